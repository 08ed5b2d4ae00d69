package com.kbhealth.backend.scraping;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbhealth.backend.config.ScrapingConfig;
import com.kbhealth.backend.config.SourceDefinition;
import com.kbhealth.backend.exception.PageFetchException;
import com.kbhealth.backend.model.dto.ArticleDTO;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Service;

/**
 * Turns a fetched article page into an {@link ArticleDTO} using the source's priority
 * selectors, with JSON-LD structured data as an alternative selector.
 */
@Service
@Slf4j
public class ArticleExtractorService {

    private static final String JSON_LD = "script[type='application/ld+json']";

    private static final List<DateTimeFormatter> LOCAL_DATE_FORMATTERS = Arrays.asList(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("dd/MM/yyyy HH:mm:ss"),
            DateTimeFormatter.ofPattern("MM/dd/yyyy HH:mm:ss")
    );

    private final ObjectMapper objectMapper;
    private final Set<String> allowedJsonLdTypesLowercase;

    public ArticleExtractorService(ScrapingConfig scrapingConfig, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.allowedJsonLdTypesLowercase = scrapingConfig.getAllowedJsonLdTypes() != null
                ? scrapingConfig.getAllowedJsonLdTypes().stream()
                .map(String::toLowerCase)
                .collect(Collectors.toSet())
                : Set.of();
    }

    /**
     * @param fallbackCategory category of the listing the article was discovered on
     * @throws PageFetchException (permanent) when no title or body can be extracted
     */
    public ArticleDTO extract(FetchedPage page, SourceDefinition definition, String fallbackCategory) {
        Document doc = page.getDocument();
        String url = page.getRequestedUrl();

        ArticleDTO article = new ArticleDTO();
        article.setUrl(url);
        article.setTitle(extractText(doc, definition.effectiveTitleSelectors(), "title"));
        article.setContent(extractContent(doc, definition.effectiveContentSelectors(), definition.getContentIgnoreSelectors()));
        article.setSummary(extractText(doc, definition.effectiveSummarySelectors(), "summary"));
        article.setAuthor(extractText(doc, definition.effectiveAuthorSelectors(), "author"));
        article.setLastModifiedAt(parseDateTime(extractText(doc, definition.effectiveModifiedTimeSelectors(), "modifiedTime")));

        String category = extractText(doc, definition.effectiveCategorySelectors(), "category");
        article.setCategory(category != null ? category : fallbackCategory);
        article.setTags(splitKeywords(extractText(doc, definition.effectiveKeywordSelectors(), "keywords")));

        log.debug("Extracted data for {}: title={}, author={}, modified={}, content_length={}",
                url,
                article.getTitle() != null ? article.getTitle().substring(0, Math.min(50, article.getTitle().length())) : "null",
                article.getAuthor(),
                article.getLastModifiedAt(),
                article.getContent() != null ? article.getContent().length() : 0);

        if (!isValidArticle(article)) {
            throw PageFetchException.permanent(url, "No article title or body found at " + url, null);
        }
        return article;
    }

    /**
     * Extract text using priority-based selectors, including JSON-LD support
     */
    private String extractText(Document doc, List<String> selectors, String fieldType) {
        if (selectors == null || selectors.isEmpty()) {
            return null;
        }

        for (String selector : selectors) {
            try {
                if (selector.contains(JSON_LD)) {
                    String jsonLdResult = extractFromJsonLd(doc, fieldType);
                    if (jsonLdResult != null && !jsonLdResult.trim().isEmpty()) {
                        return jsonLdResult.trim();
                    }
                } else {
                    Elements elements = doc.select(selector);
                    if (!elements.isEmpty()) {
                        Element el = elements.first();
                        // Prefer machine-readable attributes for dates and metas
                        if ("modifiedTime".equals(fieldType)) {
                            String attr = el.hasAttr("datetime") ? el.attr("datetime") :
                                    (el.hasAttr("content") ? el.attr("content") : null);
                            if (attr != null && !attr.trim().isEmpty()) return attr.trim();
                        }

                        if (el.hasAttr("content")) {
                            String content = el.attr("content");
                            if (!content.trim().isEmpty()) return content.trim();
                        }

                        String result = el.text();
                        if (!result.trim().isEmpty()) {
                            return result.trim();
                        }
                    }
                }
            } catch (RuntimeException e) {
                log.debug("Error with selector '{}' for field '{}': {}", selector, fieldType, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Extract the article body as markdown, removing ignored elements first
     */
    private String extractContent(Document doc, List<String> contentSelectors, List<String> ignoreSelectors) {
        for (String selector : contentSelectors) {
            try {
                if (selector.contains(JSON_LD)) {
                    String body = extractFromJsonLd(doc, "content");
                    if (body != null && !body.trim().isEmpty()) {
                        return HtmlToMarkdown.convert(Jsoup.parseBodyFragment(body, doc.location()).body());
                    }
                    continue;
                }

                Element element = doc.selectFirst(selector);
                if (element == null) {
                    continue;
                }
                Element body = element.clone();
                if (ignoreSelectors != null) {
                    for (String ignoreSelector : ignoreSelectors) {
                        body.select(ignoreSelector).remove();
                    }
                }
                String markdown = HtmlToMarkdown.convert(body);
                if (!markdown.isEmpty()) {
                    return markdown;
                }
            } catch (RuntimeException e) {
                log.debug("Error with content selector '{}': {}", selector, e.getMessage());
            }
        }
        return null;
    }

    /**
     * Extract data from JSON-LD structured data
     */
    private String extractFromJsonLd(Document doc, String fieldType) {
        for (Element script : doc.select(JSON_LD)) {
            String jsonContent = script.html();
            if (jsonContent == null || jsonContent.trim().isEmpty()) continue;
            try {
                JsonNode jsonNode = objectMapper.readTree(jsonContent);
                if (jsonNode.has("@graph")) {
                    jsonNode = jsonNode.get("@graph");
                }

                if (jsonNode.isArray()) {
                    for (JsonNode node : jsonNode) {
                        String result = extractFieldFromJsonNode(node, fieldType);
                        if (result != null) return result;
                    }
                } else {
                    String result = extractFieldFromJsonNode(jsonNode, fieldType);
                    if (result != null) return result;
                }
            } catch (Exception e) {
                log.debug("Error parsing JSON-LD: {}", e.getMessage());
            }
        }
        return null;
    }

    /**
     * Extract specific field from JSON-LD node
     */
    private String extractFieldFromJsonNode(JsonNode node, String fieldType) {
        // Only process allowed @type values, which skips BreadcrumbList and friends
        JsonNode typeNode = node.get("@type");
        if (typeNode == null || !allowedJsonLdTypesLowercase.contains(typeNode.asText().toLowerCase())) {
            return null;
        }

        switch (fieldType) {
            case "title":
                return getJsonValue(node, "headline", "name");
            case "author":
                return extractAuthor(node);
            case "modifiedTime":
                return getJsonValue(node, "dateModified", "datePublished");
            case "summary":
                return getJsonValue(node, "description", "abstract");
            case "content":
                return getJsonValue(node, "articleBody", "text");
            case "category":
                return getJsonValue(node, "articleSection", "about");
            case "keywords":
                JsonNode keywords = node.get("keywords");
                if (keywords != null && keywords.isArray()) {
                    StringBuilder joined = new StringBuilder();
                    keywords.forEach(k -> joined.append(joined.length() > 0 ? "," : "").append(k.asText()));
                    return joined.toString();
                }
                return getJsonValue(node, "keywords");
            default:
                return null;
        }
    }

    private String extractAuthor(JsonNode node) {
        JsonNode authorNode = node.get("author");
        if (authorNode != null) {
            if (authorNode.isArray() && !authorNode.isEmpty()) {
                return getJsonValue(authorNode.get(0), "name", "givenName");
            } else if (authorNode.isObject()) {
                return getJsonValue(authorNode, "name", "givenName");
            } else {
                return authorNode.asText();
            }
        }
        return null;
    }

    private String getJsonValue(JsonNode node, String... fields) {
        for (String field : fields) {
            JsonNode fieldNode = node.get(field);
            if (fieldNode != null && !fieldNode.isNull() && fieldNode.isValueNode()) {
                return fieldNode.asText();
            }
        }
        return null;
    }

    private Set<String> splitKeywords(String keywords) {
        Set<String> tags = new LinkedHashSet<>();
        if (keywords == null) {
            return tags;
        }
        for (String keyword : keywords.split("[,;]")) {
            String tag = keyword.trim().toLowerCase();
            if (!tag.isEmpty()) {
                tags.add(tag);
            }
        }
        return tags;
    }

    /**
     * Parses the timestamp formats seen in meta tags and JSON-LD, normalized to UTC.
     */
    LocalDateTime parseDateTime(String value) {
        if (value == null || value.trim().isEmpty()) {
            return null;
        }
        String cleaned = value.trim();

        try {
            return OffsetDateTime.parse(cleaned).atZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.trace("Not an offset timestamp: {}", cleaned);
        }
        try {
            return ZonedDateTime.parse(cleaned).withZoneSameInstant(ZoneOffset.UTC).toLocalDateTime();
        } catch (DateTimeParseException e) {
            log.trace("Not a zoned timestamp: {}", cleaned);
        }
        for (DateTimeFormatter formatter : LOCAL_DATE_FORMATTERS) {
            try {
                return LocalDateTime.parse(cleaned, formatter);
            } catch (DateTimeParseException e) {
                log.trace("Timestamp {} does not match {}", cleaned, formatter);
            }
        }
        try {
            return LocalDate.parse(cleaned.length() >= 10 ? cleaned.substring(0, 10) : cleaned).atStartOfDay();
        } catch (DateTimeParseException e) {
            log.debug("Could not parse timestamp: {}", cleaned);
            return null;
        }
    }

    /**
     * Validate that extracted article has required fields
     */
    private boolean isValidArticle(ArticleDTO article) {
        return article.getTitle() != null && article.getTitle().length() >= 3 &&
                article.getContent() != null && !article.getContent().isBlank() &&
                article.getUrl() != null && article.getUrl().startsWith("http");
    }
}
