package com.kbhealth.backend.scraping;

import com.kbhealth.backend.config.ScrapingConfig;
import com.kbhealth.backend.config.SourceDefinition;
import com.kbhealth.backend.model.enums.Platform;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Service;

/**
 * Finds category listings on a source's index page and article links on a listing page.
 * Returned URLs are canonical, deduplicated and in document order.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class UrlDiscoveryService {

    private final ScrapingConfig scrapingConfig;

    /**
     * Listing URLs of a source. An empty list means the index page itself is the only listing.
     */
    public List<String> discoverCategoryUrls(Document index, SourceDefinition definition) {
        List<String> configured = definition.getCategoryUrls();
        if (!configured.isEmpty()) {
            List<String> urls = new ArrayList<>();
            for (String url : configured) {
                String canonical = CanonicalUrls.canonicalize(url);
                if (canonical != null && !urls.contains(canonical)) {
                    urls.add(canonical);
                }
            }
            return urls;
        }

        String selector = definition.effectiveCategoryLinkSelector();
        if (selector == null) {
            return List.of();
        }

        String indexUrl = CanonicalUrls.canonicalize(index.location());
        Set<String> urls = new LinkedHashSet<>();
        for (Element link : index.select(selector)) {
            String canonical = resolve(link);
            if (canonical != null && !canonical.equals(indexUrl) && belongsToSource(canonical, definition)) {
                urls.add(canonical);
            }
        }
        log.debug("Discovered {} categories on {}", urls.size(), index.location());
        return new ArrayList<>(urls);
    }

    /**
     * Article URLs linked from a listing page.
     */
    public List<String> discoverArticleUrls(Document listing, SourceDefinition definition) {
        String listingUrl = CanonicalUrls.canonicalize(listing.location());
        boolean generic = definition.getPlatform() == Platform.GENERIC && definition.getArticleLinkSelector() == null;

        Set<String> urls = new LinkedHashSet<>();
        for (Element link : listing.select(definition.effectiveArticleLinkSelector())) {
            String canonical = resolve(link);
            if (canonical == null || canonical.equals(listingUrl) || !belongsToSource(canonical, definition)) {
                continue;
            }
            if (generic && !isLikelyArticleUrl(canonical)) {
                continue;
            }
            urls.add(canonical);
        }
        log.debug("Discovered {} article links on {}", urls.size(), listing.location());
        return new ArrayList<>(urls);
    }

    /**
     * Human-readable category of a listing: its main heading, else the last path segment.
     */
    public String categoryName(Document listing) {
        Element heading = listing.selectFirst("h1");
        if (heading != null && !heading.text().isBlank()) {
            return heading.text().trim();
        }
        String canonical = CanonicalUrls.canonicalize(listing.location());
        if (canonical == null) {
            return null;
        }
        String path = canonical.replaceFirst("https?://[^/]+", "");
        if (path.isEmpty()) {
            return null;
        }
        String segment = path.substring(path.lastIndexOf('/') + 1)
                .replaceFirst("^\\d+-", "")
                .replace('-', ' ')
                .replace('_', ' ');
        return segment.isBlank() ? null : segment.substring(0, 1).toUpperCase() + segment.substring(1);
    }

    private String resolve(Element link) {
        String href = link.attr("href").trim();
        // Skip JavaScript and other non-page schemes
        if (href.isEmpty() || href.startsWith("javascript:") || href.startsWith("mailto:")
                || href.startsWith("#") || href.startsWith("tel:")) {
            return null;
        }
        return CanonicalUrls.canonicalize(link.absUrl("href"));
    }

    private boolean belongsToSource(String url, SourceDefinition definition) {
        if (!definition.matchesUrl(url)) {
            return false;
        }

        String lowerUrl = url.toLowerCase();
        boolean excluded = scrapingConfig.getExcludedUrlPatterns().stream()
                .anyMatch(pattern -> lowerUrl.contains(pattern.toLowerCase()));
        if (excluded) {
            return false;
        }

        if (definition.getCategoriesToIgnore() != null) {
            return definition.getCategoriesToIgnore().stream()
                    .noneMatch(ignored -> lowerUrl.contains(ignored.toLowerCase()));
        }
        return true;
    }

    /**
     * Use heuristics to determine if URL is likely an article
     */
    private boolean isLikelyArticleUrl(String url) {
        String lowerUrl = url.toLowerCase();

        boolean hasDatePattern = url.matches(".*/(\\d{4})/(\\d{1,2})/(\\d{1,2})/.*");
        boolean hasArticleId = url.matches(".*/\\d{4,}(-[^/]*)?$");
        boolean hasArticleKeyword = lowerUrl.contains("/articles/") ||
                lowerUrl.contains("/article/") ||
                lowerUrl.contains("/docs/") ||
                lowerUrl.contains("/guide/") ||
                lowerUrl.contains("/kb/") ||
                lowerUrl.contains("/help/");

        // Must have reasonable length (not just domain or category)
        String path = url.replaceFirst("https?://[^/]+", "");
        boolean hasSubstantialPath = path.length() > 15;

        boolean endsWithBadPattern = lowerUrl.endsWith(".php") ||
                lowerUrl.endsWith(".xml") ||
                lowerUrl.endsWith(".jpg") ||
                lowerUrl.endsWith(".png");

        return (hasDatePattern || hasArticleId || hasArticleKeyword || hasSubstantialPath) && !endsWithBadPattern;
    }
}
