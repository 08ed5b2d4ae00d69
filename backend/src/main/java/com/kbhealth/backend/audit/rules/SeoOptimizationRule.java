package com.kbhealth.backend.audit.rules;

import com.kbhealth.backend.audit.BaseAuditRule;
import com.kbhealth.backend.audit.Issue;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import com.kbhealth.backend.scraping.CanonicalUrls;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(5)
public class SeoOptimizationRule extends BaseAuditRule {

    static final int MIN_WORDS = 300;
    static final int MAX_WORDS = 2500;
    static final double MIN_KEYWORD_DENSITY = 0.005;
    static final double MAX_KEYWORD_DENSITY = 0.03;
    static final int MIN_TITLE_LENGTH = 30;
    static final int MAX_TITLE_LENGTH = 60;

    private static final Set<String> STOP_WORDS = Set.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for", "of", "with", "by",
            "is", "are", "was", "were", "how", "what", "when", "where", "why"
    );

    public SeoOptimizationRule() {
        super("seo-optimization", "SEO Optimization Analysis",
                "Evaluates content for search engine optimization including keywords, structure and meta information",
                RuleCategory.SEO, Severity.LOW);
    }

    @Override
    public List<Issue> evaluate(Article article) {
        String content = article.getContent();
        if (content == null || content.isBlank()) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        checkLength(wordCount(content), findings);
        checkHeadings(content, findings);
        checkKeywords(content, keywords(article), findings);
        checkMeta(article, findings);
        checkImages(content, findings);
        checkInternalLinks(content, CanonicalUrls.hostOf(article.getUrl()), findings);
        return consolidate(findings, 8);
    }

    /**
     * Title words without stop words, then tags, deduplicated.
     */
    static List<String> keywords(Article article) {
        Set<String> keywords = new LinkedHashSet<>();
        if (article.getTitle() != null) {
            for (String word : article.getTitle().toLowerCase(Locale.ROOT).replaceAll("[^\\w\\s]", "").split("\\s+")) {
                if (word.length() > 2 && !STOP_WORDS.contains(word)) {
                    keywords.add(word);
                }
            }
        }
        if (article.getTags() != null) {
            article.getTags().forEach(tag -> keywords.add(tag.toLowerCase(Locale.ROOT)));
        }
        return new ArrayList<>(keywords);
    }

    private void checkLength(int wordCount, List<Finding> findings) {
        if (wordCount < MIN_WORDS) {
            findings.add(new Finding(Severity.MEDIUM, "Content too short for SEO",
                    "Content has " + wordCount + " words. SEO typically favors longer, more comprehensive content.",
                    List.of("Expand content to at least 300 words",
                            "Add more detailed explanations and examples",
                            "Include relevant background information",
                            "Add FAQ or troubleshooting sections")));
        } else if (wordCount > MAX_WORDS) {
            findings.add(new Finding(Severity.LOW, "Content may be too long",
                    "Very long content (" + wordCount + " words) may affect user engagement and SEO.",
                    List.of("Consider breaking into multiple focused articles",
                            "Use clear headings to improve scanability",
                            "Add a table of contents for navigation",
                            "Ensure content density remains high throughout")));
        }
    }

    private void checkHeadings(String content, List<Finding> findings) {
        List<Integer> levels = headerLevels(content);
        if (levels.isEmpty()) {
            findings.add(new Finding(Severity.MEDIUM, "Missing heading structure",
                    "Content lacks heading structure, which is important for SEO and readability.",
                    List.of("Add H2 and H3 headings to structure content",
                            "Use headings to break up long sections",
                            "Include target keywords in headings where appropriate",
                            "Create a logical hierarchy of information")));
            return;
        }
        if (!isProperHierarchy(levels)) {
            findings.add(new Finding(Severity.MEDIUM, "Poor heading hierarchy",
                    "Heading structure doesn't follow proper hierarchy (H1, H2, H3 and so on).",
                    List.of("Organize headings in proper hierarchy",
                            "Use H1 for main title, H2 for sections, H3 for subsections",
                            "Avoid skipping heading levels",
                            "Ensure logical content flow")));
        }
    }

    static boolean isProperHierarchy(List<Integer> levels) {
        int expected = 1;
        for (int level : levels) {
            if (level > expected + 1) {
                return false;
            }
            expected = Math.min(level + 1, 6);
        }
        return true;
    }

    private void checkKeywords(String content, List<String> keywords, List<Finding> findings) {
        List<String> words = words(content);
        if (words.isEmpty()) {
            return;
        }
        for (String keyword : keywords.stream().limit(3).toList()) {
            long occurrences = words.stream().filter(word -> word.contains(keyword)).count();
            double density = (double) occurrences / words.size();
            String percent = String.format(Locale.ROOT, "%.1f", density * 100);
            if (density < MIN_KEYWORD_DENSITY) {
                findings.add(new Finding(Severity.LOW, "Low keyword density",
                        "Keyword \"" + keyword + "\" appears only " + occurrences + " times (" + percent + "% density).",
                        List.of("Include target keywords more naturally in content",
                                "Use keywords in headings and subheadings",
                                "Add keyword variations and synonyms",
                                "Ensure keywords appear in the first paragraph")));
            } else if (density > MAX_KEYWORD_DENSITY) {
                findings.add(new Finding(Severity.MEDIUM, "Keyword over-optimization",
                        "Keyword \"" + keyword + "\" appears " + occurrences + " times (" + percent
                                + "% density), which may be excessive.",
                        List.of("Reduce keyword repetition to avoid over-optimization",
                                "Use natural language and keyword variations",
                                "Focus on content quality over keyword density",
                                "Consider using synonyms and related terms")));
            }
        }
    }

    private void checkMeta(Article article, List<Finding> findings) {
        String title = article.getTitle();
        if (title != null) {
            if (title.length() < MIN_TITLE_LENGTH) {
                findings.add(new Finding(Severity.MEDIUM, "Title too short",
                        "Title is shorter than recommended for SEO (30-60 characters).",
                        List.of("Expand title to 30-60 characters",
                                "Include primary keywords in title",
                                "Make title descriptive and compelling",
                                "Consider user search intent")));
            } else if (title.length() > MAX_TITLE_LENGTH) {
                findings.add(new Finding(Severity.MEDIUM, "Title too long",
                        "Title may be truncated in search results (over 60 characters).",
                        List.of("Shorten title to under 60 characters",
                                "Place important keywords at the beginning",
                                "Remove unnecessary words and phrases",
                                "Maintain clarity and relevance")));
            }
        }
        if (article.getSummary() == null || article.getSummary().isBlank()) {
            findings.add(new Finding(Severity.HIGH, "Missing meta description",
                    "Article lacks a summary, which search results show as its description.",
                    List.of("Add a compelling meta description (150-160 characters)",
                            "Include primary keywords naturally",
                            "Summarize the article's value proposition",
                            "Make it actionable and click-worthy")));
        }
    }

    private void checkImages(String content, List<Finding> findings) {
        int total = 0;
        int missingAlt = 0;
        Matcher matcher = MARKDOWN_IMAGE.matcher(content);
        while (matcher.find()) {
            total++;
            if (matcher.group(1).isBlank()) {
                missingAlt++;
            }
        }
        if (missingAlt > 0) {
            findings.add(new Finding(Severity.MEDIUM, "Images missing alt text",
                    "Found " + missingAlt + " of " + total + " images without proper alt text.",
                    List.of("Add descriptive alt text to all images",
                            "Include relevant keywords in alt text naturally",
                            "Describe image content for accessibility",
                            "Keep alt text concise but informative")));
        }
    }

    // Relative links and links to the article's own host count as internal
    private void checkInternalLinks(String content, String articleHost, List<Finding> findings) {
        int total = 0;
        int internal = 0;
        Matcher matcher = MARKDOWN_LINK.matcher(content);
        while (matcher.find()) {
            total++;
            String target = matcher.group(2).trim();
            if (!target.startsWith("http") || (articleHost != null && articleHost.equals(CanonicalUrls.hostOf(target)))) {
                internal++;
            }
        }
        if (total > 0 && internal == 0) {
            findings.add(new Finding(Severity.LOW, "No internal links found",
                    "Content has external links but no internal links to other articles.",
                    List.of("Add links to related articles in your knowledge base",
                            "Link to relevant documentation or guides",
                            "Use descriptive anchor text for internal links",
                            "Create content clusters through strategic linking")));
        }
    }
}
