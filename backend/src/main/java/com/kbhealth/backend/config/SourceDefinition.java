package com.kbhealth.backend.config;

import com.kbhealth.backend.model.entity.DataSource;
import com.kbhealth.backend.model.enums.Platform;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;

/**
 * Declared shape of a knowledge-base source, loaded from {@code data-sources.yml}.
 * <p>
 * Selector lists are tried in priority order (high to low). Any list left empty falls back
 * to the defaults of the source's {@link Platform}.
 */
@Data
public class SourceDefinition {
    private String id;
    private String name;
    private Platform platform = Platform.GENERIC;
    private String baseUrl;
    private boolean enabled = true;

    // Listing discovery
    private String categoryLinkSelector;
    private String articleLinkSelector;
    private List<String> categories;              // Explicit listing paths, skip discovery when set
    private List<String> categoriesToIgnore;      // Listing or article paths to skip

    // Article extraction, CSS selectors in priority order
    private List<String> titleSelectors;
    private List<String> contentSelectors;
    private List<String> contentIgnoreSelectors;  // Elements to remove from content
    private List<String> summarySelectors;
    private List<String> authorSelectors;
    private List<String> modifiedTimeSelectors;
    private List<String> categorySelectors;
    private List<String> keywordSelectors;

    private Integer maxArticlesPerCategory;
    private Integer syncTimeoutSeconds;

    /**
     * Definition carrying only platform defaults, for sources registered without one.
     */
    public static SourceDefinition fromDataSource(DataSource source) {
        SourceDefinition definition = new SourceDefinition();
        definition.setId(source.getId());
        definition.setName(source.getName());
        definition.setPlatform(source.getPlatform() != null ? source.getPlatform() : Platform.GENERIC);
        definition.setBaseUrl(source.getBaseUrl());
        definition.setEnabled(source.isEnabled());
        definition.setMaxArticlesPerCategory(source.getMaxArticlesPerCategory());
        definition.setSyncTimeoutSeconds(source.getSyncTimeoutSeconds());
        return definition;
    }

    public DataSource toDataSource() {
        return DataSource.builder()
                .id(id)
                .name(name != null ? name : id)
                .platform(platform)
                .baseUrl(baseUrl)
                .enabled(enabled)
                .maxArticlesPerCategory(maxArticlesPerCategory)
                .syncTimeoutSeconds(syncTimeoutSeconds)
                .build();
    }

    /**
     * Get the host name from the base URL
     */
    public String getDomain() {
        if (baseUrl == null) return null;
        return baseUrl.replaceAll("https?://", "").replaceAll("[/:].*", "").toLowerCase();
    }

    /**
     * Check if a URL belongs to this source's host
     */
    public boolean matchesUrl(String url) {
        if (url == null || getDomain() == null) return false;
        String host = url.replaceAll("https?://", "").replaceAll("[/:?#].*", "").toLowerCase();
        return host.equals(getDomain()) || host.endsWith("." + getDomain());
    }

    /**
     * Absolute listing URLs for the explicitly configured categories
     */
    public List<String> getCategoryUrls() {
        if (categories == null) return List.of();
        List<String> urls = new ArrayList<>();
        for (String category : categories) {
            if (category.startsWith("http://") || category.startsWith("https://")) {
                urls.add(category);
            } else if (baseUrl.endsWith("/") && category.startsWith("/")) {
                urls.add(baseUrl + category.substring(1));
            } else if (!baseUrl.endsWith("/") && !category.startsWith("/")) {
                urls.add(baseUrl + "/" + category);
            } else {
                urls.add(baseUrl + category);
            }
        }
        return urls;
    }

    public String effectiveCategoryLinkSelector() {
        return categoryLinkSelector != null ? categoryLinkSelector : platform.getCategoryLinkSelector();
    }

    public String effectiveArticleLinkSelector() {
        return articleLinkSelector != null ? articleLinkSelector : platform.getArticleLinkSelector();
    }

    public List<String> effectiveTitleSelectors() {
        return orDefault(titleSelectors, platform.getTitleSelectors());
    }

    public List<String> effectiveContentSelectors() {
        return orDefault(contentSelectors, platform.getContentSelectors());
    }

    public List<String> effectiveSummarySelectors() {
        return orDefault(summarySelectors, platform.getSummarySelectors());
    }

    public List<String> effectiveAuthorSelectors() {
        return orDefault(authorSelectors, List.of("script[type='application/ld+json']",
                "meta[name=author]", ".author", "[rel=author]"));
    }

    public List<String> effectiveModifiedTimeSelectors() {
        return orDefault(modifiedTimeSelectors, List.of("meta[property=article:modified_time]",
                "script[type='application/ld+json']", "time[datetime]"));
    }

    public List<String> effectiveCategorySelectors() {
        return orDefault(categorySelectors, List.of("meta[property=article:section]", ".breadcrumb a:last-of-type"));
    }

    public List<String> effectiveKeywordSelectors() {
        return orDefault(keywordSelectors, List.of("meta[name=keywords]", "script[type='application/ld+json']"));
    }

    private static List<String> orDefault(List<String> configured, List<String> fallback) {
        return configured != null && !configured.isEmpty() ? configured : fallback;
    }
}
