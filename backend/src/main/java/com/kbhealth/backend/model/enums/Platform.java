package com.kbhealth.backend.model.enums;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Knowledge-base platforms with their default page selectors. Selectors declared on a
 * source definition take precedence over these defaults.
 */
@Getter
@AllArgsConstructor
public enum Platform {
    GENERIC("generic", "Generic site",
            null,
            "a[href]",
            List.of("script[type='application/ld+json']", "h1", "title"),
            List.of("article", "main", ".content", "body"),
            List.of("meta[name=description]", "meta[property=og:description]")),
    INTERCOM("intercom", "Intercom help center",
            "a[href*=/collections/]",
            "a[href*=/articles/]",
            List.of("h1", ".article-title", "header h1"),
            List.of(".article-content", ".content", "[class*=article-body]", "main"),
            List.of("meta[name=description]", ".article-description")),
    ZENDESK("zendesk", "Zendesk guide",
            "a[href*=/categories/], a[href*=/sections/]",
            "a[href*=/articles/]",
            List.of("h1.article-title", "h1"),
            List.of(".article-body", "article", "main"),
            List.of("meta[name=description]"));

    private final String code;
    private final String displayName;
    private final String categoryLinkSelector;
    private final String articleLinkSelector;
    private final List<String> titleSelectors;
    private final List<String> contentSelectors;
    private final List<String> summarySelectors;

    public static Platform fromCode(String code) {
        if (code == null) {
            return GENERIC;
        }
        for (Platform platform : values()) {
            if (platform.code.equalsIgnoreCase(code.trim()) || platform.name().equalsIgnoreCase(code.trim())) {
                return platform;
            }
        }
        throw new IllegalArgumentException("Code " + code + " is not a valid Platform");
    }
}
