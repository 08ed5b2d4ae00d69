package com.kbhealth.backend.config;

import jakarta.validation.constraints.Min;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "scraping")
@Validated
@Data
public class ScrapingConfig {

    // Width of the article fetch worker pool
    @Min(1)
    private int workers = 4;

    // Outstanding requests allowed against one host at any instant
    @Min(1)
    private int maxConcurrentPerHost = 2;

    // Minimum spacing between two requests to the same host, 0 disables it
    @Min(0)
    private long politeDelayMs = 0;

    @Min(1)
    private int timeoutMs = 30_000;

    // Retries after the first attempt, transient failures only
    @Min(0)
    private int maxRetries = 3;

    @Min(0)
    private long backoffBaseMs = 500;

    @Min(0)
    private long backoffMaxMs = 8_000;

    // Default headers for HTTP requests
    private Map<String, String> defaultHeaders = Map.of(
            "User-Agent", "Mozilla/5.0 (compatible; KbHealthBot/1.0; +https://kbhealth.dev/bot)",
            "Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8",
            "Accept-Language", "en-US,en;q=0.5"
    );

    // URL patterns never followed as article links
    private List<String> excludedUrlPatterns = Arrays.asList(
            "javascript:", "mailto:", "tel:",
            "facebook.com", "twitter.com", "youtube.com", "linkedin.com",
            "/search", "/login", "/signin", "/signup",
            "/share", "/print", ".pdf"
    );

    // JSON-LD @type values accepted as article metadata
    private List<String> allowedJsonLdTypes = Arrays.asList(
            "Article", "TechArticle", "NewsArticle", "BlogPosting", "HowTo", "FAQPage", "WebPage"
    );
}
