package com.kbhealth.backend.audit.rules;

import com.kbhealth.backend.audit.BaseAuditRule;
import com.kbhealth.backend.audit.Issue;
import com.kbhealth.backend.audit.IssueLocation;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.Value;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Statically inspects the links of an article for URLs that are likely broken or should not
 * be published. No link is requested over the network.
 */
@Component
@Order(2)
public class BrokenLinksRule extends BaseAuditRule {

    private static final Pattern HTML_LINK = Pattern.compile(
            "<a\\s+(?:[^>]*?\\s+)?href=([\"'])(.*?)\\1[^>]*>(.*?)</a>", Pattern.CASE_INSENSITIVE);

    private static final List<String> SUSPICIOUS_HOSTS = List.of(
            "localhost", "127.0.0.1", "192.168.", "10.0.0.",
            "staging.", "test.", "dev.", "demo."
    );

    private static final List<String> DEPRECATED_HOSTS = List.of("example.com", "test.com", "localhost.com");

    static final Set<String> POOR_LINK_TEXT = Set.of("here", "click here", "link", "this", "read more");

    private static final int MAX_URL_LENGTH = 2000;

    public BrokenLinksRule() {
        super("broken-links", "Broken Links Detection",
                "Identifies potentially broken links, malformed URLs and link-related issues",
                RuleCategory.TECHNICAL, Severity.HIGH);
    }

    @Override
    public List<Issue> evaluate(Article article) {
        String content = article.getContent();
        if (content == null) {
            return List.of();
        }
        List<Link> links = extractLinks(content);
        if (links.isEmpty()) {
            return List.of();
        }

        List<Finding> findings = new ArrayList<>();
        checkUrls(content, links, findings);
        checkFormatting(links, findings);
        checkDuplicates(links, findings);
        return consolidate(findings, 6);
    }

    List<Link> extractLinks(String content) {
        List<Link> links = new ArrayList<>();
        Matcher markdown = MARKDOWN_LINK.matcher(content);
        while (markdown.find()) {
            links.add(new Link(LinkType.MARKDOWN, markdown.group(1), markdown.group(2).trim(),
                    markdown.start(), markdown.end()));
        }
        Matcher html = HTML_LINK.matcher(content);
        while (html.find()) {
            links.add(new Link(LinkType.HTML, html.group(3), html.group(2).trim(), html.start(), html.end()));
        }

        List<int[]> covered = new ArrayList<>();
        links.forEach(link -> covered.add(new int[]{link.getStart(), link.getEnd()}));
        Matcher image = MARKDOWN_IMAGE.matcher(content);
        while (image.find()) {
            covered.add(new int[]{image.start(), image.end()});
        }

        Matcher raw = RAW_URL.matcher(content);
        while (raw.find()) {
            int start = raw.start();
            boolean insideLink = covered.stream().anyMatch(span -> start >= span[0] && start < span[1]);
            if (!insideLink) {
                links.add(new Link(LinkType.RAW, raw.group(), raw.group(), raw.start(), raw.end()));
            }
        }
        links.sort((a, b) -> Integer.compare(a.getStart(), b.getStart()));
        return links;
    }

    List<String> analyzeUrl(String url) {
        List<String> problems = new ArrayList<>();
        String lowerUrl = url.toLowerCase();
        if (lowerUrl.startsWith("mailto:") || lowerUrl.startsWith("tel:")) {
            return problems;
        }
        boolean relative = url.startsWith("/") || url.startsWith("#") || url.startsWith(".");

        if (url.contains(" ")) {
            problems.add("Contains unencoded spaces");
        }
        if (url.length() > MAX_URL_LENGTH) {
            problems.add("URL is extremely long");
        }

        URI uri;
        try {
            uri = new URI(url.replace(" ", "%20"));
        } catch (URISyntaxException e) {
            problems.add("Malformed URL structure");
            return problems;
        }

        String path = uri.getRawPath();
        if (path != null && path.contains("//")) {
            problems.add("Contains double slashes in path");
        }
        if (relative) {
            return problems;
        }

        String scheme = uri.getScheme();
        if (scheme == null || (!scheme.equalsIgnoreCase("http") && !scheme.equalsIgnoreCase("https"))) {
            problems.add("Unsupported protocol: " + (scheme == null ? "none" : scheme + ":"));
            return problems;
        }
        String host = uri.getHost();
        if (host == null || host.isEmpty()) {
            problems.add("Empty hostname");
            return problems;
        }
        host = host.toLowerCase();

        for (String suspicious : SUSPICIOUS_HOSTS) {
            boolean matches = suspicious.endsWith(".")
                    ? host.startsWith(suspicious) || host.contains("." + suspicious)
                    : host.equals(suspicious) || host.endsWith("." + suspicious);
            if (matches) {
                problems.add("Contains suspicious domain: " + suspicious);
            }
        }
        for (String deprecated : DEPRECATED_HOSTS) {
            if (host.equals(deprecated) || host.endsWith("." + deprecated)) {
                problems.add("Uses deprecated domain: " + deprecated);
            }
        }
        if (scheme.equalsIgnoreCase("http") && !host.equals("localhost")) {
            problems.add("Uses insecure HTTP protocol");
        }
        return problems;
    }

    private void checkUrls(String content, List<Link> links, List<Finding> findings) {
        Link first = null;
        List<String> firstProblems = List.of();
        int problematic = 0;
        for (Link link : links) {
            List<String> problems = analyzeUrl(link.getUrl());
            if (!problems.isEmpty()) {
                problematic++;
                if (first == null) {
                    first = link;
                    firstProblems = problems;
                }
            }
        }
        if (first != null) {
            findings.add(new Finding(Severity.HIGH, "Problematic URLs detected",
                    "Found " + problematic + " links that may be broken or problematic. First: "
                            + first.getUrl() + " (" + String.join(", ", firstProblems) + ").",
                    List.of("Review and update problematic URLs",
                            "Test all external links for accessibility",
                            "Replace development/staging URLs with production URLs",
                            "Remove or fix malformed URLs",
                            "Consider using relative paths for internal links"),
                    IssueLocation.of(content, first.getStart())));
        }
    }

    private void checkFormatting(List<Link> links, List<Finding> findings) {
        long rawCount = links.stream().filter(link -> link.getType() == LinkType.RAW).count();
        if (rawCount > 0) {
            findings.add(new Finding(Severity.MEDIUM, "Unformatted URLs",
                    "Found " + rawCount + " raw URLs that should be formatted as proper links.",
                    List.of("Convert raw URLs to markdown links with descriptive text",
                            "Use meaningful link text instead of displaying URLs",
                            "Follow accessibility guidelines for link text",
                            "Consider shortening very long URLs")));
        }

        long poorText = links.stream()
                .filter(link -> link.getType() == LinkType.MARKDOWN)
                .filter(link -> isPoorLinkText(link.getText(), link.getUrl()))
                .count();
        if (poorText > 0) {
            findings.add(new Finding(Severity.MEDIUM, "Poor link text",
                    "Found " + poorText + " links with non-descriptive text.",
                    List.of("Use descriptive text that indicates link destination",
                            "Avoid generic phrases like \"click here\" or \"read more\"",
                            "Make link text meaningful out of context",
                            "Follow accessibility best practices for link text")));
        }
    }

    private void checkDuplicates(List<Link> links, List<Finding> findings) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (Link link : links) {
            counts.merge(link.getUrl().toLowerCase(), 1, Integer::sum);
        }
        long duplicates = counts.values().stream().filter(count -> count > 1).count();
        if (duplicates > 0) {
            findings.add(new Finding(Severity.LOW, "Duplicate links detected",
                    "Found " + duplicates + " URLs that appear multiple times in the content.",
                    List.of("Review duplicate links for necessity",
                            "Consider consolidating repetitive links",
                            "Use internal references instead of repeating URLs",
                            "Ensure duplicate links serve different purposes")));
        }
    }

    static boolean isPoorLinkText(String text, String url) {
        String normalized = text.toLowerCase().trim();
        return POOR_LINK_TEXT.contains(normalized) || normalized.equals(url.toLowerCase()) || normalized.length() < 3;
    }

    enum LinkType {
        MARKDOWN, HTML, RAW
    }

    @Value
    static class Link {
        LinkType type;
        String text;
        String url;
        int start;
        int end;
    }
}
