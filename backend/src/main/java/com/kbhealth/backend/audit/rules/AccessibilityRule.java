package com.kbhealth.backend.audit.rules;

import com.kbhealth.backend.audit.BaseAuditRule;
import com.kbhealth.backend.audit.Issue;
import com.kbhealth.backend.audit.IssueLocation;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Reports each image without alt text and each link whose text does not describe its target,
 * with the position of the offending markdown.
 */
@Component
@Order(6)
public class AccessibilityRule extends BaseAuditRule {

    public AccessibilityRule() {
        super("accessibility", "Accessibility Check",
                "Flags images without alternative text and links with non-descriptive text",
                RuleCategory.ACCESSIBILITY, Severity.LOW);
    }

    @Override
    public List<Issue> evaluate(Article article) {
        String content = article.getContent();
        if (content == null || content.isEmpty()) {
            return List.of();
        }

        // Issues are emitted in document order
        List<Positioned> found = new ArrayList<>();
        Matcher images = MARKDOWN_IMAGE.matcher(content);
        while (images.find()) {
            if (images.group(1).isBlank()) {
                found.add(new Positioned(images.start(), issue("Image missing alt text",
                        "Image " + images.group(2).trim() + " has no alternative text for screen readers.",
                        "Describe the image content in its alt text",
                        IssueLocation.of(content, images.start()))));
            }
        }
        Matcher links = MARKDOWN_LINK.matcher(content);
        while (links.find()) {
            String text = links.group(1);
            String url = links.group(2).trim();
            if (BrokenLinksRule.isPoorLinkText(text, url)) {
                found.add(new Positioned(links.start(), issue("Non-descriptive link text",
                        "Link text \"" + text.trim() + "\" does not describe its destination " + url + ".",
                        "Use link text that makes sense out of context",
                        IssueLocation.of(content, links.start()))));
            }
        }
        found.sort((a, b) -> Integer.compare(a.offset, b.offset));
        return found.stream().map(positioned -> positioned.issue).toList();
    }

    private static final class Positioned {
        private final int offset;
        private final Issue issue;

        private Positioned(int offset, Issue issue) {
            this.offset = offset;
            this.issue = issue;
        }
    }
}
