package com.kbhealth.backend.audit.rules;

import com.kbhealth.backend.audit.BaseAuditRule;
import com.kbhealth.backend.audit.Issue;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Flags stale articles: old modification dates, pinned version numbers, time-relative wording
 * and references to retired technology.
 */
@Component
@Order(1)
public class OutdatedContentRule extends BaseAuditRule {

    static final int MAX_AGE_MONTHS = 12;
    static final int CRITICAL_AGE_MONTHS = 18;

    private static final List<Pattern> VERSION_PATTERNS = List.of(
            Pattern.compile("version\\s+(\\d+\\.?\\d*\\.?\\d*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bv(\\d+\\.?\\d*\\.?\\d*)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("(\\d+\\.?\\d*\\.?\\d*)\\s+(update|release)", Pattern.CASE_INSENSITIVE)
    );

    private static final List<String> TEMPORAL_KEYWORDS = List.of(
            "last year", "this year", "currently", "at the moment",
            "recently", "soon", "upcoming", "latest version",
            "new feature", "beta", "coming soon"
    );

    private static final List<String> OUTDATED_TECHNOLOGY = List.of(
            "internet explorer", "ie6", "ie7", "ie8", "ie9",
            "flash player", "adobe flash", "silverlight",
            "windows xp", "windows vista", "windows 7",
            "jquery 1.", "angular 1.", "angularjs",
            "php 5.", "python 2.", "node 0.", "node 6.",
            "http://"
    );

    private final Clock clock;

    public OutdatedContentRule(Clock clock) {
        super("outdated-content", "Outdated Content Detection",
                "Identifies articles that may contain outdated information based on age, version references and temporal language",
                RuleCategory.FRESHNESS, Severity.HIGH);
        this.clock = clock;
    }

    @Override
    public List<Issue> evaluate(Article article) {
        List<Finding> findings = new ArrayList<>();
        checkAge(article.getLastModifiedAt(), findings);

        String content = article.getContent();
        if (content != null) {
            checkVersionReferences(content, findings);
            checkTemporalLanguage(content.toLowerCase(), findings);
            checkOutdatedTechnology(content.toLowerCase(), findings);
        }
        return consolidate(findings, 6);
    }

    private void checkAge(LocalDateTime lastModifiedAt, List<Finding> findings) {
        if (lastModifiedAt == null) {
            return;
        }
        long ageDays = Duration.between(lastModifiedAt, LocalDateTime.now(clock)).toDays();
        long ageMonths = Math.round(ageDays / 30.0);
        if (ageDays > CRITICAL_AGE_MONTHS * 30L) {
            findings.add(new Finding(Severity.CRITICAL, "Critically outdated content",
                    "This article hasn't been updated in " + ageMonths
                            + " months and may contain significantly outdated information.",
                    List.of("Review and update the content immediately",
                            "Verify all information is still accurate",
                            "Update any changed procedures or features",
                            "Consider archiving if no longer relevant")));
        } else if (ageDays > MAX_AGE_MONTHS * 30L) {
            findings.add(new Finding(Severity.HIGH, "Potentially outdated content",
                    "This article is " + ageMonths + " months old and should be reviewed for accuracy.",
                    List.of("Review content for accuracy",
                            "Update any changed information",
                            "Refresh examples and screenshots",
                            "Update the \"last reviewed\" date")));
        }
    }

    private void checkVersionReferences(String content, List<Finding> findings) {
        for (Pattern pattern : VERSION_PATTERNS) {
            List<String> versions = new ArrayList<>();
            Matcher matcher = pattern.matcher(content);
            while (matcher.find() && versions.size() < 3) {
                versions.add(matcher.group());
            }
            if (!versions.isEmpty()) {
                findings.add(new Finding(Severity.MEDIUM, "Version references detected",
                        "Content contains specific version numbers that may become outdated: "
                                + String.join(", ", versions) + ".",
                        List.of("Review version references for accuracy",
                                "Consider using \"latest version\" instead of specific numbers",
                                "Update version numbers if they're outdated",
                                "Add a note about when version info was last checked")));
                return;
            }
        }
    }

    private void checkTemporalLanguage(String lowerContent, List<Finding> findings) {
        List<String> found = TEMPORAL_KEYWORDS.stream().filter(lowerContent::contains).limit(5).toList();
        if (!found.isEmpty()) {
            findings.add(new Finding(Severity.MEDIUM, "Temporal language detected",
                    "Content uses time-sensitive language that may become inaccurate: "
                            + String.join(", ", found) + ".",
                    List.of("Replace temporal language with specific dates",
                            "Use evergreen language where possible",
                            "Add specific update dates for time-sensitive information",
                            "Review and update temporal references regularly")));
        }
    }

    private void checkOutdatedTechnology(String lowerContent, List<Finding> findings) {
        List<String> found = OUTDATED_TECHNOLOGY.stream().filter(lowerContent::contains).limit(3).toList();
        if (!found.isEmpty()) {
            findings.add(new Finding(Severity.HIGH, "Outdated technology references",
                    "Content references potentially outdated technologies or versions: "
                            + String.join(", ", found) + ".",
                    List.of("Update technology references to current versions",
                            "Remove references to deprecated technologies",
                            "Verify all technical information is current",
                            "Consider adding browser/system requirements")));
        }
    }
}
