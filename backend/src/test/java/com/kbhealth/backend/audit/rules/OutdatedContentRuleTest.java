package com.kbhealth.backend.audit.rules;

import com.kbhealth.backend.audit.Issue;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import com.kbhealth.backend.support.TestArticles;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OutdatedContentRuleTest {

    private final OutdatedContentRule rule =
            new OutdatedContentRule(Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneOffset.UTC));

    @Test
    @DisplayName("Recently updated article with evergreen wording passes")
    void freshArticlePasses() {
        // given
        Article article = TestArticles.withContent("Store owners open the settings page to choose a payment option.");

        // when / then
        assertThat(rule.evaluate(article)).isEmpty();
    }

    @Test
    @DisplayName("Article untouched for over eighteen months is critically outdated")
    void criticallyOld() {
        // given
        Article article = TestArticles.withContent("Store owners open the settings page.").toBuilder()
                .lastModifiedAt(LocalDateTime.of(2024, 1, 1, 0, 0))
                .build();

        // when
        List<Issue> issues = rule.evaluate(article);

        // then
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getTitle()).isEqualTo("Critically outdated content");
            assertThat(issue.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(issue.getCategory()).isEqualTo(RuleCategory.FRESHNESS);
            assertThat(issue.getRuleId()).isEqualTo("outdated-content");
        });
    }

    @Test
    @DisplayName("Age and version findings fold into one issue led by the age finding")
    void consolidatesFindings() {
        // given
        Article article = TestArticles.withContent("Requires version 2.1 of the app.").toBuilder()
                .lastModifiedAt(LocalDateTime.of(2025, 8, 27, 0, 0))
                .build();

        // when
        List<Issue> issues = rule.evaluate(article);

        // then
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getTitle()).isEqualTo("Potentially outdated content");
            assertThat(issue.getDescription()).endsWith("(1 related finding)");
            assertThat(issue.getSuggestion()).contains("Review content for accuracy", "Review version references for accuracy");
        });
    }

    @Test
    @DisplayName("Time-relative wording is reported")
    void temporalLanguage() {
        // given
        Article article = TestArticles.withContent("The loyalty module is currently in beta.");

        // when
        List<Issue> issues = rule.evaluate(article);

        // then
        assertThat(issues).singleElement().satisfies(issue -> {
            assertThat(issue.getTitle()).isEqualTo("Temporal language detected");
            assertThat(issue.getDescription()).contains("currently", "beta");
        });
    }

    @Test
    @DisplayName("Insecure links count as outdated technology")
    void outdatedTechnology() {
        // given
        Article article = TestArticles.withContent("Visit http://acme.io for details.");

        // when
        List<Issue> issues = rule.evaluate(article);

        // then
        assertThat(issues).singleElement()
                .extracting(Issue::getTitle)
                .isEqualTo("Outdated technology references");
    }

    @Test
    @DisplayName("Missing modification date skips the age check")
    void noDate() {
        // given
        Article article = TestArticles.withContent("Store owners open the settings page.").toBuilder()
                .lastModifiedAt(null)
                .build();

        // when / then
        assertThat(rule.evaluate(article)).isEmpty();
    }
}
