package com.kbhealth.backend.audit;

import com.kbhealth.backend.config.AuditConfig;
import com.kbhealth.backend.exception.NotFoundException;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.entity.AuditFinding;
import com.kbhealth.backend.model.entity.AuditRun;
import com.kbhealth.backend.model.enums.AuditRunStatus;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import com.kbhealth.backend.support.FixedRule;
import com.kbhealth.backend.support.InMemoryArticleStore;
import com.kbhealth.backend.support.InMemoryAuditHistoryStore;
import com.kbhealth.backend.support.TestArticles;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.task.SimpleAsyncTaskExecutor;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AuditEngineTest {

    private static final Instant NOW = Instant.parse("2026-10-01T08:00:00Z");

    private InMemoryArticleStore articleStore;
    private InMemoryAuditHistoryStore historyStore;
    private AuditConfig auditConfig;
    private Clock clock;

    @BeforeEach
    void setUp() {
        articleStore = new InMemoryArticleStore();
        historyStore = new InMemoryAuditHistoryStore();
        auditConfig = new AuditConfig();
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        articleStore.upsert(TestArticles.withContent("Body of the article."));
    }

    @Test
    @DisplayName("One medium and one low issue score 80")
    void scoresIssues() {
        // given
        AuditEngine engine = engine(
                FixedRule.reporting("content-quality", RuleCategory.CONTENT_QUALITY, Severity.MEDIUM, 1),
                FixedRule.reporting("freshness", RuleCategory.FRESHNESS, Severity.LOW, 1));

        // when
        AuditResult result = engine.audit("kb-1");

        // then
        assertThat(result.getComputedHealthScore()).isEqualTo(80);
        assertThat(result.getRulesExecuted()).isEqualTo(2);
        assertThat(result.getIssues()).extracting(Issue::getRuleId).containsExactly("content-quality", "freshness");
        assertThat(result.getPerRuleOutcome()).containsOnlyKeys("content-quality", "freshness");
        assertThat(result.getPerRuleOutcome().get("freshness").isPassed()).isFalse();
        assertThat(result.getAuditedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Score and audit time are written back to the article")
    void persistsScore() {
        // given
        AuditEngine engine = engine(FixedRule.reporting("seo", RuleCategory.SEO, Severity.HIGH, 1));

        // when
        engine.audit("kb-1");

        // then
        Article stored = articleStore.get("kb-1").orElseThrow();
        assertThat(stored.getContentHealthScore()).isEqualTo(70);
        assertThat(stored.getLastAuditedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(stored.getContent()).isEqualTo("Body of the article.");
    }

    @Test
    @DisplayName("Content synced while rules run survives the score write-back")
    void scoreWriteKeepsConcurrentSync() {
        // given
        AuditEngine engine = engine(FixedRule.behaving("sync-during-audit", article -> {
            articleStore.upsert(article.toBuilder()
                    .content("New body from sync.")
                    .title("Refreshed title")
                    .build());
            return List.of();
        }));

        // when
        AuditResult result = engine.audit("kb-1");

        // then
        Article stored = articleStore.get("kb-1").orElseThrow();
        assertThat(stored.getContent()).isEqualTo("New body from sync.");
        assertThat(stored.getTitle()).isEqualTo("Refreshed title");
        assertThat(stored.getContentHealthScore()).isEqualTo(result.getComputedHealthScore()).isEqualTo(100);
        assertThat(stored.getLastAuditedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Auditing the same article twice gives the same issues and score")
    void idempotent() {
        // given
        AuditEngine engine = engine(
                FixedRule.reporting("a", RuleCategory.TECHNICAL, Severity.HIGH, 2),
                FixedRule.passing("b"));

        // when
        AuditResult first = engine.audit("kb-1");
        AuditResult second = engine.audit("kb-1");

        // then
        assertThat(second.getIssues()).isEqualTo(first.getIssues());
        assertThat(second.getComputedHealthScore()).isEqualTo(first.getComputedHealthScore()).isEqualTo(40);
    }

    @Test
    @DisplayName("No enabled rules scores 100")
    void noRules() {
        // given
        auditConfig.setDisabledRules(List.of("only"));
        AuditEngine engine = engine(FixedRule.reporting("only", RuleCategory.SEO, Severity.HIGH, 1));

        // when
        AuditResult result = engine.audit("kb-1");

        // then
        assertThat(result.getRulesExecuted()).isZero();
        assertThat(result.getIssues()).isEmpty();
        assertThat(result.getComputedHealthScore()).isEqualTo(100);
    }

    @Test
    @DisplayName("Unknown article fails with NotFound")
    void unknownArticle() {
        AuditEngine engine = engine(FixedRule.passing("a"));

        assertThatThrownBy(() -> engine.audit("missing")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Selected rules run alone, disabled ones are skipped and unknown ids fail")
    void selectedRules() {
        // given
        FixedRule first = FixedRule.reporting("first", RuleCategory.SEO, Severity.LOW, 1);
        FixedRule second = FixedRule.reporting("second", RuleCategory.SEO, Severity.LOW, 1);
        FixedRule third = FixedRule.reporting("third", RuleCategory.SEO, Severity.LOW, 1);
        auditConfig.setDisabledRules(List.of("third"));
        AuditEngine engine = engine(first, second, third);

        // when
        AuditResult result = engine.audit("kb-1", List.of("second", "third"));

        // then
        assertThat(result.getRulesExecuted()).isEqualTo(1);
        assertThat(result.getPerRuleOutcome()).containsOnlyKeys("second");
        assertThat(first.getInvocations()).isZero();
        assertThat(third.getInvocations()).isZero();
        assertThatThrownBy(() -> engine.audit("kb-1", List.of("ghost"))).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("A throwing rule costs five points and the other rules still run")
    void failingRuleIsContained() {
        // given
        AuditEngine engine = engine(
                FixedRule.behaving("boom", a -> {
                    throw new IllegalArgumentException("bad input");
                }),
                FixedRule.reporting("after", RuleCategory.CONTENT_QUALITY, Severity.MEDIUM, 1));

        // when
        AuditResult result = engine.audit("kb-1");

        // then
        assertThat(result.getIssues()).hasSize(2);
        assertThat(result.getIssues().get(0).getCategory()).isEqualTo(RuleCategory.ENGINE);
        assertThat(result.getComputedHealthScore()).isEqualTo(80);
    }

    @Test
    @DisplayName("Source audit covers every article of the source")
    void auditSource() {
        // given
        articleStore.upsert(TestArticles.withContent("Second body.").toBuilder()
                .id("kb-2")
                .url("https://help.acme.io/articles/2-refunds")
                .build());
        articleStore.upsert(TestArticles.withContent("Elsewhere.").toBuilder()
                .id("other-1")
                .sourceId("other")
                .build());
        AuditEngine engine = engine(FixedRule.reporting("a", RuleCategory.SEO, Severity.MEDIUM, 1));

        // when
        SourceAuditSummary summary = engine.auditSource("kb");

        // then
        assertThat(summary.getArticlesAudited()).isEqualTo(2);
        assertThat(summary.getTotalIssues()).isEqualTo(2);
        assertThat(summary.getAverageHealthScore()).isEqualTo(85.0);
        assertThat(summary.getFailures()).isEmpty();
        assertThat(articleStore.get("other-1").orElseThrow().getContentHealthScore()).isNull();
    }

    @Test
    @DisplayName("Source audit is recorded in the history with its totals and findings")
    void auditSourceRecordsHistory() {
        // given
        articleStore.upsert(TestArticles.withContent("Second body.").toBuilder()
                .id("kb-2")
                .url("https://help.acme.io/articles/2-refunds")
                .build());
        AuditEngine engine = engine(
                FixedRule.reporting("seo", RuleCategory.SEO, Severity.MEDIUM, 1),
                FixedRule.passing("quality"));

        // when
        SourceAuditSummary summary = engine.auditSource("kb");

        // then
        List<AuditRun> runs = engine.listRuns("kb");
        assertThat(runs).hasSize(1);
        AuditRun run = runs.get(0);
        assertThat(run.getId()).isEqualTo(summary.getAuditRunId());
        assertThat(run.getStatus()).isEqualTo(AuditRunStatus.COMPLETED);
        assertThat(run.getRulesExecuted()).isEqualTo(2);
        assertThat(run.getArticlesProcessed()).isEqualTo(2);
        assertThat(run.getArticlesFailed()).isZero();
        assertThat(run.getTotalIssues()).isEqualTo(2);
        assertThat(run.getAverageHealthScore()).isEqualTo(85.0);
        assertThat(run.getStartedAt()).isEqualTo(LocalDateTime.ofInstant(NOW, ZoneOffset.UTC));
        assertThat(run.getCompletedAt()).isNotNull();

        List<AuditFinding> findings = engine.listFindings(run.getId());
        assertThat(findings).extracting(AuditFinding::getArticleId).containsExactly("kb-1", "kb-2");
        assertThat(findings).allMatch(finding -> finding.getRuleId().equals("seo")
                && finding.getSeverity() == Severity.MEDIUM);
        assertThat(engine.listRuns("other")).isEmpty();
        assertThatThrownBy(() -> engine.listFindings("no-such-run")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Source audit that cannot read its articles is recorded as FAILED")
    void auditSourceFailureIsRecorded() {
        // given
        articleStore = new InMemoryArticleStore() {
            @Override
            public List<Article> listBySource(String sourceId) {
                throw new IllegalStateException("store down");
            }
        };
        AuditEngine engine = engine(FixedRule.passing("a"));

        // when / then
        assertThatThrownBy(() -> engine.auditSource("kb")).hasMessage("store down");
        AuditRun run = engine.listRuns("kb").get(0);
        assertThat(run.getStatus()).isEqualTo(AuditRunStatus.FAILED);
        assertThat(run.getErrorMessage()).isEqualTo("store down");
        assertThat(run.getCompletedAt()).isNotNull();
    }

    private AuditEngine engine(AuditRule... rules) {
        RuleCatalog catalog = new RuleCatalog(List.of(rules), auditConfig);
        RuleEvaluator evaluator = new RuleEvaluator(new SimpleAsyncTaskExecutor("audit-test-"), auditConfig);
        return new AuditEngine(articleStore, catalog, evaluator, new HealthScoreCalculator(), historyStore, clock);
    }
}
