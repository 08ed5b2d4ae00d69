package com.kbhealth.backend.audit;

import com.kbhealth.backend.article.ArticleStore;
import com.kbhealth.backend.exception.NotFoundException;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.entity.AuditFinding;
import com.kbhealth.backend.model.entity.AuditRun;
import com.kbhealth.backend.model.enums.AuditRunStatus;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Audits stored articles against the enabled rules and writes the resulting health score
 * back to the article. Source audits are recorded in the audit history.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditEngine {

    private final ArticleStore articleStore;
    private final RuleCatalog ruleCatalog;
    private final RuleEvaluator ruleEvaluator;
    private final HealthScoreCalculator healthScoreCalculator;
    private final AuditHistoryStore auditHistoryStore;
    private final Clock clock;

    /**
     * Runs every enabled rule against the article.
     *
     * @throws NotFoundException if no article has this id
     */
    public AuditResult audit(String articleId) {
        Article article = articleStore.get(articleId).orElseThrow(() -> NotFoundException.article(articleId));
        return run(article, ruleCatalog.snapshot());
    }

    /**
     * Runs only the named rules, skipping those that are disabled.
     *
     * @throws NotFoundException if the article or one of the rule ids is unknown
     */
    public AuditResult audit(String articleId, Collection<String> ruleIds) {
        Set<String> requested = new LinkedHashSet<>(ruleIds);
        requested.forEach(ruleCatalog::get);
        Article article = articleStore.get(articleId).orElseThrow(() -> NotFoundException.article(articleId));
        List<AuditRule> rules = ruleCatalog.snapshot().stream()
                .filter(rule -> requested.contains(rule.getId()))
                .toList();
        return run(article, rules);
    }

    /**
     * Audits every stored article of a source. A failing article is recorded in the summary
     * and does not stop the others. The run and its findings are kept in the audit history.
     */
    public SourceAuditSummary auditSource(String sourceId) {
        long startTime = System.currentTimeMillis();
        AuditRun auditRun = AuditRun.builder()
                .id(UUID.randomUUID().toString())
                .sourceId(sourceId)
                .status(AuditRunStatus.RUNNING)
                .startedAt(LocalDateTime.now(clock))
                .build();
        auditHistoryStore.saveRun(auditRun);

        try {
            List<Article> articles = articleStore.listBySource(sourceId);
            List<AuditRule> rules = ruleCatalog.snapshot();
            log.info("Auditing {} articles of {} with {} rules (run {})",
                    articles.size(), sourceId, rules.size(), auditRun.getId());

            List<AuditResult> results = new ArrayList<>();
            List<String> failures = new ArrayList<>();
            int totalIssues = 0;
            long scoreSum = 0;
            for (Article article : articles) {
                AuditResult result;
                try {
                    result = run(article, rules);
                } catch (RuntimeException e) {
                    log.warn("Audit of article {} failed: {}", article.getId(), e.getMessage());
                    failures.add(article.getId() + " - " + e.getMessage());
                    continue;
                }
                results.add(result);
                totalIssues += result.getIssues().size();
                scoreSum += result.getComputedHealthScore();
                auditHistoryStore.saveFindings(findings(auditRun.getId(), article, result.getIssues()));
            }

            double average = results.isEmpty() ? 0 : (double) scoreSum / results.size();
            auditRun.setStatus(AuditRunStatus.COMPLETED);
            auditRun.setRulesExecuted(rules.size());
            auditRun.setArticlesProcessed(results.size());
            auditRun.setArticlesFailed(failures.size());
            auditRun.setTotalIssues(totalIssues);
            auditRun.setAverageHealthScore(results.isEmpty() ? null : average);
            finish(auditRun, startTime);

            log.info("Audited {} articles of {}: {} issues, average score {}",
                    results.size(), sourceId, totalIssues, String.format("%.1f", average));
            return SourceAuditSummary.builder()
                    .auditRunId(auditRun.getId())
                    .sourceId(sourceId)
                    .articlesAudited(results.size())
                    .totalIssues(totalIssues)
                    .averageHealthScore(average)
                    .results(results)
                    .failures(failures)
                    .build();
        } catch (RuntimeException e) {
            log.error("Audit run {} of {} failed: {}", auditRun.getId(), sourceId, e.getMessage());
            auditRun.setStatus(AuditRunStatus.FAILED);
            auditRun.setErrorMessage(e.getMessage());
            try {
                finish(auditRun, startTime);
            } catch (RuntimeException historyError) {
                e.addSuppressed(historyError);
            }
            throw e;
        }
    }

    /**
     * Audit runs of a source, newest first.
     */
    public List<AuditRun> listRuns(String sourceId) {
        return auditHistoryStore.listRuns(sourceId);
    }

    /**
     * @throws NotFoundException if no audit run has this id
     */
    public List<AuditFinding> listFindings(String auditRunId) {
        auditHistoryStore.findRun(auditRunId).orElseThrow(() -> NotFoundException.auditRun(auditRunId));
        return auditHistoryStore.listFindings(auditRunId);
    }

    private AuditResult run(Article article, List<AuditRule> rules) {
        long startTime = System.currentTimeMillis();
        if (rules.isEmpty()) {
            log.warn("No enabled audit rules, article {} scores {}", article.getId(), HealthScoreCalculator.MAX_SCORE);
        }

        List<Issue> issues = new ArrayList<>();
        Map<String, RuleOutcome> outcomes = new LinkedHashMap<>();
        for (AuditRule rule : rules) {
            RuleEvaluation evaluation = ruleEvaluator.evaluate(rule, article);
            issues.addAll(evaluation.getIssues());
            outcomes.put(rule.getId(), RuleOutcome.of(evaluation));
        }

        int score = healthScoreCalculator.calculate(issues);
        LocalDateTime auditedAt = LocalDateTime.now(clock);
        if (!articleStore.updateHealthScore(article.getId(), score, auditedAt)) {
            log.warn("Article {} disappeared during its audit, score {} not stored", article.getId(), score);
        }

        long durationMs = System.currentTimeMillis() - startTime;
        log.info("Audited {}: {} rules, {} issues, score {} in {} ms",
                article.getId(), rules.size(), issues.size(), score, durationMs);
        return AuditResult.builder()
                .articleId(article.getId())
                .rulesExecuted(rules.size())
                .issues(List.copyOf(issues))
                .perRuleOutcome(outcomes)
                .executionDurationMs(durationMs)
                .computedHealthScore(score)
                .auditedAt(auditedAt)
                .build();
    }

    private void finish(AuditRun auditRun, long startTime) {
        auditRun.setCompletedAt(LocalDateTime.now(clock));
        auditRun.setDurationMs(System.currentTimeMillis() - startTime);
        auditHistoryStore.saveRun(auditRun);
    }

    private static List<AuditFinding> findings(String auditRunId, Article article, List<Issue> issues) {
        List<AuditFinding> findings = new ArrayList<>();
        for (Issue issue : issues) {
            findings.add(AuditFinding.builder()
                    .auditRunId(auditRunId)
                    .articleId(article.getId())
                    .articleTitle(article.getTitle())
                    .articleUrl(article.getUrl())
                    .ruleId(issue.getRuleId())
                    .category(issue.getCategory())
                    .severity(issue.getSeverity())
                    .message(issue.getTitle())
                    .details(issue.getDescription())
                    .suggestion(issue.getSuggestion())
                    .build());
        }
        return findings;
    }
}
