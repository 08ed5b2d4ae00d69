package com.kbhealth.backend.audit;

import com.kbhealth.backend.config.AuditConfig;
import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Runs one rule against one article within the configured time budget. A rule that times out
 * or throws yields a single low-severity engine issue instead of failing the audit.
 */
@Component
@Slf4j
public class RuleEvaluator {

    private final AsyncTaskExecutor ruleTaskExecutor;
    private final AuditConfig auditConfig;

    public RuleEvaluator(@Qualifier("ruleTaskExecutor") AsyncTaskExecutor ruleTaskExecutor, AuditConfig auditConfig) {
        this.ruleTaskExecutor = ruleTaskExecutor;
        this.auditConfig = auditConfig;
    }

    public RuleEvaluation evaluate(AuditRule rule, Article article) {
        long startTime = System.currentTimeMillis();
        // Rules see a private copy so they cannot alter the stored article
        Article snapshot = article.toBuilder()
                .tags(article.getTags() != null ? new LinkedHashSet<>(article.getTags()) : new LinkedHashSet<>())
                .build();

        Future<List<Issue>> future;
        try {
            future = ruleTaskExecutor.submit(() -> rule.evaluate(snapshot));
        } catch (RejectedExecutionException e) {
            log.warn("Rule {} could not be scheduled for {}: {}", rule.getId(), article.getId(), e.getMessage());
            return failure(rule, startTime, "Rule execution failed: rule pool saturated", false);
        }

        try {
            List<Issue> issues = future.get(auditConfig.getRuleTimeoutMs(), TimeUnit.MILLISECONDS);
            long durationMs = System.currentTimeMillis() - startTime;
            log.debug("Rule {} found {} issues in {} ({} ms)", rule.getId(),
                    issues == null ? 0 : issues.size(), article.getId(), durationMs);
            return new RuleEvaluation(rule.getId(), issues == null ? List.of() : new ArrayList<>(issues),
                    durationMs, false, false);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Rule {} timed out after {} ms on {}", rule.getId(), auditConfig.getRuleTimeoutMs(), article.getId());
            return failure(rule, startTime,
                    "Rule timed out after " + auditConfig.getRuleTimeoutMs() + " ms", true);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Rule {} failed on {}: {}", rule.getId(), article.getId(), cause.getMessage(), cause);
            return failure(rule, startTime, "Rule execution failed: " + cause.getMessage(), false);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("Rule {} interrupted on {}", rule.getId(), article.getId());
            return failure(rule, startTime, "Rule execution interrupted", false);
        }
    }

    private RuleEvaluation failure(AuditRule rule, long startTime, String message, boolean timedOut) {
        Issue issue = Issue.builder()
                .ruleId(rule.getId())
                .category(RuleCategory.ENGINE)
                .severity(Severity.LOW)
                .title(timedOut ? "Rule timed out" : "Rule execution failed")
                .description(message)
                .suggestion("Check the " + rule.getId() + " rule and re-run the audit")
                .build();
        return new RuleEvaluation(rule.getId(), List.of(issue), System.currentTimeMillis() - startTime, timedOut, !timedOut);
    }
}
