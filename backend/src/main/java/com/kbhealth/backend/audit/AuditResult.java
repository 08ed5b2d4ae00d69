package com.kbhealth.backend.audit;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

/**
 * Outcome of auditing one article. Issues and per-rule outcomes follow rule catalog order.
 */
@Value
@Builder
public class AuditResult {

    String articleId;
    int rulesExecuted;
    List<Issue> issues;
    Map<String, RuleOutcome> perRuleOutcome;
    long executionDurationMs;
    int computedHealthScore;
    LocalDateTime auditedAt;
}
