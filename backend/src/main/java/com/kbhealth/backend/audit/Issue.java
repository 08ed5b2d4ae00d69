package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import lombok.Builder;
import lombok.Value;

/**
 * One problem found by a rule in an article.
 */
@Value
@Builder
public class Issue {

    String ruleId;
    RuleCategory category;
    Severity severity;
    String title;
    String description;
    String suggestion;

    // Position of the offending markdown, null when the issue concerns the whole article
    IssueLocation location;
}
