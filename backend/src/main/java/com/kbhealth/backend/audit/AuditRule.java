package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.entity.Article;
import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import java.util.List;

/**
 * A content check run by the audit engine. Implementations must be deterministic for a
 * fixed article and read time only from an injected clock.
 */
public interface AuditRule {

    String getId();

    String getName();

    String getDescription();

    RuleCategory getCategory();

    Severity getSeverity();

    /**
     * @return issues in emission order, empty when the article passes
     */
    List<Issue> evaluate(Article article);
}
