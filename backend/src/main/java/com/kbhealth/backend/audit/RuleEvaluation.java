package com.kbhealth.backend.audit;

import java.util.List;
import lombok.Value;

/**
 * Issues of one rule run against one article.
 */
@Value
public class RuleEvaluation {

    String ruleId;
    List<Issue> issues;
    long durationMs;
    boolean timedOut;

    // The rule threw instead of returning issues
    boolean failed;
}
