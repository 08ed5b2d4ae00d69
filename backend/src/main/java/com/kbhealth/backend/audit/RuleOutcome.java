package com.kbhealth.backend.audit;

import lombok.Value;

@Value
public class RuleOutcome {

    boolean passed;
    int issueCount;
    long durationMs;
    boolean timedOut;

    static RuleOutcome of(RuleEvaluation evaluation) {
        return new RuleOutcome(evaluation.getIssues().isEmpty(), evaluation.getIssues().size(),
                evaluation.getDurationMs(), evaluation.isTimedOut());
    }
}
