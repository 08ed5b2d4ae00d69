package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.enums.Severity;
import java.util.Collection;
import org.springframework.stereotype.Component;

/**
 * Health score of an article: 100 minus the severity weight of every issue, clamped to
 * [0, 100].
 */
@Component
public class HealthScoreCalculator {

    public static final int MAX_SCORE = 100;

    public int calculate(Collection<Issue> issues) {
        int deductions = 0;
        for (Issue issue : issues) {
            Severity severity = issue.getSeverity() != null ? issue.getSeverity() : Severity.LOW;
            deductions += severity.getWeight();
            if (deductions >= MAX_SCORE) {
                return 0;
            }
        }
        return MAX_SCORE - deductions;
    }
}
