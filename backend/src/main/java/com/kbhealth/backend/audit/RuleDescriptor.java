package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.enums.RuleCategory;
import com.kbhealth.backend.model.enums.Severity;
import lombok.Value;

@Value
public class RuleDescriptor {

    String id;
    String name;
    String description;
    RuleCategory category;
    Severity severity;
    boolean enabled;

    static RuleDescriptor of(AuditRule rule, boolean enabled) {
        return new RuleDescriptor(rule.getId(), rule.getName(), rule.getDescription(),
                rule.getCategory(), rule.getSeverity(), enabled);
    }
}
