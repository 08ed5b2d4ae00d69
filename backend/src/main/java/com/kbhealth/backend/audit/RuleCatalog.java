package com.kbhealth.backend.audit;

import com.kbhealth.backend.config.AuditConfig;
import com.kbhealth.backend.exception.NotFoundException;
import com.kbhealth.backend.model.enums.RuleCategory;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Registered audit rules in a fixed order with a mutable enabled flag per rule.
 * <p>
 * Registration order is the order of the injected rule beans. Audits work on an immutable
 * {@link #snapshot()}, so enabling or disabling a rule never affects an audit in progress.
 */
@Service
@Slf4j
public class RuleCatalog {

    private final Map<String, AuditRule> rules = new LinkedHashMap<>();
    private final Set<String> disabled = new HashSet<>();
    private volatile List<AuditRule> enabledSnapshot;

    public RuleCatalog(List<AuditRule> registeredRules, AuditConfig auditConfig) {
        for (AuditRule rule : registeredRules) {
            if (rules.putIfAbsent(rule.getId(), rule) != null) {
                throw new IllegalStateException("Duplicate audit rule id: " + rule.getId());
            }
        }
        for (String ruleId : auditConfig.getDisabledRules()) {
            if (rules.containsKey(ruleId)) {
                disabled.add(ruleId);
            } else {
                log.warn("Ignoring unknown rule id in audit.disabled-rules: {}", ruleId);
            }
        }
        rebuildSnapshot();
        log.info("Registered {} audit rules ({} enabled): {}", rules.size(), enabledSnapshot.size(), rules.keySet());
    }

    /**
     * Enabled rules in registration order.
     */
    public List<AuditRule> snapshot() {
        return enabledSnapshot;
    }

    public synchronized List<RuleDescriptor> list() {
        List<RuleDescriptor> descriptors = new ArrayList<>();
        rules.values().forEach(rule -> descriptors.add(RuleDescriptor.of(rule, !disabled.contains(rule.getId()))));
        return descriptors;
    }

    public synchronized RuleDescriptor get(String ruleId) {
        AuditRule rule = rules.get(ruleId);
        if (rule == null) {
            throw NotFoundException.rule(ruleId);
        }
        return RuleDescriptor.of(rule, !disabled.contains(ruleId));
    }

    public synchronized RuleDescriptor setEnabled(String ruleId, boolean enabled) {
        AuditRule rule = rules.get(ruleId);
        if (rule == null) {
            throw NotFoundException.rule(ruleId);
        }
        boolean changed = enabled ? disabled.remove(ruleId) : disabled.add(ruleId);
        if (changed) {
            rebuildSnapshot();
            log.info("Audit rule {} {}", ruleId, enabled ? "enabled" : "disabled");
        }
        return RuleDescriptor.of(rule, enabled);
    }

    public RuleCatalogSummary summary() {
        List<RuleDescriptor> descriptors = list();
        Map<RuleCategory, Integer> counts = new EnumMap<>(RuleCategory.class);
        Map<RuleCategory, Integer> enabledCounts = new EnumMap<>(RuleCategory.class);
        int enabled = 0;
        for (RuleDescriptor descriptor : descriptors) {
            counts.merge(descriptor.getCategory(), 1, Integer::sum);
            if (descriptor.isEnabled()) {
                enabledCounts.merge(descriptor.getCategory(), 1, Integer::sum);
                enabled++;
            }
        }
        return RuleCatalogSummary.builder()
                .rules(descriptors)
                .countsByCategory(counts)
                .enabledByCategory(enabledCounts)
                .totalRules(descriptors.size())
                .enabledRules(enabled)
                .build();
    }

    private void rebuildSnapshot() {
        enabledSnapshot = rules.values().stream()
                .filter(rule -> !disabled.contains(rule.getId()))
                .toList();
    }
}
