package com.kbhealth.backend.audit;

import com.kbhealth.backend.model.enums.RuleCategory;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RuleCatalogSummary {

    List<RuleDescriptor> rules;
    Map<RuleCategory, Integer> countsByCategory;
    Map<RuleCategory, Integer> enabledByCategory;
    int totalRules;
    int enabledRules;
}
