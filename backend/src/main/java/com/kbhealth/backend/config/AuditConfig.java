package com.kbhealth.backend.config;

import jakarta.validation.constraints.Min;
import java.util.ArrayList;
import java.util.List;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "audit")
@Validated
@Data
public class AuditConfig {

    // Time budget of a single rule evaluation
    @Min(1)
    private long ruleTimeoutMs = 5_000;

    // Rule ids registered but disabled at startup
    private List<String> disabledRules = new ArrayList<>();
}
