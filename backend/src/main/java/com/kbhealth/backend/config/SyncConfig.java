package com.kbhealth.backend.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

@Component
@ConfigurationProperties(prefix = "sync")
@Validated
@Data
public class SyncConfig {

    // Sources synced at the same time by a sync-all sweep
    @Min(1)
    private int maxConcurrentSources = 3;

    // Wall-clock budget of one run when the source does not set its own
    @Min(1)
    private int defaultTimeoutSeconds = 600;

    @Min(1)
    private int defaultMaxArticlesPerCategory = 5;

    // Failed URLs kept on a sync result
    @Min(0)
    private int errorSampleLimit = 5;

    private Schedule schedule = new Schedule();

    @Data
    public static class Schedule {
        private boolean enabled = false;
        private long intervalMs = 3_600_000;
        private long initialDelayMs = 60_000;
        private boolean forceRefresh = false;
    }
}
