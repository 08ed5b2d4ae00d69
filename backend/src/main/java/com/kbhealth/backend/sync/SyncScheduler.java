package com.kbhealth.backend.sync;

import com.kbhealth.backend.config.SyncConfig;
import com.kbhealth.backend.model.dto.FetchOptions;
import com.kbhealth.backend.model.dto.SyncResultDTO;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic sync-all sweep, active only with {@code sync.schedule.enabled=true}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "sync.schedule", name = "enabled", havingValue = "true")
public class SyncScheduler {

    private final SyncOrchestrator syncOrchestrator;
    private final SyncConfig syncConfig;

    private final AtomicBoolean sweepRunning = new AtomicBoolean(false);

    @Scheduled(fixedDelayString = "${sync.schedule.interval-ms:3600000}",
            initialDelayString = "${sync.schedule.initial-delay-ms:60000}")
    public void scheduledSync() {
        if (!sweepRunning.compareAndSet(false, true)) {
            log.info("Skipping scheduled sync - previous sweep still in progress");
            return;
        }

        try {
            log.info("Scheduled sync started");
            FetchOptions options = FetchOptions.builder()
                    .forceRefresh(syncConfig.getSchedule().isForceRefresh())
                    .build();
            Map<String, SyncResultDTO> results = syncOrchestrator.syncAll(options);
            results.forEach((sourceId, result) ->
                    log.info("  {} -> {} ({} stored, {} unchanged, {} errors)", sourceId, result.getStatus(),
                            result.getArticlesFound(), result.getArticlesUnchanged(), result.getErrors()));
        } catch (RuntimeException e) {
            log.error("Scheduled sync failed: {}", e.getMessage(), e);
        } finally {
            sweepRunning.set(false);
        }
    }
}
