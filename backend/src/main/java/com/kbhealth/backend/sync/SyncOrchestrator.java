package com.kbhealth.backend.sync;

import com.kbhealth.backend.article.ArticleStore;
import com.kbhealth.backend.config.SyncConfig;
import com.kbhealth.backend.exception.AlreadySyncingException;
import com.kbhealth.backend.exception.FatalSourceException;
import com.kbhealth.backend.exception.KbHealthException;
import com.kbhealth.backend.model.dto.FetchOptions;
import com.kbhealth.backend.model.dto.SyncResultDTO;
import com.kbhealth.backend.model.entity.DataSource;
import com.kbhealth.backend.model.enums.SyncStatus;
import com.kbhealth.backend.scraping.FetchOutcome;
import com.kbhealth.backend.scraping.FetchPipeline;
import com.kbhealth.backend.scraping.FetchRun;
import com.kbhealth.backend.scraping.SyncCancellation;
import com.kbhealth.backend.source.SourceRegistry;
import com.kbhealth.backend.source.SyncOutcome;
import com.kbhealth.backend.source.SyncTicket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Drives fetch pipeline runs for one source or for every enabled source and records each
 * run's outcome in the source registry.
 */
@Service
@Slf4j
public class SyncOrchestrator {

    private final SourceRegistry sourceRegistry;
    private final FetchPipeline fetchPipeline;
    private final ArticleStore articleStore;
    private final SyncConfig syncConfig;
    private final Executor syncTaskExecutor;

    // Cancellation handles of in-flight runs
    private final Map<String, SyncCancellation> activeRuns = new ConcurrentHashMap<>();

    public SyncOrchestrator(SourceRegistry sourceRegistry,
                            FetchPipeline fetchPipeline,
                            ArticleStore articleStore,
                            SyncConfig syncConfig,
                            @Qualifier("syncTaskExecutor") Executor syncTaskExecutor) {
        this.sourceRegistry = sourceRegistry;
        this.fetchPipeline = fetchPipeline;
        this.articleStore = articleStore;
        this.syncConfig = syncConfig;
        this.syncTaskExecutor = syncTaskExecutor;
    }

    /**
     * Syncs one source within its wall-clock budget.
     *
     * @throws AlreadySyncingException if the source has a run in flight
     * @throws com.kbhealth.backend.exception.NotFoundException if the source is unknown
     */
    public SyncResultDTO syncOne(String sourceId, FetchOptions options) {
        DataSource source = sourceRegistry.get(sourceId);
        int budgetSeconds = source.getSyncTimeoutSeconds() != null
                ? source.getSyncTimeoutSeconds()
                : syncConfig.getDefaultTimeoutSeconds();
        return syncOne(sourceId, options, SyncCancellation.withBudget(Duration.ofSeconds(budgetSeconds)));
    }

    public SyncResultDTO syncOne(String sourceId, FetchOptions options, SyncCancellation cancellation) {
        SyncTicket ticket = sourceRegistry.beginSync(sourceId);
        activeRuns.put(sourceId, cancellation);
        long startTime = System.currentTimeMillis();

        int found = 0;
        int unchanged = 0;
        int errors = 0;
        List<String> errorSamples = new ArrayList<>();

        // Every path below closes the ticket, so the source never stays SYNCING
        try {
            boolean cutShort;
            DataSource source = sourceRegistry.get(sourceId);
            try (FetchRun run = fetchPipeline.fetch(source, options, cancellation)) {
                while (run.hasNext()) {
                    FetchOutcome outcome = run.next();
                    switch (outcome.getKind()) {
                        case FETCHED:
                            try {
                                articleStore.upsert(outcome.getArticle());
                                found++;
                            } catch (RuntimeException e) {
                                errors++;
                                addSample(errorSamples, outcome.getUrl(), "store failure: " + e.getMessage());
                                log.warn("Failed to store article {}: {}", outcome.getUrl(), e.getMessage());
                            }
                            break;
                        case UNCHANGED:
                            unchanged++;
                            break;
                        case FAILED:
                            errors++;
                            addSample(errorSamples, outcome.getUrl(), outcome.getErrorMessage());
                            break;
                        default:
                            break;
                    }
                }
                cutShort = run.isCutShort();
            }

            long durationMs = System.currentTimeMillis() - startTime;
            long articlesCount = articleStore.countBySource(sourceId);

            // A cancel arriving after the last outcome skipped nothing, so the run still succeeds
            if (cutShort) {
                String reason = cancellation.isCancelRequested()
                        ? "Cancelled by request"
                        : "Sync budget exceeded";
                sourceRegistry.completeSync(ticket, SyncOutcome.cancelled(articlesCount));
                log.warn("Sync of {} cancelled ({}): {} articles stored before stopping", sourceId, reason, found);
                return result(sourceId, SyncStatus.CANCELLED, found, unchanged, errors, errorSamples, durationMs, reason);
            }

            sourceRegistry.completeSync(ticket, SyncOutcome.success(articlesCount));
            log.info("Completed sync of {}: {} stored, {} unchanged, {} errors in {} ms",
                    sourceId, found, unchanged, errors, durationMs);
            return result(sourceId, SyncStatus.SUCCESS, found, unchanged, errors, errorSamples, durationMs,
                    errors > 0 ? "Completed with " + errors + " item errors" : "Completed");
        } catch (FatalSourceException e) {
            return fail(ticket, startTime, found, unchanged, errors, errorSamples, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Sync of {} aborted by unexpected error", sourceId, e);
            return fail(ticket, startTime, found, unchanged, errors, errorSamples,
                    "Unexpected error: " + e.getMessage());
        } finally {
            activeRuns.remove(sourceId, cancellation);
        }
    }

    /**
     * Syncs every enabled source concurrently. A failure of one source is reported in its own
     * result and never aborts the others.
     */
    public Map<String, SyncResultDTO> syncAll(FetchOptions options) {
        List<DataSource> targets = sourceRegistry.listEnabled();
        log.info("Starting sync of {} enabled sources", targets.size());
        long startTime = System.currentTimeMillis();

        Map<String, CompletableFuture<SyncResultDTO>> futures = new LinkedHashMap<>();
        for (DataSource source : targets) {
            String sourceId = source.getId();
            CompletableFuture<SyncResultDTO> future;
            try {
                future = CompletableFuture.supplyAsync(() -> syncContained(sourceId, options), syncTaskExecutor);
            } catch (RejectedExecutionException e) {
                future = CompletableFuture.completedFuture(
                        result(sourceId, SyncStatus.ERROR, 0, 0, 0, new ArrayList<>(), 0, "Sync pool saturated"));
            }
            futures.put(sourceId, future);
        }

        Map<String, SyncResultDTO> results = new LinkedHashMap<>();
        futures.forEach((sourceId, future) -> results.put(sourceId, future.join()));

        long succeeded = results.values().stream().filter(SyncResultDTO::isSuccess).count();
        log.info("Completed sync of all sources: {}/{} succeeded in {} ms",
                succeeded, results.size(), System.currentTimeMillis() - startTime);
        return results;
    }

    /**
     * Signals the in-flight run of a source to stop.
     *
     * @return false when the source has no run in flight
     */
    public boolean cancel(String sourceId) {
        sourceRegistry.get(sourceId);
        SyncCancellation cancellation = activeRuns.get(sourceId);
        if (cancellation == null) {
            return false;
        }
        cancellation.cancel();
        log.info("Cancellation requested for sync of {}", sourceId);
        return true;
    }

    public boolean isRunning(String sourceId) {
        return activeRuns.containsKey(sourceId);
    }

    private SyncResultDTO syncContained(String sourceId, FetchOptions options) {
        long startTime = System.currentTimeMillis();
        try {
            return syncOne(sourceId, options);
        } catch (AlreadySyncingException e) {
            log.info("Skipping {}: already syncing", sourceId);
            return result(sourceId, SyncStatus.SYNCING, 0, 0, 0, new ArrayList<>(),
                    System.currentTimeMillis() - startTime, e.getMessage());
        } catch (KbHealthException e) {
            log.warn("Sync of {} failed: {}", sourceId, e.getMessage());
            return result(sourceId, SyncStatus.ERROR, 0, 0, 0, new ArrayList<>(),
                    System.currentTimeMillis() - startTime, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Sync of {} failed unexpectedly", sourceId, e);
            return result(sourceId, SyncStatus.ERROR, 0, 0, 0, new ArrayList<>(),
                    System.currentTimeMillis() - startTime, "Unexpected error: " + e.getMessage());
        }
    }

    private SyncResultDTO fail(SyncTicket ticket, long startTime, int found, int unchanged, int errors,
                               List<String> errorSamples, String message) {
        try {
            sourceRegistry.completeSync(ticket, SyncOutcome.error(message));
        } catch (RuntimeException e) {
            log.error("Could not record the failure of sync run {} of {}", ticket.getRunId(), ticket.getSourceId(), e);
        }
        log.error("Sync of {} failed: {}", ticket.getSourceId(), message);
        return result(ticket.getSourceId(), SyncStatus.ERROR, found, unchanged, errors, errorSamples,
                System.currentTimeMillis() - startTime, message);
    }

    private void addSample(List<String> samples, String url, String reason) {
        if (samples.size() < syncConfig.getErrorSampleLimit()) {
            samples.add(url + " - " + reason);
        }
    }

    private static SyncResultDTO result(String sourceId, SyncStatus status, int found, int unchanged, int errors,
                                        List<String> errorSamples, long durationMs, String message) {
        return SyncResultDTO.builder()
                .sourceId(sourceId)
                .status(status)
                .articlesFound(found)
                .articlesUnchanged(unchanged)
                .errors(errors)
                .errorSamples(errorSamples)
                .durationMs(durationMs)
                .message(message)
                .build();
    }
}
