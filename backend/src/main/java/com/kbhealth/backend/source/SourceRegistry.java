package com.kbhealth.backend.source;

import com.kbhealth.backend.exception.AlreadySyncingException;
import com.kbhealth.backend.exception.NotFoundException;
import com.kbhealth.backend.model.entity.DataSource;
import com.kbhealth.backend.model.enums.SyncStatus;
import jakarta.annotation.PostConstruct;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Holds every data source with its live sync status.
 * <p>
 * Each source has its own entry lock; every state transition happens under that lock and is
 * written through to the {@link SourceConfigurationStore} before it becomes visible. Callers
 * only ever receive copies.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SourceRegistry {

    private final SourceConfigurationStore configurationStore;
    private final Clock clock;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();

    @PostConstruct
    public void loadFromStore() {
        int reset = 0;
        for (DataSource persisted : configurationStore.findAll()) {
            DataSource state = persisted.toBuilder().build();
            if (state.getStatus() == SyncStatus.SYNCING) {
                // The run that owned it died with the previous process
                state.setStatus(SyncStatus.IDLE);
                configurationStore.save(state.toBuilder().build());
                reset++;
            }
            entries.put(state.getId(), new Entry(state));
        }
        log.info("Loaded {} data sources from store ({} interrupted syncs reset)", entries.size(), reset);
    }

    /**
     * Adds a source, or refreshes the configuration of a known one while keeping its
     * status, counters and enabled flag.
     */
    public DataSource register(DataSource candidate) {
        Entry created = new Entry(null);
        Entry existing = entries.putIfAbsent(candidate.getId(), created);
        Entry entry = existing != null ? existing : created;

        synchronized (entry) {
            DataSource next;
            if (entry.state == null) {
                next = candidate.toBuilder()
                        .status(SyncStatus.IDLE)
                        .lastSyncAt(null)
                        .syncCount(0)
                        .errorCount(0)
                        .articlesCount(0)
                        .lastError(null)
                        .build();
                log.info("Registered data source: {} ({})", next.getId(), next.getBaseUrl());
            } else {
                next = entry.state.toBuilder()
                        .name(candidate.getName())
                        .platform(candidate.getPlatform())
                        .baseUrl(candidate.getBaseUrl())
                        .maxArticlesPerCategory(candidate.getMaxArticlesPerCategory())
                        .syncTimeoutSeconds(candidate.getSyncTimeoutSeconds())
                        .build();
                log.debug("Refreshed configuration of data source: {}", next.getId());
            }
            commit(entry, next);
            return copy(next);
        }
    }

    public DataSource get(String sourceId) {
        Entry entry = entryFor(sourceId);
        synchronized (entry) {
            return copy(entry.state);
        }
    }

    public boolean exists(String sourceId) {
        Entry entry = entries.get(sourceId);
        if (entry == null) {
            return false;
        }
        synchronized (entry) {
            return entry.state != null;
        }
    }

    public List<DataSource> list() {
        List<DataSource> sources = new ArrayList<>();
        for (Entry entry : entries.values()) {
            synchronized (entry) {
                if (entry.state != null) {
                    sources.add(copy(entry.state));
                }
            }
        }
        sources.sort(Comparator.comparing(DataSource::getId));
        return sources;
    }

    public List<DataSource> listEnabled() {
        return list().stream().filter(DataSource::isEnabled).toList();
    }

    public DataSource setEnabled(String sourceId, boolean enabled) {
        Entry entry = entryFor(sourceId);
        synchronized (entry) {
            DataSource next = entry.state.toBuilder().enabled(enabled).build();
            commit(entry, next);
            log.info("Data source {} {}", sourceId, enabled ? "enabled" : "disabled");
            return copy(next);
        }
    }

    /**
     * Claims the source for a new sync run.
     *
     * @throws AlreadySyncingException if another run owns the source
     * @throws NotFoundException if the source is unknown
     */
    public SyncTicket beginSync(String sourceId) {
        Entry entry = entryFor(sourceId);
        synchronized (entry) {
            if (entry.state.getStatus().isSyncing()) {
                throw new AlreadySyncingException(sourceId);
            }
            DataSource next = entry.state.toBuilder().status(SyncStatus.SYNCING).build();
            commit(entry, next);
            entry.runId = UUID.randomUUID().toString();
            log.info("Sync started for {} (run {})", sourceId, entry.runId);
            return new SyncTicket(sourceId, entry.runId, LocalDateTime.now(clock));
        }
    }

    /**
     * Applies the outcome of the run identified by the ticket. A failed run keeps the last
     * successful sync time and article count. The claim is released even when the durable
     * write fails, in which case the store's exception is rethrown.
     */
    public DataSource completeSync(SyncTicket ticket, SyncOutcome outcome) {
        Entry entry = entryFor(ticket.getSourceId());
        synchronized (entry) {
            if (!entry.state.getStatus().isSyncing() || !ticket.getRunId().equals(entry.runId)) {
                throw new IllegalStateException("Ticket " + ticket.getRunId()
                        + " does not own the sync of " + ticket.getSourceId());
            }

            DataSource current = entry.state;
            DataSource next;
            if (outcome.getKind() == SyncOutcome.Kind.SUCCESS) {
                next = current.toBuilder()
                        .status(SyncStatus.SUCCESS)
                        .lastSyncAt(LocalDateTime.now(clock))
                        .syncCount(current.getSyncCount() + 1)
                        .articlesCount(outcome.getArticlesCount())
                        .lastError(null)
                        .build();
            } else if (outcome.getKind() == SyncOutcome.Kind.ERROR) {
                next = current.toBuilder()
                        .status(SyncStatus.ERROR)
                        .errorCount(current.getErrorCount() + 1)
                        .lastError(outcome.getErrorMessage())
                        .build();
            } else {
                // Cancelled runs keep counters, applied upserts still count
                next = current.toBuilder()
                        .status(SyncStatus.CANCELLED)
                        .articlesCount(outcome.getArticlesCount())
                        .build();
            }
            entry.runId = null;
            try {
                commit(entry, next);
            } catch (RuntimeException e) {
                // The run is over even when its end cannot be persisted
                entry.state = next;
                log.error("Could not persist the end of sync run {} of {}: {}",
                        ticket.getRunId(), ticket.getSourceId(), e.getMessage());
                throw e;
            }
            log.info("Sync finished for {} with status {} (run {})", ticket.getSourceId(), next.getStatus(), ticket.getRunId());
            return copy(next);
        }
    }

    private Entry entryFor(String sourceId) {
        Entry entry = entries.get(sourceId);
        if (entry == null) {
            throw NotFoundException.source(sourceId);
        }
        synchronized (entry) {
            if (entry.state == null) {
                throw NotFoundException.source(sourceId);
            }
        }
        return entry;
    }

    // Caller holds the entry lock
    private void commit(Entry entry, DataSource next) {
        configurationStore.save(copy(next));
        entry.state = next;
    }

    private static DataSource copy(DataSource source) {
        return source.toBuilder().build();
    }

    private static final class Entry {
        private DataSource state;
        private String runId;

        private Entry(DataSource state) {
            this.state = state;
        }
    }
}
