package com.kbhealth.backend.source;

import com.kbhealth.backend.exception.AlreadySyncingException;
import com.kbhealth.backend.exception.NotFoundException;
import com.kbhealth.backend.model.entity.DataSource;
import com.kbhealth.backend.model.enums.SyncStatus;
import com.kbhealth.backend.support.InMemorySourceConfigurationStore;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SourceRegistryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 10, 1, 9, 0);

    private InMemorySourceConfigurationStore store;
    private Clock clock;
    private SourceRegistry registry;

    @BeforeEach
    void setUp() {
        store = new InMemorySourceConfigurationStore();
        clock = Clock.fixed(NOW.toInstant(ZoneOffset.UTC), ZoneOffset.UTC);
        registry = new SourceRegistry(store, clock);
        registry.register(source("s1"));
    }

    @Test
    @DisplayName("Second beginSync without completeSync fails with AlreadySyncing")
    void doubleBeginSyncFails() {
        // given
        registry.beginSync("s1");

        // when / then
        assertThatThrownBy(() -> registry.beginSync("s1"))
                .isInstanceOf(AlreadySyncingException.class)
                .hasMessageContaining("s1");
        assertThat(registry.get("s1").getStatus()).isEqualTo(SyncStatus.SYNCING);
    }

    @Test
    @DisplayName("Failed write of the run's end still releases the source")
    void completeSyncReleasesClaimWhenStoreFails() {
        // given
        SyncTicket ticket = registry.beginSync("s1");
        store.setFailing(true);

        // when / then
        assertThatThrownBy(() -> registry.completeSync(ticket, SyncOutcome.error("boom")))
                .hasMessage("configuration store down");
        assertThat(registry.get("s1").getStatus()).isEqualTo(SyncStatus.ERROR);

        store.setFailing(false);
        assertThat(registry.beginSync("s1")).isNotNull();
    }

    @Test
    @DisplayName("Concurrent beginSync calls have exactly one winner")
    void concurrentBeginSyncHasOneWinner() throws Exception {
        // given
        int contenders = 8;
        ExecutorService pool = Executors.newFixedThreadPool(contenders);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> attempts = new ArrayList<>();
        for (int i = 0; i < contenders; i++) {
            Callable<Boolean> attempt = () -> {
                start.await();
                try {
                    registry.beginSync("s1");
                    return true;
                } catch (AlreadySyncingException e) {
                    return false;
                }
            };
            attempts.add(pool.submit(attempt));
        }

        // when
        start.countDown();
        int winners = 0;
        for (Future<Boolean> attempt : attempts) {
            if (attempt.get()) {
                winners++;
            }
        }
        pool.shutdown();

        // then
        assertThat(winners).isEqualTo(1);
    }

    @Test
    @DisplayName("Successful sync records time, count and articles and clears the last error")
    void completeSyncSuccess() {
        // given
        SyncTicket failedRun = registry.beginSync("s1");
        registry.completeSync(failedRun, SyncOutcome.error("boom"));
        SyncTicket ticket = registry.beginSync("s1");

        // when
        DataSource result = registry.completeSync(ticket, SyncOutcome.success(12));

        // then
        assertThat(result.getStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(result.getLastSyncAt()).isEqualTo(NOW);
        assertThat(result.getSyncCount()).isEqualTo(1);
        assertThat(result.getErrorCount()).isEqualTo(1);
        assertThat(result.getArticlesCount()).isEqualTo(12);
        assertThat(result.getLastError()).isNull();
        assertThat(store.findById("s1")).get().extracting(DataSource::getStatus).isEqualTo(SyncStatus.SUCCESS);
    }

    @Test
    @DisplayName("Failed sync keeps the last successful sync time and article count")
    void completeSyncErrorKeepsLastSuccess() {
        // given
        registry.completeSync(registry.beginSync("s1"), SyncOutcome.success(7));
        SyncTicket ticket = registry.beginSync("s1");

        // when
        DataSource result = registry.completeSync(ticket, SyncOutcome.error("Index page unreachable"));

        // then
        assertThat(result.getStatus()).isEqualTo(SyncStatus.ERROR);
        assertThat(result.getErrorCount()).isEqualTo(1);
        assertThat(result.getSyncCount()).isEqualTo(1);
        assertThat(result.getLastSyncAt()).isEqualTo(NOW);
        assertThat(result.getArticlesCount()).isEqualTo(7);
        assertThat(result.getLastError()).isEqualTo("Index page unreachable");
    }

    @Test
    @DisplayName("Cancelled sync leaves counters alone and refreshes the article count")
    void completeSyncCancelled() {
        // given
        SyncTicket ticket = registry.beginSync("s1");

        // when
        DataSource result = registry.completeSync(ticket, SyncOutcome.cancelled(3));

        // then
        assertThat(result.getStatus()).isEqualTo(SyncStatus.CANCELLED);
        assertThat(result.getSyncCount()).isZero();
        assertThat(result.getErrorCount()).isZero();
        assertThat(result.getLastSyncAt()).isNull();
        assertThat(result.getArticlesCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("A ticket of an earlier run cannot complete the current one")
    void staleTicketIsRejected() {
        // given
        SyncTicket first = registry.beginSync("s1");
        registry.completeSync(first, SyncOutcome.success(1));
        registry.beginSync("s1");

        // when / then
        assertThatThrownBy(() -> registry.completeSync(first, SyncOutcome.success(2)))
                .isInstanceOf(IllegalStateException.class);
        assertThat(registry.get("s1").getStatus()).isEqualTo(SyncStatus.SYNCING);
    }

    @Test
    @DisplayName("Unknown source ids fail with NotFound")
    void unknownSource() {
        assertThatThrownBy(() -> registry.get("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.beginSync("nope")).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> registry.setEnabled("nope", false)).isInstanceOf(NotFoundException.class);
        assertThat(registry.exists("nope")).isFalse();
    }

    @Test
    @DisplayName("Re-registering refreshes configuration but keeps counters and the enabled flag")
    void reRegisterKeepsState() {
        // given
        registry.completeSync(registry.beginSync("s1"), SyncOutcome.success(4));
        registry.setEnabled("s1", false);

        // when
        DataSource result = registry.register(source("s1").toBuilder()
                .name("Renamed")
                .baseUrl("https://new.acme.io")
                .enabled(true)
                .build());

        // then
        assertThat(result.getName()).isEqualTo("Renamed");
        assertThat(result.getBaseUrl()).isEqualTo("https://new.acme.io");
        assertThat(result.isEnabled()).isFalse();
        assertThat(result.getSyncCount()).isEqualTo(1);
        assertThat(result.getArticlesCount()).isEqualTo(4);
    }

    @Test
    @DisplayName("A sync interrupted by a restart is reset to idle on load")
    void restartResetsSyncing() {
        // given
        registry.beginSync("s1");
        registry.register(source("s2"));

        // when
        SourceRegistry restarted = new SourceRegistry(store, clock);
        restarted.loadFromStore();

        // then
        assertThat(restarted.get("s1").getStatus()).isEqualTo(SyncStatus.IDLE);
        assertThat(store.findById("s1")).get().extracting(DataSource::getStatus).isEqualTo(SyncStatus.IDLE);
        assertThat(restarted.list()).extracting(DataSource::getId).containsExactly("s1", "s2");
        assertThat(restarted.beginSync("s1")).isNotNull();
    }

    @Test
    @DisplayName("Only enabled sources are listed for sweeps")
    void listEnabled() {
        // given
        registry.register(source("s2"));
        registry.setEnabled("s1", false);

        // when / then
        assertThat(registry.listEnabled()).extracting(DataSource::getId).containsExactly("s2");
        assertThat(registry.list()).hasSize(2);
    }

    @Test
    @DisplayName("Callers receive copies, not live registry state")
    void returnsCopies() {
        // given
        DataSource copy = registry.get("s1");

        // when
        copy.setStatus(SyncStatus.ERROR);

        // then
        assertThat(registry.get("s1").getStatus()).isEqualTo(SyncStatus.IDLE);
    }

    private static DataSource source(String id) {
        return DataSource.builder()
                .id(id)
                .name("Source " + id)
                .baseUrl("https://" + id + ".acme.io")
                .build();
    }
}
