package com.kbhealth.backend.sync;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kbhealth.backend.config.ScrapingConfig;
import com.kbhealth.backend.config.SyncConfig;
import com.kbhealth.backend.exception.AlreadySyncingException;
import com.kbhealth.backend.exception.NotFoundException;
import com.kbhealth.backend.model.dto.FetchOptions;
import com.kbhealth.backend.model.dto.SyncResultDTO;
import com.kbhealth.backend.model.entity.DataSource;
import com.kbhealth.backend.model.enums.Platform;
import com.kbhealth.backend.model.enums.SyncStatus;
import com.kbhealth.backend.scraping.ArticleExtractorService;
import com.kbhealth.backend.scraping.FetchPipeline;
import com.kbhealth.backend.scraping.HostRateLimiter;
import com.kbhealth.backend.scraping.RetryingFetcher;
import com.kbhealth.backend.scraping.SyncCancellation;
import com.kbhealth.backend.scraping.UrlDiscoveryService;
import com.kbhealth.backend.source.SourceDefinitionService;
import com.kbhealth.backend.source.SourceRegistry;
import com.kbhealth.backend.support.InMemoryArticleStore;
import com.kbhealth.backend.support.InMemorySourceConfigurationStore;
import com.kbhealth.backend.support.ScriptedPageFetcher;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ByteArrayResource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SyncOrchestratorTest {

    private static final String BASE = "https://kb.acme.io/en";

    private ScrapingConfig scrapingConfig;
    private SyncConfig syncConfig;
    private Clock clock;
    private ScriptedPageFetcher pageFetcher;
    private InMemoryArticleStore articleStore;
    private SourceRegistry registry;
    private ExecutorService workers;
    private SyncOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        scrapingConfig = new ScrapingConfig();
        scrapingConfig.setBackoffBaseMs(0);
        syncConfig = new SyncConfig();
        syncConfig.setErrorSampleLimit(2);
        clock = Clock.fixed(Instant.parse("2026-10-01T00:00:00Z"), ZoneOffset.UTC);

        pageFetcher = new ScriptedPageFetcher();
        articleStore = new InMemoryArticleStore();
        workers = Executors.newFixedThreadPool(4);
        registry = new SourceRegistry(new InMemorySourceConfigurationStore(), clock);
        orchestrator = orchestratorWith(articleStore);

        registry.register(DataSource.builder()
                .id("acme")
                .name("Acme help")
                .platform(Platform.INTERCOM)
                .baseUrl(BASE)
                .build());
        pageFetcher.page(BASE, "<a href=\"/en/collections/1-payments\">Payments</a>");
        pageFetcher.page(BASE + "/collections/1-payments", "<h1>Payments</h1>"
                + "<a href=\"/en/articles/p1\">p1</a>"
                + "<a href=\"/en/articles/p2\">p2</a>"
                + "<a href=\"/en/articles/gone-1\">gone</a>"
                + "<a href=\"/en/articles/gone-2\">gone</a>"
                + "<a href=\"/en/articles/gone-3\">gone</a>");
        pageFetcher.page(BASE + "/articles/p1", article("p1"));
        pageFetcher.page(BASE + "/articles/p2", article("p2"));
    }

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    @DisplayName("Successful sync stores articles, counts item errors and marks the source SUCCESS")
    void syncOneSucceeds() {
        // when
        SyncResultDTO result = orchestrator.syncOne("acme", FetchOptions.defaults());

        // then
        assertThat(result.getStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(result.getArticlesFound()).isEqualTo(2);
        assertThat(result.getErrors()).isEqualTo(3);
        assertThat(result.getErrorSamples()).hasSize(2);
        assertThat(result.getMessage()).isEqualTo("Completed with 3 item errors");
        assertThat(articleStore.countBySource("acme")).isEqualTo(2);

        DataSource source = registry.get("acme");
        assertThat(source.getStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(source.getSyncCount()).isEqualTo(1);
        assertThat(source.getArticlesCount()).isEqualTo(2);
        assertThat(orchestrator.isRunning("acme")).isFalse();
    }

    @Test
    @DisplayName("Second sync of unchanged articles upserts nothing unless a refresh is forced")
    void resyncReportsUnchanged() {
        // given
        orchestrator.syncOne("acme", FetchOptions.defaults());
        int upsertsAfterFirstSync = articleStore.getUpsertCount();

        // when
        SyncResultDTO result = orchestrator.syncOne("acme", FetchOptions.defaults());

        // then
        assertThat(result.getArticlesFound()).isZero();
        assertThat(result.getArticlesUnchanged()).isEqualTo(2);
        assertThat(articleStore.getUpsertCount()).isEqualTo(upsertsAfterFirstSync);
        assertThat(registry.get("acme").getArticlesCount()).isEqualTo(2);

        SyncResultDTO forced = orchestrator.syncOne("acme", FetchOptions.builder().forceRefresh(true).build());
        assertThat(forced.getArticlesFound()).isEqualTo(2);
        assertThat(articleStore.getUpsertCount()).isEqualTo(upsertsAfterFirstSync + 2);
    }

    @Test
    @DisplayName("Unreachable index page marks the source ERROR with the reason")
    void fatalFailure() {
        // given
        registry.register(DataSource.builder().id("down").name("Down").baseUrl("https://down.acme.io").build());

        // when
        SyncResultDTO result = orchestrator.syncOne("down", FetchOptions.defaults());

        // then
        assertThat(result.getStatus()).isEqualTo(SyncStatus.ERROR);
        DataSource source = registry.get("down");
        assertThat(source.getStatus()).isEqualTo(SyncStatus.ERROR);
        assertThat(source.getErrorCount()).isEqualTo(1);
        assertThat(source.getLastError()).contains("unreachable");
        assertThat(source.getLastSyncAt()).isNull();
    }

    @Test
    @DisplayName("Cancelled run ends CANCELLED and the source can sync again")
    void cancelledRun() {
        // given
        SyncCancellation cancellation = SyncCancellation.none();
        cancellation.cancel();

        // when
        SyncResultDTO result = orchestrator.syncOne("acme", FetchOptions.defaults(), cancellation);

        // then
        assertThat(result.getStatus()).isEqualTo(SyncStatus.CANCELLED);
        assertThat(result.getMessage()).isEqualTo("Cancelled by request");
        assertThat(registry.get("acme").getStatus()).isEqualTo(SyncStatus.CANCELLED);
        assertThat(registry.get("acme").getSyncCount()).isZero();
        assertThat(orchestrator.syncOne("acme", FetchOptions.defaults()).getStatus()).isEqualTo(SyncStatus.SUCCESS);
    }

    @Test
    @DisplayName("Exceeded budget ends the run CANCELLED")
    void budgetExceeded() {
        // when
        SyncResultDTO result = orchestrator.syncOne("acme", FetchOptions.defaults(),
                SyncCancellation.withBudget(Duration.ofMillis(-1)));

        // then
        assertThat(result.getStatus()).isEqualTo(SyncStatus.CANCELLED);
        assertThat(result.getMessage()).isEqualTo("Sync budget exceeded");
    }

    @Test
    @DisplayName("Source with a run in flight rejects another sync")
    void alreadySyncing() {
        // given
        registry.beginSync("acme");

        // when / then
        assertThatThrownBy(() -> orchestrator.syncOne("acme", FetchOptions.defaults()))
                .isInstanceOf(AlreadySyncingException.class);
        assertThatThrownBy(() -> orchestrator.syncOne("nope", FetchOptions.defaults()))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Sync of all sources isolates failures and skips busy and disabled sources")
    void syncAllIsolatesFailures() {
        // given
        registry.register(DataSource.builder().id("down").name("Down").baseUrl("https://down.acme.io").build());
        registry.register(DataSource.builder().id("busy").name("Busy").baseUrl("https://busy.acme.io").build());
        registry.register(DataSource.builder().id("off").name("Off").baseUrl("https://off.acme.io").build());
        registry.setEnabled("off", false);
        registry.beginSync("busy");

        // when
        Map<String, SyncResultDTO> results = orchestrator.syncAll(FetchOptions.defaults());

        // then
        assertThat(results).containsOnlyKeys("acme", "busy", "down");
        assertThat(results.get("acme").getStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(results.get("down").getStatus()).isEqualTo(SyncStatus.ERROR);
        assertThat(results.get("busy").getStatus()).isEqualTo(SyncStatus.SYNCING);
        assertThat(registry.get("off").getStatus()).isEqualTo(SyncStatus.IDLE);
    }

    @Test
    @DisplayName("Cancel without a run in flight reports false")
    void cancelIdleSource() {
        assertThat(orchestrator.cancel("acme")).isFalse();
        assertThatThrownBy(() -> orchestrator.cancel("nope")).isInstanceOf(NotFoundException.class);
    }

    @Test
    @DisplayName("Store failure after the walk ends the run ERROR and frees the source")
    void failureAfterWalkReleasesSource() {
        // given
        SyncOrchestrator failing = orchestratorWith(new InMemoryArticleStore() {
            @Override
            public long countBySource(String sourceId) {
                throw new IllegalStateException("store down");
            }
        });

        // when
        SyncResultDTO result = failing.syncOne("acme", FetchOptions.defaults());

        // then
        assertThat(result.getStatus()).isEqualTo(SyncStatus.ERROR);
        assertThat(result.getMessage()).isEqualTo("Unexpected error: store down");
        assertThat(result.getArticlesFound()).isEqualTo(2);
        DataSource source = registry.get("acme");
        assertThat(source.getStatus()).isEqualTo(SyncStatus.ERROR);
        assertThat(source.getLastError()).isEqualTo("Unexpected error: store down");
        assertThat(failing.isRunning("acme")).isFalse();
        assertThat(orchestrator.syncOne("acme", FetchOptions.defaults()).getStatus()).isEqualTo(SyncStatus.SUCCESS);
    }

    @Test
    @DisplayName("Cancel arriving after every outcome was processed still ends SUCCESS")
    void lateCancelIsSuccess() {
        // given
        SyncCancellation cancellation = SyncCancellation.none();
        SyncOrchestrator lateCancel = orchestratorWith(new InMemoryArticleStore() {
            @Override
            public long countBySource(String sourceId) {
                cancellation.cancel();
                return super.countBySource(sourceId);
            }
        });

        // when
        SyncResultDTO result = lateCancel.syncOne("acme", FetchOptions.defaults(), cancellation);

        // then
        assertThat(result.getStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(result.getArticlesFound()).isEqualTo(2);
        assertThat(registry.get("acme").getStatus()).isEqualTo(SyncStatus.SUCCESS);
        assertThat(registry.get("acme").getSyncCount()).isEqualTo(1);
    }

    private SyncOrchestrator orchestratorWith(InMemoryArticleStore store) {
        FetchPipeline pipeline = new FetchPipeline(
                new RetryingFetcher(pageFetcher, new HostRateLimiter(scrapingConfig), scrapingConfig),
                new UrlDiscoveryService(scrapingConfig),
                new ArticleExtractorService(scrapingConfig, new ObjectMapper()),
                new SourceDefinitionService(new ByteArrayResource(new byte[0])),
                store,
                syncConfig,
                workers,
                clock);
        return new SyncOrchestrator(registry, pipeline, store, syncConfig, Runnable::run);
    }

    private static String article(String slug) {
        return "<html><head><meta property=\"article:modified_time\" content=\"2026-01-10T00:00:00Z\"></head>"
                + "<body><h1>Article " + slug + "</h1><div class=\"article-content\"><p>Body of " + slug
                + ".</p></div></body></html>";
    }
}
