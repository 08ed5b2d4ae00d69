package com.kbhealth.backend.scraping;

import com.kbhealth.backend.article.ArticleStore;
import com.kbhealth.backend.config.SourceDefinition;
import com.kbhealth.backend.config.SyncConfig;
import com.kbhealth.backend.exception.FatalSourceException;
import com.kbhealth.backend.exception.PageFetchException;
import com.kbhealth.backend.model.dto.FetchOptions;
import com.kbhealth.backend.model.entity.DataSource;
import com.kbhealth.backend.source.SourceDefinitionService;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Entry point of a source walk: fetches the index page, discovers the category listings and
 * hands back a lazy {@link FetchRun} over the article outcomes.
 */
@Service
@Slf4j
public class FetchPipeline {

    private final RetryingFetcher retryingFetcher;
    private final UrlDiscoveryService urlDiscoveryService;
    private final ArticleExtractorService articleExtractorService;
    private final SourceDefinitionService definitionService;
    private final ArticleStore articleStore;
    private final SyncConfig syncConfig;
    private final Executor fetchTaskExecutor;
    private final Clock clock;

    public FetchPipeline(RetryingFetcher retryingFetcher,
                         UrlDiscoveryService urlDiscoveryService,
                         ArticleExtractorService articleExtractorService,
                         SourceDefinitionService definitionService,
                         ArticleStore articleStore,
                         SyncConfig syncConfig,
                         @Qualifier("fetchTaskExecutor") Executor fetchTaskExecutor,
                         Clock clock) {
        this.retryingFetcher = retryingFetcher;
        this.urlDiscoveryService = urlDiscoveryService;
        this.articleExtractorService = articleExtractorService;
        this.definitionService = definitionService;
        this.articleStore = articleStore;
        this.syncConfig = syncConfig;
        this.fetchTaskExecutor = fetchTaskExecutor;
        this.clock = clock;
    }

    /**
     * @throws FatalSourceException when the index page cannot be fetched after retries
     */
    public FetchRun fetch(DataSource source, FetchOptions options, SyncCancellation cancellation) {
        SourceDefinition definition = definitionService.resolve(source);
        int maxPerCategory = resolveMaxArticlesPerCategory(source, options);

        FetchedPage index;
        try {
            index = retryingFetcher.fetch(source.getBaseUrl());
        } catch (PageFetchException e) {
            log.error("Index page of {} unreachable: {}", source.getId(), e.getMessage());
            throw new FatalSourceException(source.getId(),
                    "Index page of " + source.getId() + " unreachable: " + e.getMessage(), e);
        }

        List<String> categoryUrls = urlDiscoveryService.discoverCategoryUrls(index.getDocument(), definition);
        log.info("Walking {}: {} categories, up to {} articles each (forceRefresh={})",
                source.getId(), categoryUrls.size(), maxPerCategory, options.isForceRefresh());

        return new FetchRun(source.getId(), definition, maxPerCategory, options.isForceRefresh(), cancellation,
                index, categoryUrls, retryingFetcher, urlDiscoveryService, articleExtractorService,
                articleStore, fetchTaskExecutor, clock);
    }

    int resolveMaxArticlesPerCategory(DataSource source, FetchOptions options) {
        if (options.getMaxArticlesPerCategory() != null) {
            return Math.max(0, options.getMaxArticlesPerCategory());
        }
        if (source.getMaxArticlesPerCategory() != null) {
            return Math.max(0, source.getMaxArticlesPerCategory());
        }
        return syncConfig.getDefaultMaxArticlesPerCategory();
    }
}
