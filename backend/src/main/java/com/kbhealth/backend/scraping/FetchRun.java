package com.kbhealth.backend.scraping;

import com.kbhealth.backend.article.ArticleStore;
import com.kbhealth.backend.config.SourceDefinition;
import com.kbhealth.backend.exception.PageFetchException;
import com.kbhealth.backend.model.dto.ArticleDTO;
import com.kbhealth.backend.model.entity.Article;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;

/**
 * Lazy sequence of outcomes of one source walk.
 * <p>
 * Listings are walked on the consuming thread as outcomes are requested, and only when no
 * finished outcome is waiting; each newly discovered article URL is handed to the worker
 * pool and its outcome is delivered in completion order. Once the run is cancelled or closed no further listing is walked and
 * queued articles are dropped, while articles already being fetched still deliver their
 * outcome. Not thread-safe: one consumer per run.
 */
@Slf4j
public class FetchRun implements Iterator<FetchOutcome>, AutoCloseable {

    private final String sourceId;
    private final SourceDefinition definition;
    private final int maxArticlesPerCategory;
    private final boolean forceRefresh;
    private final SyncCancellation cancellation;

    private final RetryingFetcher fetcher;
    private final UrlDiscoveryService urlDiscoveryService;
    private final ArticleExtractorService extractor;
    private final ArticleStore articleStore;
    private final Executor executor;
    private final Clock clock;

    private FetchedPage initialListing;
    private final Deque<String> pendingListings = new ArrayDeque<>();
    // Canonical URLs already claimed by this run
    private final Set<String> seen = new HashSet<>();
    private final Deque<FetchOutcome> ready = new ArrayDeque<>();
    private final BlockingQueue<Optional<FetchOutcome>> completed = new LinkedBlockingQueue<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private int outstanding;
    private boolean cutShort;
    private int listingsWalked;
    private int articlesQueued;

    FetchRun(String sourceId, SourceDefinition definition, int maxArticlesPerCategory, boolean forceRefresh,
             SyncCancellation cancellation, FetchedPage index, List<String> categoryUrls,
             RetryingFetcher fetcher, UrlDiscoveryService urlDiscoveryService, ArticleExtractorService extractor,
             ArticleStore articleStore, Executor executor, Clock clock) {
        this.sourceId = sourceId;
        this.definition = definition;
        this.maxArticlesPerCategory = maxArticlesPerCategory;
        this.forceRefresh = forceRefresh;
        this.cancellation = cancellation;
        this.fetcher = fetcher;
        this.urlDiscoveryService = urlDiscoveryService;
        this.extractor = extractor;
        this.articleStore = articleStore;
        this.executor = executor;
        this.clock = clock;

        String indexUrl = CanonicalUrls.canonicalize(index.getRequestedUrl());
        if (indexUrl != null) {
            seen.add(indexUrl);
        }
        if (categoryUrls.isEmpty()) {
            this.initialListing = index;
        } else {
            for (String categoryUrl : new LinkedHashSet<>(categoryUrls)) {
                if (seen.add(categoryUrl)) {
                    pendingListings.add(categoryUrl);
                }
            }
        }
    }

    @Override
    public boolean hasNext() {
        while (true) {
            // Deliver finished articles before walking another listing
            drainCompleted();
            if (!ready.isEmpty()) {
                return true;
            }
            boolean listingsLeft = initialListing != null || !pendingListings.isEmpty();
            if (listingsLeft && !isStopped()) {
                walkNextListing();
                continue;
            }
            if (listingsLeft) {
                cutShort = true;
            }
            if (outstanding == 0) {
                return false;
            }
            try {
                accept(completed.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Fetch run for {} interrupted with {} articles in flight", sourceId, outstanding);
                cutShort = true;
                close();
                return false;
            }
        }
    }

    @Override
    public FetchOutcome next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        return ready.poll();
    }

    /**
     * Stops the walk; articles not yet started are dropped.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.debug("Fetch run for {} closed after {} listings and {} queued articles",
                    sourceId, listingsWalked, articlesQueued);
        }
    }

    /**
     * True when cancellation or close skipped listings or queued articles.
     */
    public boolean isCutShort() {
        return cutShort;
    }

    public int getListingsWalked() {
        return listingsWalked;
    }

    public int getArticlesQueued() {
        return articlesQueued;
    }

    private void drainCompleted() {
        Optional<FetchOutcome> next;
        while ((next = completed.poll()) != null) {
            accept(next);
        }
    }

    // Empty marks an article dropped because the run stopped before it started
    private void accept(Optional<FetchOutcome> next) {
        outstanding--;
        if (next.isPresent()) {
            ready.add(next.get());
        } else {
            cutShort = true;
        }
    }

    private boolean isStopped() {
        return closed.get() || cancellation.isCancelled();
    }

    private void walkNextListing() {
        FetchedPage listing;
        if (initialListing != null) {
            listing = initialListing;
            initialListing = null;
        } else {
            String listingUrl = pendingListings.poll();
            try {
                listing = fetcher.fetch(listingUrl);
            } catch (PageFetchException e) {
                log.warn("Listing {} of {} failed: {}", listingUrl, sourceId, e.getMessage());
                ready.add(FetchOutcome.failed(listingUrl, e.getMessage(), e.getStatusCode(), e.isTransient()));
                return;
            }
        }
        listingsWalked++;

        String category = urlDiscoveryService.categoryName(listing.getDocument());
        List<String> links = urlDiscoveryService.discoverArticleUrls(listing.getDocument(), definition);

        // The cap counts only URLs this run has not claimed through another listing
        int accepted = 0;
        for (String url : links) {
            if (accepted >= maxArticlesPerCategory) {
                break;
            }
            if (!seen.add(url)) {
                continue;
            }
            accepted++;
            submit(url, category);
        }
        log.debug("Listing {} ({}) queued {} of {} links", listing.getRequestedUrl(), category, accepted, links.size());
    }

    private void submit(String url, String category) {
        outstanding++;
        articlesQueued++;
        try {
            executor.execute(() -> {
                Optional<FetchOutcome> result = Optional.empty();
                try {
                    if (!isStopped()) {
                        result = Optional.of(fetchArticle(url, category));
                    }
                } catch (RuntimeException e) {
                    log.error("Unexpected error fetching {}: {}", url, e.getMessage(), e);
                    result = Optional.of(FetchOutcome.failed(url, "Unexpected error: " + e.getMessage(), null, false));
                } finally {
                    completed.add(result);
                }
            });
        } catch (RejectedExecutionException e) {
            outstanding--;
            ready.add(FetchOutcome.failed(url, "Fetch worker pool rejected the task", null, true));
        }
    }

    private FetchOutcome fetchArticle(String url, String category) {
        ArticleDTO extracted;
        try {
            FetchedPage page = fetcher.fetch(url);
            extracted = extractor.extract(page, definition, category);
        } catch (PageFetchException e) {
            log.warn("Article {} failed: {}", url, e.getMessage());
            return FetchOutcome.failed(url, e.getMessage(), e.getStatusCode(), e.isTransient());
        }

        String articleId = Article.buildId(sourceId, url);
        if (!forceRefresh && extracted.getLastModifiedAt() != null) {
            Optional<Article> stored = articleStore.get(articleId);
            if (stored.isPresent() && extracted.getLastModifiedAt().equals(stored.get().getLastModifiedAt())) {
                log.debug("Article {} unchanged since {}", url, extracted.getLastModifiedAt());
                return FetchOutcome.unchanged(url);
            }
        }

        Article article = Article.builder()
                .id(articleId)
                .sourceId(sourceId)
                .url(url)
                .title(extracted.getTitle())
                .content(extracted.getContent())
                .summary(extracted.getSummary())
                .category(extracted.getCategory())
                .tags(new LinkedHashSet<>(extracted.getTags()))
                .lastModifiedAt(extracted.getLastModifiedAt())
                .author(extracted.getAuthor())
                .publicationStatus("published")
                .fetchedAt(LocalDateTime.now(clock))
                .build();
        return FetchOutcome.fetched(article);
    }
}
