package com.kbhealth.backend.scraping;

import com.kbhealth.backend.config.ScrapingConfig;
import com.kbhealth.backend.exception.PageFetchException;
import java.util.concurrent.ThreadLocalRandom;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Fetches a page through the per-host limiter, retrying transient failures with exponential
 * backoff and jitter. Permanent failures are rethrown on the first attempt.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RetryingFetcher {

    private final PageFetcher pageFetcher;
    private final HostRateLimiter hostRateLimiter;
    private final ScrapingConfig scrapingConfig;

    public FetchedPage fetch(String url) {
        int attempts = 1 + Math.max(0, scrapingConfig.getMaxRetries());
        PageFetchException lastFailure = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            if (attempt > 0) {
                sleepBeforeRetry(url, attempt, lastFailure);
            }
            try (HostRateLimiter.Permit ignored = hostRateLimiter.acquire(url)) {
                return pageFetcher.fetch(url);
            } catch (PageFetchException e) {
                if (!e.isTransient()) {
                    log.debug("Permanent failure for {}: {}", url, e.getMessage());
                    throw e;
                }
                lastFailure = e;
                log.warn("Transient failure for {} (attempt {}/{}): {}", url, attempt + 1, attempts, e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw PageFetchException.permanent(url, "Interrupted while fetching " + url, e);
            }
        }

        log.warn("Giving up on {} after {} attempts", url, attempts);
        throw lastFailure;
    }

    long backoffDelayMs(int retry) {
        long base = scrapingConfig.getBackoffBaseMs();
        if (base <= 0) {
            return 0;
        }
        long exponential = base << Math.min(retry - 1, 20);
        long capped = Math.min(exponential, scrapingConfig.getBackoffMaxMs());
        // Jitter over the upper half of the capped delay
        return capped / 2 + ThreadLocalRandom.current().nextLong(capped / 2 + 1);
    }

    private void sleepBeforeRetry(String url, int retry, PageFetchException lastFailure) {
        long delay = backoffDelayMs(retry);
        if (delay <= 0) {
            return;
        }
        try {
            Thread.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PageFetchException(url, "Interrupted while backing off", false,
                    lastFailure != null ? lastFailure.getStatusCode() : null, e);
        }
    }
}
