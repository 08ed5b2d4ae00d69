package com.kbhealth.backend.scraping;

import com.kbhealth.backend.config.ScrapingConfig;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Semaphore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Caps outstanding requests per external host and optionally spaces consecutive requests to
 * the same host. Shared by every pipeline run in the process.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HostRateLimiter {

    private final ScrapingConfig scrapingConfig;
    private final Map<String, HostSlot> slots = new ConcurrentHashMap<>();

    /**
     * Blocks until the host admits one more request. The returned permit must be closed
     * when the request finishes.
     */
    public Permit acquire(String url) throws InterruptedException {
        String host = CanonicalUrls.hostOf(url);
        HostSlot slot = slots.computeIfAbsent(host != null ? host : "", h -> new HostSlot(scrapingConfig.getMaxConcurrentPerHost()));
        slot.semaphore.acquire();
        try {
            slot.awaitPoliteDelay(scrapingConfig.getPoliteDelayMs());
        } catch (InterruptedException e) {
            slot.semaphore.release();
            throw e;
        }
        return new Permit(slot);
    }

    int availablePermits(String host) {
        HostSlot slot = slots.get(host);
        return slot != null ? slot.semaphore.availablePermits() : scrapingConfig.getMaxConcurrentPerHost();
    }

    public static final class Permit implements AutoCloseable {
        private final HostSlot slot;
        private boolean released;

        private Permit(HostSlot slot) {
            this.slot = slot;
        }

        @Override
        public void close() {
            if (!released) {
                released = true;
                slot.semaphore.release();
            }
        }
    }

    private static final class HostSlot {
        private final Semaphore semaphore;
        private long lastRequestNanos;

        private HostSlot(int permits) {
            this.semaphore = new Semaphore(permits, true);
        }

        private synchronized void awaitPoliteDelay(long delayMs) throws InterruptedException {
            if (delayMs <= 0) {
                return;
            }
            long waitNanos = lastRequestNanos + delayMs * 1_000_000L - System.nanoTime();
            if (lastRequestNanos != 0 && waitNanos > 0) {
                Thread.sleep(waitNanos / 1_000_000L, (int) (waitNanos % 1_000_000L));
            }
            lastRequestNanos = System.nanoTime();
        }
    }
}
