package com.kbhealth.backend.scraping;

import com.kbhealth.backend.config.ScrapingConfig;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HostRateLimiterTest {

    @Test
    @DisplayName("At most max-concurrent-per-host requests run against one host")
    void capsConcurrencyPerHost() throws Exception {
        // given
        ScrapingConfig config = new ScrapingConfig();
        config.setMaxConcurrentPerHost(2);
        HostRateLimiter limiter = new HostRateLimiter(config);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(6);
        CountDownLatch done = new CountDownLatch(12);

        // when
        for (int i = 0; i < 12; i++) {
            pool.execute(() -> {
                try (HostRateLimiter.Permit ignored = limiter.acquire("https://help.acme.io/articles/" + System.nanoTime())) {
                    int now = inFlight.incrementAndGet();
                    maxInFlight.accumulateAndGet(now, Math::max);
                    Thread.sleep(20);
                    inFlight.decrementAndGet();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        // then
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        pool.shutdownNow();
        assertThat(maxInFlight.get()).isLessThanOrEqualTo(2);
        assertThat(limiter.availablePermits("help.acme.io")).isEqualTo(2);
    }

    @Test
    @DisplayName("Hosts do not share permits")
    void hostsAreIndependent() throws Exception {
        // given
        ScrapingConfig config = new ScrapingConfig();
        config.setMaxConcurrentPerHost(1);
        HostRateLimiter limiter = new HostRateLimiter(config);

        // when
        HostRateLimiter.Permit first = limiter.acquire("https://a.acme.io/x");
        HostRateLimiter.Permit second = limiter.acquire("https://b.acme.io/x");

        // then
        assertThat(limiter.availablePermits("a.acme.io")).isZero();
        assertThat(limiter.availablePermits("b.acme.io")).isZero();
        first.close();
        second.close();
        first.close();
        assertThat(limiter.availablePermits("a.acme.io")).isEqualTo(1);
    }
}
