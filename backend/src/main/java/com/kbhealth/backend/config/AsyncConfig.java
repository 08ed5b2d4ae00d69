package com.kbhealth.backend.config;

import java.time.Clock;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
@EnableScheduling
@Slf4j
public class AsyncConfig {

    /**
     * Worker pool fetching article pages, shared by every running pipeline.
     */
    @Bean
    public ThreadPoolTaskExecutor fetchTaskExecutor(ScrapingConfig scrapingConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(scrapingConfig.getWorkers());
        executor.setMaxPoolSize(scrapingConfig.getWorkers());
        executor.setQueueCapacity(1000);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Fetch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    /**
     * Task executor for sync-all sweeps, one task per source
     */
    @Bean
    public ThreadPoolTaskExecutor syncTaskExecutor(SyncConfig syncConfig) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(syncConfig.getMaxConcurrentSources());
        executor.setMaxPoolSize(syncConfig.getMaxConcurrentSources());
        executor.setQueueCapacity(200);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Sync-");
        executor.setRejectedExecutionHandler(rejectingHandler("Sync"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();
        return executor;
    }

    /**
     * Task executor for audit rule evaluations
     */
    @Bean
    public ThreadPoolTaskExecutor ruleTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setKeepAliveSeconds(60);
        executor.setThreadNamePrefix("Rule-");
        // Never run a rule on the caller, its timeout would not apply
        executor.setRejectedExecutionHandler(rejectingHandler("Rule"));
        executor.initialize();
        return executor;
    }

    /**
     * Rejects tasks of a saturated pool with a {@link RejectedExecutionException} so callers
     * can report the saturation.
     */
    public static RejectedExecutionHandler rejectingHandler(String poolName) {
        return (task, pool) -> {
            log.warn("{} task rejected, pool saturated (active={}, queued={})",
                    poolName, pool.getActiveCount(), pool.getQueue().size());
            throw new RejectedExecutionException(poolName + " pool saturated");
        };
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
