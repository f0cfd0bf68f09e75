package com.faastrace.core.service.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Async configuration.
 *
 * Record fetches and Neo4j exports run on their own thread pools. Trace
 * reconstruction itself stays on the thread that started the run.
 */
@Slf4j
@Configuration
@EnableAsync
@RequiredArgsConstructor
public class AsyncConfig {

    private final IngestionConfig ingestionConfig;

    // ==================== Executor Beans ====================

    /**
     * Executor for record fetches ahead of the merger.
     */
    @Bean(name = "prefetchExecutor")
    public ThreadPoolTaskExecutor prefetchExecutor() {
        var prefetch = ingestionConfig.getPrefetch();
        log.info("Initializing prefetch executor with {}-{} threads",
                prefetch.getCoreThreads(), prefetch.getMaxThreads());
        return createThreadPool("prefetch-", prefetch.getCoreThreads(), prefetch.getMaxThreads(),
                Math.max(prefetch.getWindowSize(), 1) * 2);
    }

    /**
     * Executor for export operations (Neo4j).
     */
    @Bean(name = "exportExecutor")
    public ThreadPoolTaskExecutor exportExecutor() {
        log.info("Initializing export executor");
        return createThreadPool("export-", 1, 2, 50);
    }

    // ==================== Helper Methods ====================

    private ThreadPoolTaskExecutor createThreadPool(String prefix, int coreSize,
                                                    int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(Math.max(coreSize, maxSize));
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
