package com.quantinfo.collector.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Executors for ingestion work.
 * The ingestion pool bounds how many instrument refreshes are in flight at once;
 * the task executor runs the coordinating side of manual refresh requests.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    @Value("${market-data.ingestion.concurrency:5}")
    private int ingestionConcurrency;

    @Bean(name = "taskExecutor")
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(20);
        executor.setThreadNamePrefix("RefreshCoordinator-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "ingestionExecutorService", destroyMethod = "shutdownNow")
    public ExecutorService ingestionExecutorService() {
        if (ingestionConcurrency <= 0) {
            throw new IllegalStateException(
                    "market-data.ingestion.concurrency must be positive, was " + ingestionConcurrency);
        }
        log.info("Creating ingestion pool with {} workers", ingestionConcurrency);
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(ingestionConcurrency,
                r -> {
                    Thread thread = new Thread(r);
                    thread.setName("IngestionWorker-" + counter.incrementAndGet());
                    thread.setDaemon(false);
                    return thread;
                });
    }
}
