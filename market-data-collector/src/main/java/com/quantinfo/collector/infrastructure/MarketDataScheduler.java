package com.quantinfo.collector.infrastructure;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Owns the periodic ingestion tasks and their threads.
 * Started automatically once the application is ready when {@code scheduler.enabled} is set,
 * and on demand through {@link #start()} otherwise.
 */
@Slf4j
public class MarketDataScheduler {

    private static final long STOP_TIMEOUT_SECONDS = 30;

    private final List<PeriodicTask> tasks;
    private final boolean autoStart;

    // guarded by this
    private ExecutorService executor;

    public MarketDataScheduler(List<PeriodicTask> tasks, boolean autoStart) {
        this.tasks = List.copyOf(tasks);
        this.autoStart = autoStart;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!autoStart) {
            log.info("Scheduler auto-start is disabled");
            return;
        }
        start();
    }

    /**
     * Start every task on a dedicated thread. Calling start on a running scheduler is a no-op.
     */
    public synchronized void start() {
        if (executor != null) {
            log.warn("Scheduler is already running");
            return;
        }
        log.info("Starting scheduler with {} tasks", tasks.size());
        executor = Executors.newFixedThreadPool(tasks.size(), r -> {
            Thread thread = new Thread(r);
            thread.setName("MarketDataScheduler-" + thread.getId());
            thread.setDaemon(true);
            return thread;
        });
        for (PeriodicTask task : tasks) {
            task.reset();
            executor.submit(task);
            log.info("Started {}", task.getName());
        }
    }

    /**
     * Signal every task, interrupt their sleeps and wait for them to finish.
     */
    @PreDestroy
    public synchronized void stop() {
        if (executor == null) {
            return;
        }
        log.info("Stopping scheduler...");
        tasks.forEach(PeriodicTask::stop);
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(STOP_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Scheduler tasks did not terminate within {}s", STOP_TIMEOUT_SECONDS);
            } else {
                log.info("Scheduler stopped");
            }
        } catch (InterruptedException e) {
            log.error("Interrupted while waiting for scheduler tasks to stop", e);
            Thread.currentThread().interrupt();
        } finally {
            executor = null;
        }
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isTerminated();
    }

    public List<String> getTaskNames() {
        return tasks.stream().map(PeriodicTask::getName).collect(Collectors.toList());
    }
}
