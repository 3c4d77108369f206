package com.example.jobscheduler.service.dispatch;

import com.example.jobscheduler.config.JobSchedulerProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * One fixed-size worker pool per named queue.
 * <p>
 * Each pool bounds how many executions of its queue run at once, so a flood of
 * low priority work never starves the critical queue.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueueWorkerPool {

    static final String FALLBACK_QUEUE = "default";

    private final JobSchedulerProperties properties;

    private final Map<String, ExecutorService> pools = new LinkedHashMap<>();

    @PostConstruct
    public void initialize() {
        properties.getQueues().forEach((queue, workers) -> {
            pools.put(queue, Executors.newFixedThreadPool(workers, new CustomizableThreadFactory("worker-" + queue + "-")));
            log.info("Started queue '{}' with {} workers", queue, workers);
        });
    }

    /**
     * Hand a unit of work to the pool of the given queue. Unknown queues fall back to the default pool.
     */
    public void submit(String queue, Runnable work) {
        var pool = pools.get(queue);
        if (pool == null) {
            log.warn("No worker pool for queue '{}', using '{}'", queue, FALLBACK_QUEUE);
            pool = pools.get(FALLBACK_QUEUE);
        }
        if (pool == null) {
            throw new IllegalStateException("No worker pool for queue: " + queue);
        }
        pool.execute(work);
    }

    /**
     * Stop accepting work and wait for in-flight executions. Workers still running
     * after the grace period are interrupted; their executions finalize as CANCELED.
     */
    @PreDestroy
    public void shutdown() {
        pools.values().forEach(ExecutorService::shutdown);
        var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(properties.getShutdownAwaitSeconds());
        for (var entry : pools.entrySet()) {
            try {
                var remaining = Math.max(0, deadline - System.nanoTime());
                if (!entry.getValue().awaitTermination(remaining, TimeUnit.NANOSECONDS)) {
                    log.warn("Queue '{}' did not drain in time, interrupting workers", entry.getKey());
                    entry.getValue().shutdownNow();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                entry.getValue().shutdownNow();
            }
        }
        log.info("Queue worker pools stopped");
    }
}
