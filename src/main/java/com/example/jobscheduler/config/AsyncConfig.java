package com.example.jobscheduler.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executors used outside the per-queue worker pools.
 */
@Slf4j
@EnableAsync
@Configuration
@RequiredArgsConstructor
public class AsyncConfig {

    private final JobSchedulerProperties properties;

    /**
     * Runs handler invocations so the executor can race them against a timeout.
     * Unbounded: a timed-out handler that ignores interruption keeps its thread
     * while the worker moves on.
     */
    @Bean(name = "jobHandlerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService jobHandlerExecutor() {
        log.info("Creating job handler executor");
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("job-handler-"));
    }

    /**
     * Task executor for Spring's @Async annotation (alerts).
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var poolSize = properties.getAsyncPoolSize();
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize * 2);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> log.warn("Async alert rejected, executor saturated"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        return executor;
    }
}
