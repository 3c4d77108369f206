package com.example.jobscheduler.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler")
public class JobSchedulerProperties {

    /**
     * Polling interval in milliseconds for checking due triggers
     */
    @Min(100)
    private long pollIntervalMs = 1000;

    /**
     * Maximum number of due triggers claimed per poll cycle
     */
    @Min(1)
    private int batchSize = 100;

    /**
     * Base of the exponential retry backoff: attempt n waits base^n seconds
     */
    @Min(0)
    private int retryBaseDelaySeconds = 5;

    /**
     * Worker count per queue. Queue names must cover every name the priority policy produces.
     */
    @NotEmpty
    private Map<String, Integer> queues = defaultQueues();

    /**
     * Seconds to wait for in-flight executions on shutdown
     */
    @Min(0)
    private int shutdownAwaitSeconds = 30;

    /**
     * Refresh interval of the job and trigger gauges
     */
    @Min(1000)
    private long metricsUpdateIntervalMs = 60000;

    /**
     * Core size of the @Async alert executor
     */
    @Min(1)
    private int asyncPoolSize = 4;

    private static Map<String, Integer> defaultQueues() {
        var queues = new LinkedHashMap<String, Integer>();
        queues.put("critical", 4);
        queues.put("high", 4);
        queues.put("default", 8);
        queues.put("low", 2);
        return queues;
    }
}
