package com.example.jobscheduler.service.policy;

import lombok.Value;

import java.time.Duration;

/**
 * Resources granted to a job by its priority.
 */
@Value
public class ExecutionBudget {

    /**
     * Worker queue the job is dispatched to
     */
    String queue;

    /**
     * Upper bound for a single attempt
     */
    Duration timeout;

    /**
     * Retries after the first attempt; total attempts is maxRetries + 1
     */
    int maxRetries;

    public long getTimeoutSeconds() {
        return timeout.toSeconds();
    }
}
