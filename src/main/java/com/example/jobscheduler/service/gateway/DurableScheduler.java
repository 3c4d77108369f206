package com.example.jobscheduler.service.gateway;

import java.time.Instant;
import java.util.UUID;

/**
 * Persistent job store that fires executions at their due times and survives restarts.
 * <p>
 * Every registration is identified by an opaque handle. Implementations throw
 * {@link com.example.jobscheduler.exception.GatewayException} when the store is unavailable.
 */
public interface DurableScheduler {

    /**
     * Queue a single execution to run as soon as a worker of the queue is free.
     */
    String enqueueNow(UUID jobId, String queue);

    /**
     * Register a recurring execution driven by a six-field cron expression
     * (seconds first), bounded by optional start and end times.
     */
    String scheduleRecurring(UUID jobId, String queue, String cronExpression, Instant startTime, Instant endTime);

    /**
     * Register a single execution at a fixed time.
     */
    String scheduleOnce(UUID jobId, String queue, Instant runAt);

    /**
     * Remove a registration. Cancelling an unknown or already finished handle is a no-op.
     */
    void cancel(String handle);
}
