package com.example.jobscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A single attempt exceeded the timeout derived from the job's priority
 */
@Getter
public class JobTimeoutException extends RuntimeException {

    private final UUID jobId;
    private final long timeoutSeconds;

    public JobTimeoutException(UUID jobId, long timeoutSeconds) {
        super(String.format("Job execution timed out after %ds", timeoutSeconds));
        this.jobId = jobId;
        this.timeoutSeconds = timeoutSeconds;
    }
}
