package com.example.jobscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for an id that does not resolve to a job, schedule or execution log
 */
@Getter
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public ResourceNotFoundException(String resourceType, UUID resourceId) {
        this(resourceType, String.valueOf(resourceId));
    }

    public static ResourceNotFoundException job(UUID jobId) {
        return new ResourceNotFoundException("Job", jobId);
    }

    public static ResourceNotFoundException schedule(UUID scheduleId) {
        return new ResourceNotFoundException("Schedule", scheduleId);
    }
}
