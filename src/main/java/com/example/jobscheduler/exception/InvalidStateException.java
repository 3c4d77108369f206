package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for an illegal lifecycle transition
 */
@Getter
public class InvalidStateException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;
    private final String currentState;
    private final String requestedTransition;

    public InvalidStateException(String resourceType, Object resourceId, Object currentState, String requestedTransition) {
        super(String.format("Cannot %s %s %s in state %s", requestedTransition, resourceType.toLowerCase(), resourceId, currentState));
        this.resourceType = resourceType;
        this.resourceId = String.valueOf(resourceId);
        this.currentState = String.valueOf(currentState);
        this.requestedTransition = requestedTransition;
    }
}
