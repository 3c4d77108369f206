package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a failed call against the durable scheduler
 */
@Getter
public class GatewayException extends RuntimeException {

    private final String operation;

    public GatewayException(String operation, String message, Throwable cause) {
        super(String.format("[%s] %s", operation, message), cause);
        this.operation = operation;
    }

    public GatewayException(String operation, Throwable cause) {
        this(operation, cause.getMessage(), cause);
    }
}
