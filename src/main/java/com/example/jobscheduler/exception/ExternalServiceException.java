package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for HTTP collaborator failures (callback targets)
 */
@Getter
public class ExternalServiceException extends RuntimeException {

    private final String target;
    private final Integer httpStatusCode;
    private final String responseBody;
    private final boolean retryable;

    public ExternalServiceException(String target, String message, Exception cause) {
        super(String.format("[%s] %s", target, message), cause);
        this.target = target;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public ExternalServiceException(String target, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", target, httpStatusCode, responseBody));
        this.target = target;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        // 4xx errors (except 408, 429) are not retryable
        this.retryable = httpStatusCode >= 500 || httpStatusCode == 408 || httpStatusCode == 429;
    }
}
