package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Failure raised by a job handler's business logic.
 * <p>
 * The retryable flag is authoritative: the executor does not second-guess it
 * with message inspection.
 */
@Getter
public class JobHandlerException extends RuntimeException {

    private final String handlerType;
    private final boolean retryable;

    public JobHandlerException(String handlerType, String message, boolean retryable) {
        super(message);
        this.handlerType = handlerType;
        this.retryable = retryable;
    }

    public JobHandlerException(String handlerType, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.handlerType = handlerType;
        this.retryable = retryable;
    }

    public static JobHandlerException transientFailure(String handlerType, String message, Throwable cause) {
        return new JobHandlerException(handlerType, message, cause, true);
    }

    public static JobHandlerException fatal(String handlerType, String message) {
        return new JobHandlerException(handlerType, message, false);
    }
}
