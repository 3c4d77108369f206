package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for malformed input: empty names, bad trigger expressions, non-positive intervals
 */
@Getter
public class JobValidationException extends RuntimeException {

    private final String field;

    public JobValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
