package com.example.jobscheduler.service.executor;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a single physical attempt: a handler result, or a classified failure.
 */
@Value
@Builder(toBuilder = true)
public class AttemptOutcome {

    private static final int MAX_STACK_LINES = 20;
    private static final int MAX_STACK_LENGTH = 4000;

    boolean success;

    String result;

    FailureKind failureKind;

    String errorMessage;

    /**
     * Simple class name of the failure, for logs and metrics
     */
    String errorType;

    String stackTrace;

    public static AttemptOutcome success(String result) {
        return AttemptOutcome.builder()
                .success(true)
                .result(result)
                .build();
    }

    public static AttemptOutcome failure(Throwable error, FailureKind kind) {
        return AttemptOutcome.builder()
                .success(false)
                .failureKind(kind)
                .errorMessage(error.getMessage() != null ? error.getMessage() : error.getClass().getName())
                .errorType(error.getClass().getSimpleName())
                .stackTrace(truncateStackTrace(error))
                .build();
    }

    /**
     * Non-retryable failure without an exception behind it
     */
    public static AttemptOutcome fatal(String errorMessage, String errorType) {
        return AttemptOutcome.builder()
                .success(false)
                .failureKind(FailureKind.FATAL)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    public boolean isRetryable() {
        return !success && failureKind != null && failureKind.isRetryable();
    }

    /**
     * Copy of a successful outcome with its result prefixed by the retry that produced it
     */
    public AttemptOutcome onRetry(int retryNumber) {
        return toBuilder()
                .result(String.format("succeeded on retry %d: %s", retryNumber, result))
                .build();
    }

    /**
     * Truncate stack trace to prevent database overflow
     */
    static String truncateStackTrace(Throwable e) {
        if (e == null) return null;

        var sb = new StringBuilder();
        sb.append(e.getClass().getName()).append(": ").append(e.getMessage()).append("\n");

        var trace = e.getStackTrace();
        var maxLines = Math.min(trace.length, MAX_STACK_LINES);
        for (var i = 0; i < maxLines; i++) {
            sb.append("\tat ").append(trace[i]).append("\n");
        }
        if (trace.length > maxLines) {
            sb.append("\t... ").append(trace.length - maxLines).append(" more\n");
        }

        var result = sb.toString();
        if (result.length() > MAX_STACK_LENGTH) {
            result = result.substring(0, MAX_STACK_LENGTH) + "...";
        }
        return result;
    }
}
