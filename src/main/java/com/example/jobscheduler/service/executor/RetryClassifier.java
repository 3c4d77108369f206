package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.exception.JobHandlerException;
import com.example.jobscheduler.exception.JobTimeoutException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.sql.SQLTransientException;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeoutException;

/**
 * Decides whether a failed attempt is worth retrying.
 * <p>
 * A {@link JobHandlerException} carries an explicit flag and is taken at its word.
 * Other exceptions are retryable when they are timeouts, I/O (including socket) errors,
 * transient database errors, or when their message mentions timeout, network or deadlock.
 * The message check is a heuristic and can misfire on unrelated text.
 */
@Component
public class RetryClassifier {

    private static final List<String> TRANSIENT_MARKERS = List.of("timeout", "network", "deadlock");

    public FailureKind classify(Throwable error) {
        if (error instanceof JobTimeoutException || error instanceof TimeoutException) {
            return FailureKind.TIMEOUT;
        }
        if (error instanceof JobHandlerException handlerException) {
            return handlerException.isRetryable() ? FailureKind.TRANSIENT : FailureKind.FATAL;
        }
        if (error instanceof IOException
                || error instanceof TransientDataAccessException
                || error instanceof SQLTransientException) {
            return FailureKind.TRANSIENT;
        }
        if (mentionsTransientCondition(error.getMessage())) {
            return FailureKind.TRANSIENT;
        }
        return FailureKind.FATAL;
    }

    private boolean mentionsTransientCondition(String message) {
        if (message == null) {
            return false;
        }
        var lower = message.toLowerCase(Locale.ROOT);
        return TRANSIENT_MARKERS.stream().anyMatch(lower::contains);
    }
}
