package com.example.jobscheduler.service.executor;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Classification of a failed attempt. Retry decisions switch on this tag only.
 */
@Getter
@RequiredArgsConstructor
public enum FailureKind {

    /**
     * Attempt exceeded its priority-derived timeout
     */
    TIMEOUT(true),

    /**
     * Network, transient database or explicitly retryable handler failure
     */
    TRANSIENT(true),

    /**
     * Anything else; retrying would not help
     */
    FATAL(false);

    private final boolean retryable;
}
