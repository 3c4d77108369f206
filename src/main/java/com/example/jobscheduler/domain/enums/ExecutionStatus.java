package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Status of a single logical execution recorded in the execution log.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionStatus {

    RUNNING("running", false),

    SUCCEEDED("succeeded", true),

    FAILED("failed", true),

    /**
     * Abandoned before an outcome was known, e.g. during shutdown
     */
    CANCELED("canceled", true);

    private final String code;
    private final boolean terminal;
}
