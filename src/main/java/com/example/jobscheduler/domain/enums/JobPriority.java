package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Job priority. Drives queue selection, timeout and retry budget
 * through {@link com.example.jobscheduler.service.policy.PriorityPolicy}.
 */
@Getter
@RequiredArgsConstructor
public enum JobPriority {

    LOW(1, "Low"),

    DEFAULT(5, "Default"),

    HIGH(8, "High"),

    /**
     * Fails fast, retried aggressively, alerts on terminal failure
     */
    CRITICAL(10, "Critical");

    private final int value;
    private final String displayName;
}
