package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Trigger kinds a schedule can carry.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleType {

    /**
     * Six-field cron expression (seconds first)
     */
    CRON("Cron", true),

    /**
     * Fixed interval in seconds, registered as a synthesized cron expression
     */
    INTERVAL("Interval", true),

    /**
     * Fires once at a fixed instant
     */
    ONE_TIME("One time", false);

    private final String displayName;
    private final boolean recurring;
}
