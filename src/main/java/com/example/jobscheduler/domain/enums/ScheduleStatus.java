package com.example.jobscheduler.domain.enums;

/**
 * Lifecycle status of a schedule. Reflects user intent; whether the schedule is
 * live in the durable scheduler is tracked separately by its trigger handle.
 */
public enum ScheduleStatus {
    INACTIVE,
    ACTIVE,
    PAUSED,
    DELETED
}
