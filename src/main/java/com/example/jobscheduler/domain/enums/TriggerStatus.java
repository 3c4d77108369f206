package com.example.jobscheduler.domain.enums;

/**
 * Status of a registration held by the database-backed durable scheduler.
 */
public enum TriggerStatus {

    ACTIVE,

    /**
     * No further fire times (one-shot fired, or end bound passed)
     */
    EXHAUSTED,

    CANCELLED
}
