package com.example.jobscheduler.domain.enums;

/**
 * How a trigger registration fires.
 */
public enum TriggerKind {

    /**
     * Fire once, as soon as a worker picks it up
     */
    IMMEDIATE,

    /**
     * Fire once at a fixed instant
     */
    ONCE,

    /**
     * Fire repeatedly following a cron expression
     */
    RECURRING
}
