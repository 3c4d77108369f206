package com.example.jobscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle status of a job definition.
 * <p>
 * Draft -> Active, Active <-> Paused, any non-deleted -> Deleted.
 * Deleted is terminal.
 */
@Getter
@RequiredArgsConstructor
public enum JobStatus {

    /**
     * Created but never activated. Schedules may be attached but are not registered.
     */
    DRAFT("draft", "Draft"),

    /**
     * Eligible for execution. Active schedules hold live trigger registrations.
     */
    ACTIVE("active", "Active"),

    /**
     * Temporarily suspended. Schedules keep their status but lose their registrations.
     */
    PAUSED("paused", "Paused"),

    /**
     * Soft deleted. Terminal state.
     */
    DELETED("deleted", "Deleted");

    private final String code;
    private final String displayName;

    /**
     * Find JobStatus by its code value
     */
    public static JobStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown job status code: " + code);
    }

    public boolean isTerminal() {
        return this == DELETED;
    }
}
