package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.ScheduleStatus;
import com.example.jobscheduler.domain.enums.ScheduleType;
import com.example.jobscheduler.exception.InvalidStateException;
import com.example.jobscheduler.exception.JobValidationException;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.util.UUID;

/**
 * Trigger attached to a job.
 * <p>
 * {@code status} records what the user asked for; {@code triggerHandle} records whether
 * the durable scheduler currently holds a registration for it. The two diverge while the
 * owning job is not active: an ACTIVE schedule under a paused job has no handle.
 */
@Entity
@Table(name = "schedules", indexes = {
        @Index(name = "idx_schedule_job_id", columnList = "job_id"),
        @Index(name = "idx_schedule_job_status", columnList = "job_id, status")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Schedule {

    public static final int MIN_INTERVAL_SECONDS = 5;

    public static final String INTERVAL_RULE =
            "Interval must be 5-59 seconds, a whole number of minutes up to 59, or a whole number of hours up to 23";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    @Enumerated(EnumType.STRING)
    @Column(name = "type", nullable = false, length = 20)
    private ScheduleType type;

    /**
     * Set for CRON schedules only
     */
    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    /**
     * Set for INTERVAL schedules only
     */
    @Column(name = "interval_seconds")
    private Integer intervalSeconds;

    /**
     * Set for ONE_TIME schedules only
     */
    @Column(name = "execute_at")
    private Instant executeAt;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ScheduleStatus status;

    /**
     * Handle returned by the durable scheduler; null when not registered
     */
    @Column(name = "trigger_handle", length = 100)
    private String triggerHandle;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "updated_by", length = 100)
    private String updatedBy;

    // === Factories ===

    public static Schedule createCron(UUID jobId, String cronExpression, Instant startTime, Instant endTime, String createdBy) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new JobValidationException("cronExpression", "Cron expression must not be empty");
        }
        if (!CronExpression.isValidExpression(cronExpression.trim())) {
            throw new JobValidationException("cronExpression", "Invalid cron expression: " + cronExpression);
        }
        requireOrderedBounds(startTime, endTime);

        return newSchedule(jobId, ScheduleType.CRON, createdBy)
                .cronExpression(cronExpression.trim())
                .startTime(startTime)
                .endTime(endTime)
                .build();
    }

    public static Schedule createInterval(UUID jobId, int intervalSeconds, Instant startTime, Instant endTime, String createdBy) {
        if (intervalSeconds <= 0) {
            throw new JobValidationException("intervalSeconds", "Interval must be greater than 0");
        }
        if (intervalSeconds < MIN_INTERVAL_SECONDS) {
            throw new JobValidationException("intervalSeconds",
                    String.format("Interval must be at least %d seconds", MIN_INTERVAL_SECONDS));
        }
        if (!isExpressibleInterval(intervalSeconds)) {
            throw new JobValidationException("intervalSeconds", INTERVAL_RULE);
        }
        requireOrderedBounds(startTime, endTime);

        return newSchedule(jobId, ScheduleType.INTERVAL, createdBy)
                .intervalSeconds(intervalSeconds)
                .startTime(startTime)
                .endTime(endTime)
                .build();
    }

    public static Schedule createOneTime(UUID jobId, Instant executeAt, String createdBy) {
        if (executeAt == null || !executeAt.isAfter(Instant.now())) {
            throw new JobValidationException("executeAt", "Execution time must be in the future");
        }

        return newSchedule(jobId, ScheduleType.ONE_TIME, createdBy)
                .executeAt(executeAt)
                .build();
    }

    private static ScheduleBuilder newSchedule(UUID jobId, ScheduleType type, String createdBy) {
        var now = Instant.now();
        return Schedule.builder()
                .jobId(jobId)
                .type(type)
                .status(ScheduleStatus.INACTIVE)
                .createdAt(now)
                .updatedAt(now)
                .createdBy(createdBy)
                .updatedBy(createdBy);
    }

    /**
     * Intervals map onto a single cron field: seconds, minutes or hours.
     */
    private static boolean isExpressibleInterval(int seconds) {
        if (seconds < 60) {
            return true;
        }
        if (seconds < 3600) {
            return seconds % 60 == 0;
        }
        return seconds % 3600 == 0 && seconds / 3600 <= 23;
    }

    private static void requireOrderedBounds(Instant startTime, Instant endTime) {
        if (startTime != null && endTime != null && !endTime.isAfter(startTime)) {
            throw new JobValidationException("endTime", "End time must be after start time");
        }
    }

    // === Transitions ===

    /**
     * INACTIVE/PAUSED -> ACTIVE. Re-activating an ACTIVE schedule is rejected;
     * pause it first to force re-registration.
     */
    public void activate(String updatedBy) {
        if (!canActivate()) {
            throw new InvalidStateException("Schedule", id, status, "activate");
        }
        this.status = ScheduleStatus.ACTIVE;
        touch(updatedBy);
    }

    /**
     * ACTIVE -> PAUSED
     */
    public void pause(String updatedBy) {
        if (status != ScheduleStatus.ACTIVE) {
            throw new InvalidStateException("Schedule", id, status, "pause");
        }
        this.status = ScheduleStatus.PAUSED;
        touch(updatedBy);
    }

    /**
     * Any status except DELETED -> DELETED
     */
    public void delete(String updatedBy) {
        if (status == ScheduleStatus.DELETED) {
            throw new InvalidStateException("Schedule", id, status, "delete");
        }
        this.status = ScheduleStatus.DELETED;
        touch(updatedBy);
    }

    public void assignTriggerHandle(String handle) {
        this.triggerHandle = handle;
    }

    public void clearTriggerHandle() {
        this.triggerHandle = null;
    }

    public boolean hasTriggerHandle() {
        return triggerHandle != null;
    }

    public boolean isActive() {
        return status == ScheduleStatus.ACTIVE;
    }

    /**
     * True for a one-time schedule whose execution time has passed: it either fired
     * or was missed while unregistered. Such a schedule is never registered again.
     */
    public boolean hasElapsed() {
        return type == ScheduleType.ONE_TIME && !executeAt.isAfter(Instant.now());
    }

    public boolean canActivate() {
        return status == ScheduleStatus.INACTIVE || status == ScheduleStatus.PAUSED;
    }

    /**
     * Cron expression handed to the durable scheduler for recurring types.
     * Intervals become "every N seconds", minutes or hours expressions.
     */
    public String toTriggerExpression() {
        if (type == ScheduleType.CRON) {
            return cronExpression;
        }
        if (type == ScheduleType.INTERVAL) {
            if (intervalSeconds < 60) {
                return String.format("*/%d * * * * *", intervalSeconds);
            }
            return intervalSeconds < 3600
                    ? String.format("0 */%d * * * *", intervalSeconds / 60)
                    : String.format("0 0 */%d * * *", intervalSeconds / 3600);
        }
        return null;
    }

    private void touch(String updatedBy) {
        this.updatedAt = Instant.now();
        this.updatedBy = updatedBy;
    }

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (this.createdAt == null) {
            this.createdAt = now;
        }
        if (this.updatedAt == null) {
            this.updatedAt = now;
        }
        if (this.status == null) {
            this.status = ScheduleStatus.INACTIVE;
        }
    }
}
