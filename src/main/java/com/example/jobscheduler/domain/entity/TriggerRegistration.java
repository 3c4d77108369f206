package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.TriggerKind;
import com.example.jobscheduler.domain.enums.TriggerStatus;
import jakarta.persistence.*;
import lombok.*;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.UUID;

/**
 * A live registration held by the database-backed durable scheduler.
 * <p>
 * Its id is the trigger handle given back to callers. Rows survive restarts;
 * the dispatcher picks due rows with SKIP LOCKED so multiple instances never fire
 * the same registration twice.
 */
@Entity
@Table(name = "trigger_registrations", indexes = {
        @Index(name = "idx_trigger_status_next_fire", columnList = "status, next_fire_time"),
        @Index(name = "idx_trigger_job_id", columnList = "job_id")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class TriggerRegistration {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    /**
     * Worker queue the firing is dispatched to
     */
    @Column(name = "queue", nullable = false, length = 50)
    private String queue;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 20)
    private TriggerKind kind;

    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    @Column(name = "start_time")
    private Instant startTime;

    @Column(name = "end_time")
    private Instant endTime;

    @Column(name = "next_fire_time")
    private Instant nextFireTime;

    @Column(name = "last_fired_at")
    private Instant lastFiredAt;

    @Column(name = "fire_count", nullable = false)
    @Builder.Default
    private Long fireCount = 0L;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TriggerStatus status;

    @Version
    @Column(name = "version")
    private Long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public static TriggerRegistration immediate(UUID jobId, String queue) {
        var now = Instant.now();
        return base(jobId, queue, TriggerKind.IMMEDIATE, now)
                .nextFireTime(now)
                .build();
    }

    public static TriggerRegistration once(UUID jobId, String queue, Instant runAt) {
        return base(jobId, queue, TriggerKind.ONCE, Instant.now())
                .nextFireTime(runAt)
                .build();
    }

    public static TriggerRegistration recurring(UUID jobId, String queue, String cronExpression, Instant startTime, Instant endTime) {
        var now = Instant.now();
        var registration = base(jobId, queue, TriggerKind.RECURRING, now)
                .cronExpression(cronExpression)
                .startTime(startTime)
                .endTime(endTime)
                .build();
        var from = startTime != null && startTime.isAfter(now) ? startTime.minusMillis(1) : now;
        registration.scheduleNextAfter(from);
        return registration;
    }

    private static TriggerRegistrationBuilder base(UUID jobId, String queue, TriggerKind kind, Instant now) {
        return TriggerRegistration.builder()
                .jobId(jobId)
                .queue(queue)
                .kind(kind)
                .status(TriggerStatus.ACTIVE)
                .fireCount(0L)
                .createdAt(now)
                .updatedAt(now);
    }

    /**
     * Record a firing and move to the next fire time, or exhaust the registration.
     */
    public void markFired(Instant firedAt) {
        this.fireCount = fireCount + 1;
        this.lastFiredAt = firedAt;
        this.updatedAt = Instant.now();
        if (kind == TriggerKind.RECURRING) {
            scheduleNextAfter(firedAt);
        } else {
            exhaust();
        }
    }

    public void cancel() {
        this.status = TriggerStatus.CANCELLED;
        this.nextFireTime = null;
        this.updatedAt = Instant.now();
    }

    public boolean isActive() {
        return status == TriggerStatus.ACTIVE;
    }

    /**
     * Identifier of the current firing, used as the execution log's external id
     */
    public String currentExecutionId() {
        return id + ":" + fireCount;
    }

    private void scheduleNextAfter(Instant after) {
        var next = CronExpression.parse(cronExpression).next(ZonedDateTime.ofInstant(after, ZoneId.systemDefault()));
        if (next == null || (endTime != null && next.toInstant().isAfter(endTime))) {
            exhaust();
            return;
        }
        this.nextFireTime = next.toInstant();
    }

    private void exhaust() {
        this.status = TriggerStatus.EXHAUSTED;
        this.nextFireTime = null;
    }
}
