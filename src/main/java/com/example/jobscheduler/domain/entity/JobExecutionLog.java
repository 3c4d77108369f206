package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.ExecutionStatus;
import com.example.jobscheduler.exception.InvalidStateException;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

/**
 * One record per logical execution of a job.
 * <p>
 * Created RUNNING and moved exactly once to SUCCEEDED, FAILED or CANCELED.
 * {@code endedAt} and {@code durationMs} are written together at finalization and
 * never recomputed. A terminal log carries either a result or an error, never both.
 */
@Entity
@Table(name = "job_execution_logs", indexes = {
        @Index(name = "idx_exec_log_job_id", columnList = "job_id"),
        @Index(name = "idx_exec_log_started_at", columnList = "started_at"),
        @Index(name = "idx_exec_log_status_ended_at", columnList = "status, ended_at")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class JobExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false, updatable = false)
    private UUID jobId;

    /**
     * Id of the firing as known to the durable scheduler
     */
    @Column(name = "execution_id", length = 100)
    private String executionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ExecutionStatus status;

    /**
     * Number of physical attempts made, including the first
     */
    @Column(name = "attempts", nullable = false)
    @Builder.Default
    private Integer attempts = 0;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "ended_at")
    private Instant endedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "result", columnDefinition = "TEXT")
    private String result;

    @Column(name = "error_message", columnDefinition = "TEXT")
    private String errorMessage;

    /**
     * Error stack trace (truncated)
     */
    @Column(name = "error_stack", columnDefinition = "TEXT")
    private String errorStack;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Open a log in RUNNING state
     */
    public static JobExecutionLog start(UUID jobId, String executionId) {
        var now = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        return JobExecutionLog.builder()
                .jobId(jobId)
                .executionId(executionId)
                .status(ExecutionStatus.RUNNING)
                .attempts(0)
                .startedAt(now)
                .createdAt(now)
                .build();
    }

    public void recordAttempt() {
        this.attempts = attempts + 1;
    }

    public void complete(String result) {
        finish(ExecutionStatus.SUCCEEDED);
        this.result = result != null ? result : "";
    }

    public void fail(String errorMessage, String errorStack) {
        finish(ExecutionStatus.FAILED);
        this.errorMessage = errorMessage != null ? errorMessage : "Unknown error";
        this.errorStack = errorStack;
    }

    public void cancel(String reason) {
        finish(ExecutionStatus.CANCELED);
        this.errorMessage = reason != null ? reason : "Canceled";
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    private void finish(ExecutionStatus terminalStatus) {
        if (status != ExecutionStatus.RUNNING) {
            throw new InvalidStateException("Execution log", id, status, "finalize as " + terminalStatus.getCode());
        }
        var end = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        if (end.isBefore(startedAt)) {
            end = startedAt;
        }
        this.status = terminalStatus;
        this.endedAt = end;
        this.durationMs = end.toEpochMilli() - startedAt.toEpochMilli();
    }

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
    }
}
