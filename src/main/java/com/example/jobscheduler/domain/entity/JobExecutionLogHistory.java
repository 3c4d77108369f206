package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.ExecutionStatus;
import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Archived copy of a terminal execution log, written by the archive handler.
 * Rows are inserted in bulk with a native query; this mapping is read-only.
 */
@Entity
@Table(name = "job_execution_log_history", indexes = {
        @Index(name = "idx_exec_log_history_job_id", columnList = "job_id"),
        @Index(name = "idx_exec_log_history_archived_at", columnList = "archived_at")
})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class JobExecutionLogHistory {

    /**
     * Same id as the original log
     */
    @Id
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "job_id", nullable = false)
    private UUID jobId;

    @Column(name = "execution_id", length = 100)
    private String executionId;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private ExecutionStatus status;

    @Column(name = "attempts", nullable = false)
    private Integer attempts;

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

    @Column(name = "error_stack", columnDefinition = "TEXT")
    private String errorStack;

    @Column(name = "archived_at", nullable = false)
    private Instant archivedAt;
}
