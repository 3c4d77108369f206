package com.example.jobscheduler.domain.entity;

import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.exception.InvalidStateException;
import com.example.jobscheduler.exception.JobValidationException;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Definition of executable work and its lifecycle.
 * <p>
 * The handler type names the registered {@code JobHandler} that runs the job;
 * parameters are an opaque payload passed to it verbatim.
 * Schedules and execution logs reference the job by id only.
 */
@Entity
@Table(name = "jobs", indexes = {
        @Index(name = "idx_job_status", columnList = "status"),
        @Index(name = "idx_job_status_priority", columnList = "status, priority"),
        @Index(name = "idx_job_handler_type", columnList = "handler_type")
})
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class Job {

    public static final String DEFAULT_PARAMETERS = "{}";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false, length = 200)
    private String name;

    @Column(name = "description", length = 1000)
    private String description;

    /**
     * Key of the handler that executes this job
     */
    @Column(name = "handler_type", nullable = false, length = 200)
    private String handlerType;

    /**
     * Opaque handler input, stored as given
     */
    @Column(name = "parameters", columnDefinition = "TEXT")
    private String parameters;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private JobStatus status;

    @Enumerated(EnumType.STRING)
    @Column(name = "priority", nullable = false, length = 20)
    @Builder.Default
    private JobPriority priority = JobPriority.DEFAULT;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "created_by", length = 100)
    private String createdBy;

    @Column(name = "updated_by", length = 100)
    private String updatedBy;

    /**
     * Create a new job in DRAFT status
     */
    public static Job create(String name, String description, String handlerType, String parameters,
                             JobPriority priority, String createdBy) {
        requireText(name, "name", "Job name must not be empty");
        requireText(handlerType, "handlerType", "Job handler type must not be empty");

        var now = Instant.now();
        return Job.builder()
                .name(name)
                .description(description)
                .handlerType(handlerType)
                .parameters(parameters != null ? parameters : DEFAULT_PARAMETERS)
                .status(JobStatus.DRAFT)
                .priority(priority != null ? priority : JobPriority.DEFAULT)
                .createdAt(now)
                .updatedAt(now)
                .createdBy(createdBy)
                .updatedBy(createdBy)
                .build();
    }

    /**
     * Replace the definition. Priority is only changed when given.
     */
    public void update(String name, String description, String handlerType, String parameters,
                       JobPriority priority, String updatedBy) {
        if (status == JobStatus.DELETED) {
            throw new InvalidStateException("Job", id, status, "update");
        }
        requireText(name, "name", "Job name must not be empty");
        requireText(handlerType, "handlerType", "Job handler type must not be empty");

        this.name = name;
        this.description = description;
        this.handlerType = handlerType;
        this.parameters = parameters != null ? parameters : DEFAULT_PARAMETERS;
        if (priority != null) {
            this.priority = priority;
        }
        touch(updatedBy);
    }

    /**
     * DRAFT/PAUSED -> ACTIVE. Re-activating an active job only restamps it.
     */
    public void activate(String updatedBy) {
        if (status == JobStatus.DELETED) {
            throw new InvalidStateException("Job", id, status, "activate");
        }
        this.status = JobStatus.ACTIVE;
        touch(updatedBy);
    }

    /**
     * ACTIVE -> PAUSED
     */
    public void pause(String updatedBy) {
        if (status != JobStatus.ACTIVE) {
            throw new InvalidStateException("Job", id, status, "pause");
        }
        this.status = JobStatus.PAUSED;
        touch(updatedBy);
    }

    /**
     * Any non-deleted status -> DELETED
     */
    public void delete(String updatedBy) {
        if (status == JobStatus.DELETED) {
            throw new InvalidStateException("Job", id, status, "delete");
        }
        this.status = JobStatus.DELETED;
        touch(updatedBy);
    }

    public boolean isActive() {
        return status == JobStatus.ACTIVE;
    }

    private void touch(String updatedBy) {
        this.updatedAt = Instant.now();
        this.updatedBy = updatedBy;
    }

    private static void requireText(String value, String field, String message) {
        if (value == null || value.isBlank()) {
            throw new JobValidationException(field, message);
        }
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
            this.status = JobStatus.DRAFT;
        }
        if (this.priority == null) {
            this.priority = JobPriority.DEFAULT;
        }
        if (this.parameters == null) {
            this.parameters = DEFAULT_PARAMETERS;
        }
    }
}
