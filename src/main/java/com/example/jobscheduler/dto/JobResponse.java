package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Response DTO for job details
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobResponse {

    private UUID id;
    private String name;
    private String description;
    private String handlerType;
    private String parameters;
    private JobStatus status;
    private JobPriority priority;
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;
    private String createdBy;
    private String updatedBy;

    /**
     * Non-deleted schedules (only populated on single job lookup)
     */
    private List<ScheduleResponse> schedules;
}
