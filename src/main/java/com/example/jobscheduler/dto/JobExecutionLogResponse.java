package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.ExecutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for execution log
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobExecutionLogResponse {

    private UUID id;
    private UUID jobId;
    private String executionId;
    private ExecutionStatus status;
    private Integer attempts;
    private Instant startedAt;
    private Instant endedAt;
    private Long durationMs;
    private String result;
    private String errorMessage;
    private String errorStack;
}
