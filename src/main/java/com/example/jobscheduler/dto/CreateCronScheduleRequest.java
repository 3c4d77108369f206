package com.example.jobscheduler.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for a cron schedule. Expressions use six fields, seconds first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateCronScheduleRequest {

    @NotBlank(message = "Cron expression is required")
    private String cronExpression;

    private Instant startTime;

    private Instant endTime;

    private String createdBy;
}
