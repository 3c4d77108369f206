package com.example.jobscheduler.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for an interval schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateIntervalScheduleRequest {

    /**
     * 5-59 seconds, whole minutes up to 59, or whole hours up to 23
     */
    @NotNull(message = "Interval is required")
    @Min(value = 5, message = "Interval must be at least 5 seconds")
    @Max(value = 82800, message = "Interval must not exceed 23 hours")
    private Integer intervalSeconds;

    private Instant startTime;

    private Instant endTime;

    private String createdBy;
}
