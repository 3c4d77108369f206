package com.example.jobscheduler.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for a schedule that fires once
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateOneTimeScheduleRequest {

    @NotNull(message = "Execution time is required")
    private Instant executeAt;

    private String createdBy;
}
