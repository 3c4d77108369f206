package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.JobPriority;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request DTO for replacing a job's definition
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateJobRequest {

    @NotBlank(message = "Job name is required")
    @Size(max = 200)
    private String name;

    private String description;

    @NotBlank(message = "Handler type is required")
    @Size(max = 100)
    private String handlerType;

    private String parameters;

    /**
     * Left unchanged when null
     */
    private JobPriority priority;

    private String updatedBy;
}
