package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Job counts by status
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatistics {

    private Map<JobStatus, Long> countsByStatus;
    private long totalJobs;
}
