package com.example.jobscheduler.controller;

import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.dto.*;
import com.example.jobscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;
import java.util.UUID;

/**
 * REST API controller for job management operations.
 * <p>
 * Provides endpoints for:
 * - Creating and updating jobs
 * - Managing job status (activate, pause, delete)
 * - Running a job immediately
 * - Searching jobs and reading execution history
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/jobs")
@Tag(name = "Job Management", description = "APIs for managing jobs")
public class JobController {

    static final String ACTOR_HEADER = "X-Actor";

    private final JobManagementService jobManagementService;

    // === Job Definition ===

    @PostMapping
    @Operation(summary = "Create a new job", description = "Create a job in DRAFT status")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<JobResponse>> createJob(@Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create job '{}' with handler {}", request.getName(), request.getHandlerType());

        var response = jobManagementService.createJob(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Job created successfully"));
    }

    @PutMapping("/{jobId}")
    @Operation(summary = "Update a job", description = "Replace the definition of a job")
    public ResponseEntity<ApiResponse<JobResponse>> updateJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Valid @RequestBody UpdateJobRequest request) {
        log.info("API: Update job {}", jobId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.updateJob(jobId, request), "Job updated successfully"));
    }

    // === Job Retrieval ===

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job by ID", description = "Retrieve a job with its schedules")
    public ResponseEntity<ApiResponse<JobResponse>> getJob(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getJob(jobId)));
    }

    @GetMapping
    @Operation(summary = "Search jobs", description = "Search jobs with optional filters")
    public ResponseEntity<ApiResponse<Page<JobResponse>>> searchJobs(
            @Parameter(description = "Status filter") @RequestParam(required = false) JobStatus status,
            @Parameter(description = "Priority filter") @RequestParam(required = false) JobPriority priority,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size,
            @Parameter(description = "Sort field") @RequestParam(defaultValue = "createdAt") String sortBy,
            @Parameter(description = "Sort direction") @RequestParam(defaultValue = "DESC") String sortDir) {

        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.fromString(sortDir), sortBy));
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.searchJobs(status, priority, pageable)));
    }

    @GetMapping("/{jobId}/executions")
    @Operation(summary = "Get execution history", description = "Execution logs of a job, newest first")
    public ResponseEntity<ApiResponse<Page<JobExecutionLogResponse>>> getExecutionLogs(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getExecutionLogs(jobId, PageRequest.of(page, size))));
    }

    @GetMapping("/{jobId}/executions/archived")
    @Operation(summary = "Get archived execution history", description = "Execution logs moved to the history table, newest first")
    public ResponseEntity<ApiResponse<Page<JobExecutionLogResponse>>> getArchivedExecutionLogs(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Parameter(description = "Page number") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getArchivedExecutionLogs(jobId, PageRequest.of(page, size))));
    }

    @GetMapping("/statistics")
    @Operation(summary = "Get job statistics", description = "Job counts by status")
    public ResponseEntity<ApiResponse<JobStatistics>> getStatistics() {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getStatistics()));
    }

    // === Job Status Management ===

    @PostMapping("/{jobId}/activate")
    @Operation(summary = "Activate a job", description = "Activate a job and register its active schedules")
    public ResponseEntity<ApiResponse<JobResponse>> activateJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        log.info("API: Activate job {}", jobId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.activateJob(jobId, actor), "Job activated successfully"));
    }

    @PostMapping("/{jobId}/pause")
    @Operation(summary = "Pause a job", description = "Pause a job and cancel its live registrations")
    public ResponseEntity<ApiResponse<JobResponse>> pauseJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        log.info("API: Pause job {}", jobId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.pauseJob(jobId, actor), "Job paused successfully"));
    }

    @DeleteMapping("/{jobId}")
    @Operation(summary = "Delete a job", description = "Delete a job and all of its schedules")
    public ResponseEntity<ApiResponse<JobResponse>> deleteJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        log.info("API: Delete job {}", jobId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.deleteJob(jobId, actor), "Job deleted successfully"));
    }

    @PostMapping("/{jobId}/execute")
    @Operation(summary = "Execute a job now", description = "Queue one execution of an active job on its priority queue")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public ResponseEntity<ApiResponse<Map<String, String>>> executeJob(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @RequestHeader(value = ACTOR_HEADER, required = false) String actor) {
        log.info("API: Execute job {} now", jobId);

        var handle = jobManagementService.executeJobImmediately(jobId, actor);
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(ApiResponse.success(Map.of("triggerHandle", handle), "Job queued for execution"));
    }
}
