package com.example.jobscheduler.controller;

import com.example.jobscheduler.dto.*;
import com.example.jobscheduler.service.JobManagementService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.UUID;

/**
 * REST API controller for schedules attached to jobs.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1")
@Tag(name = "Schedule Management", description = "APIs for managing job schedules")
public class ScheduleController {

    private final JobManagementService jobManagementService;

    @GetMapping("/jobs/{jobId}/schedules")
    @Operation(summary = "List schedules", description = "Non-deleted schedules of a job")
    public ResponseEntity<ApiResponse<List<ScheduleResponse>>> getSchedules(@Parameter(description = "Job UUID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(jobManagementService.getSchedules(jobId)));
    }

    @PostMapping("/jobs/{jobId}/schedules/cron")
    @Operation(summary = "Create a cron schedule", description = "Six-field cron expression, seconds first")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<ScheduleResponse>> createCronSchedule(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Valid @RequestBody CreateCronScheduleRequest request) {
        log.info("API: Create cron schedule '{}' for job {}", request.getCronExpression(), jobId);

        return created(jobManagementService.createCronSchedule(jobId, request));
    }

    @PostMapping("/jobs/{jobId}/schedules/interval")
    @Operation(summary = "Create an interval schedule", description = "Fire every N seconds (5-59) or every whole number of minutes")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<ScheduleResponse>> createIntervalSchedule(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Valid @RequestBody CreateIntervalScheduleRequest request) {
        log.info("API: Create {}s interval schedule for job {}", request.getIntervalSeconds(), jobId);

        return created(jobManagementService.createIntervalSchedule(jobId, request));
    }

    @PostMapping("/jobs/{jobId}/schedules/one-time")
    @Operation(summary = "Create a one-time schedule", description = "Fire once at a future time")
    @ResponseStatus(HttpStatus.CREATED)
    public ResponseEntity<ApiResponse<ScheduleResponse>> createOneTimeSchedule(
            @Parameter(description = "Job UUID") @PathVariable UUID jobId,
            @Valid @RequestBody CreateOneTimeScheduleRequest request) {
        log.info("API: Create one-time schedule at {} for job {}", request.getExecuteAt(), jobId);

        return created(jobManagementService.createOneTimeSchedule(jobId, request));
    }

    @PostMapping("/schedules/{scheduleId}/activate")
    @Operation(summary = "Activate a schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> activateSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId,
            @RequestHeader(value = JobController.ACTOR_HEADER, required = false) String actor) {
        log.info("API: Activate schedule {}", scheduleId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.activateSchedule(scheduleId, actor), "Schedule activated successfully"));
    }

    @PostMapping("/schedules/{scheduleId}/pause")
    @Operation(summary = "Pause a schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> pauseSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId,
            @RequestHeader(value = JobController.ACTOR_HEADER, required = false) String actor) {
        log.info("API: Pause schedule {}", scheduleId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.pauseSchedule(scheduleId, actor), "Schedule paused successfully"));
    }

    @DeleteMapping("/schedules/{scheduleId}")
    @Operation(summary = "Delete a schedule")
    public ResponseEntity<ApiResponse<ScheduleResponse>> deleteSchedule(
            @Parameter(description = "Schedule UUID") @PathVariable UUID scheduleId,
            @RequestHeader(value = JobController.ACTOR_HEADER, required = false) String actor) {
        log.info("API: Delete schedule {}", scheduleId);

        return ResponseEntity.ok(ApiResponse.success(jobManagementService.deleteSchedule(scheduleId, actor), "Schedule deleted successfully"));
    }

    private ResponseEntity<ApiResponse<ScheduleResponse>> created(ScheduleResponse response) {
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Schedule created successfully"));
    }
}
