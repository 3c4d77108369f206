package com.example.jobscheduler.service;

import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.domain.repository.JobExecutionLogHistoryRepository;
import com.example.jobscheduler.domain.repository.JobExecutionLogRepository;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.dto.CreateCronScheduleRequest;
import com.example.jobscheduler.dto.CreateIntervalScheduleRequest;
import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.CreateOneTimeScheduleRequest;
import com.example.jobscheduler.dto.JobExecutionLogResponse;
import com.example.jobscheduler.dto.JobResponse;
import com.example.jobscheduler.dto.JobStatistics;
import com.example.jobscheduler.dto.ScheduleResponse;
import com.example.jobscheduler.dto.UpdateJobRequest;
import com.example.jobscheduler.exception.InvalidStateException;
import com.example.jobscheduler.exception.JobValidationException;
import com.example.jobscheduler.exception.ResourceNotFoundException;
import com.example.jobscheduler.mapper.JobMapper;
import com.example.jobscheduler.service.gateway.SchedulingGatewayService;
import com.example.jobscheduler.service.handler.JobHandlerRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.EnumMap;
import java.util.List;
import java.util.UUID;

/**
 * Service for managing job and schedule lifecycle operations.
 * <p>
 * Provides:
 * - Job creation, update and status management
 * - Schedule creation and status management through the scheduling gateway
 * - Immediate execution requests
 * - Querying jobs, schedules and execution history
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobManagementService {

    private final JobRepository jobRepository;
    private final JobExecutionLogRepository executionLogRepository;
    private final JobExecutionLogHistoryRepository executionLogHistoryRepository;
    private final SchedulingGatewayService schedulingGateway;
    private final JobHandlerRegistry handlerRegistry;
    private final JobMapper jobMapper;

    // === Job Definition ===

    @Transactional
    public JobResponse createJob(CreateJobRequest request) {
        var job = Job.create(request.getName(), request.getDescription(), request.getHandlerType(),
                request.getParameters(), request.getPriority(), request.getCreatedBy());
        requireKnownHandler(job.getHandlerType());

        job = jobRepository.save(job);
        log.info("Created job {} '{}' (handler: {}, priority: {})", job.getId(), job.getName(), job.getHandlerType(), job.getPriority());

        return jobMapper.toResponse(job);
    }

    @Transactional
    public JobResponse updateJob(UUID jobId, UpdateJobRequest request) {
        var job = findJob(jobId);
        job.update(request.getName(), request.getDescription(), request.getHandlerType(),
                request.getParameters(), request.getPriority(), request.getUpdatedBy());
        requireKnownHandler(job.getHandlerType());

        job = jobRepository.save(job);
        log.info("Updated job {}", jobId);

        return jobMapper.toResponse(job);
    }

    // === Job Status Management ===

    /**
     * DRAFT/PAUSED -> ACTIVE, then register schedules that were waiting for the job.
     */
    @Transactional
    public JobResponse activateJob(UUID jobId, String updatedBy) {
        var job = findJob(jobId);
        job.activate(updatedBy);
        job = jobRepository.save(job);

        schedulingGateway.registerPendingSchedules(job);
        log.info("Activated job {}", jobId);

        return jobMapper.toResponse(job);
    }

    /**
     * ACTIVE -> PAUSED, releasing every live registration. Schedule statuses are kept.
     */
    @Transactional
    public JobResponse pauseJob(UUID jobId, String updatedBy) {
        var job = findJob(jobId);
        job.pause(updatedBy);
        job = jobRepository.save(job);

        schedulingGateway.releaseSchedules(job);
        log.info("Paused job {}", jobId);

        return jobMapper.toResponse(job);
    }

    /**
     * Delete the job and all of its schedules.
     */
    @Transactional
    public JobResponse deleteJob(UUID jobId, String updatedBy) {
        var job = findJob(jobId);
        job.delete(updatedBy);
        job = jobRepository.save(job);

        schedulingGateway.deleteSchedules(job, updatedBy);
        log.info("Deleted job {}", jobId);

        return jobMapper.toResponse(job);
    }

    /**
     * Queue one execution of an active job on its priority queue.
     *
     * @return trigger handle of the queued execution
     */
    @Transactional
    public String executeJobImmediately(UUID jobId, String requestedBy) {
        var job = findJob(jobId);
        if (!job.isActive()) {
            throw new InvalidStateException("Job", jobId, job.getStatus(), "execute");
        }

        log.info("Immediate execution of job {} requested by {}", jobId, requestedBy);
        return schedulingGateway.enqueueNow(job);
    }

    // === Schedules ===

    public ScheduleResponse createCronSchedule(UUID jobId, CreateCronScheduleRequest request) {
        return jobMapper.toScheduleResponse(schedulingGateway.createCronSchedule(jobId,
                request.getCronExpression(), request.getStartTime(), request.getEndTime(), request.getCreatedBy()));
    }

    public ScheduleResponse createIntervalSchedule(UUID jobId, CreateIntervalScheduleRequest request) {
        return jobMapper.toScheduleResponse(schedulingGateway.createIntervalSchedule(jobId,
                request.getIntervalSeconds(), request.getStartTime(), request.getEndTime(), request.getCreatedBy()));
    }

    public ScheduleResponse createOneTimeSchedule(UUID jobId, CreateOneTimeScheduleRequest request) {
        return jobMapper.toScheduleResponse(schedulingGateway.createOneTimeSchedule(jobId,
                request.getExecuteAt(), request.getCreatedBy()));
    }

    public ScheduleResponse activateSchedule(UUID scheduleId, String updatedBy) {
        return jobMapper.toScheduleResponse(schedulingGateway.activateSchedule(scheduleId, updatedBy));
    }

    public ScheduleResponse pauseSchedule(UUID scheduleId, String updatedBy) {
        return jobMapper.toScheduleResponse(schedulingGateway.pauseSchedule(scheduleId, updatedBy));
    }

    public ScheduleResponse deleteSchedule(UUID scheduleId, String updatedBy) {
        return jobMapper.toScheduleResponse(schedulingGateway.deleteSchedule(scheduleId, updatedBy));
    }

    public List<ScheduleResponse> getSchedules(UUID jobId) {
        return jobMapper.toScheduleResponses(schedulingGateway.getSchedules(jobId));
    }

    // === Queries ===

    /**
     * Get a job with its non-deleted schedules
     */
    @Transactional(readOnly = true)
    public JobResponse getJob(UUID jobId) {
        var response = jobMapper.toResponse(findJob(jobId));
        response.setSchedules(getSchedules(jobId));
        return response;
    }

    /**
     * Search jobs by optional status and priority. Without a status filter deleted jobs are hidden.
     */
    @Transactional(readOnly = true)
    public Page<JobResponse> searchJobs(JobStatus status, JobPriority priority, Pageable pageable) {
        Page<Job> jobs;
        if (status != null && priority != null) {
            jobs = jobRepository.findByStatusAndPriority(status, priority, pageable);
        } else if (status != null) {
            jobs = jobRepository.findByStatus(status, pageable);
        } else if (priority != null) {
            jobs = jobRepository.findByPriorityAndStatusNot(priority, JobStatus.DELETED, pageable);
        } else {
            jobs = jobRepository.findByStatusNot(JobStatus.DELETED, pageable);
        }
        return jobs.map(jobMapper::toResponse);
    }

    /**
     * Execution history of a job, newest first
     */
    @Transactional(readOnly = true)
    public Page<JobExecutionLogResponse> getExecutionLogs(UUID jobId, Pageable pageable) {
        findJob(jobId);
        return executionLogRepository.findByJobIdOrderByStartedAtDesc(jobId, pageable).map(jobMapper::toLogResponse);
    }

    /**
     * Archived execution logs of a job, newest first
     */
    @Transactional(readOnly = true)
    public Page<JobExecutionLogResponse> getArchivedExecutionLogs(UUID jobId, Pageable pageable) {
        findJob(jobId);
        return executionLogHistoryRepository.findByJobIdOrderByStartedAtDesc(jobId, pageable).map(jobMapper::toArchivedLogResponse);
    }

    @Transactional(readOnly = true)
    public JobStatistics getStatistics() {
        var counts = new EnumMap<JobStatus, Long>(JobStatus.class);
        for (var status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        for (var row : jobRepository.getJobStatsByStatus()) {
            counts.put((JobStatus) row[0], (Long) row[1]);
        }

        return JobStatistics.builder()
                .countsByStatus(counts)
                .totalJobs(counts.values().stream().mapToLong(Long::longValue).sum())
                .build();
    }

    private void requireKnownHandler(String handlerType) {
        if (!handlerRegistry.hasHandler(handlerType)) {
            throw new JobValidationException("handlerType",
                    String.format("Unknown handler type '%s'; registered types: %s", handlerType, handlerRegistry.getRegisteredTypes()));
        }
    }

    private Job findJob(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> ResourceNotFoundException.job(jobId));
    }
}
