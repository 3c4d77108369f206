package com.example.jobscheduler.service.gateway;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.entity.Schedule;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.domain.enums.ScheduleStatus;
import com.example.jobscheduler.domain.enums.ScheduleType;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.domain.repository.ScheduleRepository;
import com.example.jobscheduler.exception.GatewayException;
import com.example.jobscheduler.exception.InvalidStateException;
import com.example.jobscheduler.exception.JobValidationException;
import com.example.jobscheduler.exception.ResourceNotFoundException;
import com.example.jobscheduler.service.policy.PriorityPolicy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Keeps every schedule's trigger handle in step with its intended state.
 * <p>
 * A schedule holds a handle exactly when it is ACTIVE, its job is ACTIVE and it is not an
 * elapsed one-time schedule. Registration happens before the ACTIVE status is saved, so a
 * failed registration leaves the schedule where it was. Cancellation is deferred until the
 * surrounding transaction commits; its failures are logged and the handle is cleared anyway.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulingGatewayService {

    private final JobRepository jobRepository;
    private final ScheduleRepository scheduleRepository;
    private final DurableScheduler durableScheduler;
    private final PriorityPolicy priorityPolicy;
    private final MetricsConfig metricsConfig;

    // === Schedule creation ===

    @Transactional
    public Schedule createCronSchedule(UUID jobId, String cronExpression, Instant startTime, Instant endTime, String createdBy) {
        var job = findSchedulableJob(jobId);
        return activateNew(job, Schedule.createCron(jobId, cronExpression, startTime, endTime, createdBy), createdBy);
    }

    @Transactional
    public Schedule createIntervalSchedule(UUID jobId, int intervalSeconds, Instant startTime, Instant endTime, String createdBy) {
        var job = findSchedulableJob(jobId);
        return activateNew(job, Schedule.createInterval(jobId, intervalSeconds, startTime, endTime, createdBy), createdBy);
    }

    @Transactional
    public Schedule createOneTimeSchedule(UUID jobId, Instant executeAt, String createdBy) {
        var job = findSchedulableJob(jobId);
        return activateNew(job, Schedule.createOneTime(jobId, executeAt, createdBy), createdBy);
    }

    // === Schedule transitions ===

    /**
     * INACTIVE/PAUSED -> ACTIVE, registering with the durable scheduler when the job is active.
     */
    @Transactional
    public Schedule activateSchedule(UUID scheduleId, String updatedBy) {
        var schedule = findSchedule(scheduleId);
        var job = findJob(schedule.getJobId());
        if (!schedule.canActivate()) {
            throw new InvalidStateException("Schedule", scheduleId, schedule.getStatus(), "activate");
        }
        if (schedule.hasElapsed()) {
            throw new JobValidationException("executeAt", "Execution time of one-time schedule has passed");
        }

        if (job.isActive() && !schedule.hasTriggerHandle()) {
            register(job, schedule);
        }
        schedule.activate(updatedBy);

        log.info("Activated schedule {} of job {} (handle: {})", scheduleId, job.getId(), schedule.getTriggerHandle());
        return scheduleRepository.save(schedule);
    }

    @Transactional
    public Schedule pauseSchedule(UUID scheduleId, String updatedBy) {
        var schedule = findSchedule(scheduleId);
        schedule.pause(updatedBy);
        release(schedule);

        log.info("Paused schedule {} of job {}", scheduleId, schedule.getJobId());
        return scheduleRepository.save(schedule);
    }

    @Transactional
    public Schedule deleteSchedule(UUID scheduleId, String updatedBy) {
        var schedule = findSchedule(scheduleId);
        schedule.delete(updatedBy);
        release(schedule);

        log.info("Deleted schedule {} of job {}", scheduleId, schedule.getJobId());
        return scheduleRepository.save(schedule);
    }

    // === Job status cascades ===

    /**
     * Register every ACTIVE schedule of a now-active job that has no live registration.
     * Elapsed one-time schedules are skipped.
     *
     * @return number of schedules registered
     */
    @Transactional
    public int registerPendingSchedules(Job job) {
        var registered = 0;
        for (var schedule : scheduleRepository.findByJobIdAndStatus(job.getId(), ScheduleStatus.ACTIVE)) {
            if (schedule.hasTriggerHandle()) {
                continue;
            }
            if (schedule.hasElapsed()) {
                log.info("Skipping one-time schedule {} of job {}: execution time {} has passed",
                        schedule.getId(), job.getId(), schedule.getExecuteAt());
                continue;
            }
            register(job, schedule);
            scheduleRepository.save(schedule);
            registered++;
        }
        if (registered > 0) {
            log.info("Registered {} deferred schedule(s) of job {}", registered, job.getId());
        }
        return registered;
    }

    /**
     * Cancel and clear every live registration of a job. Schedule statuses are left alone.
     *
     * @return number of registrations released
     */
    @Transactional
    public int releaseSchedules(Job job) {
        var schedules = scheduleRepository.findByJobIdAndTriggerHandleIsNotNull(job.getId());
        for (var schedule : schedules) {
            release(schedule);
            scheduleRepository.save(schedule);
        }
        if (!schedules.isEmpty()) {
            log.info("Released {} registration(s) of job {}", schedules.size(), job.getId());
        }
        return schedules.size();
    }

    /**
     * Delete every non-deleted schedule of a job, cancelling live registrations.
     */
    @Transactional
    public void deleteSchedules(Job job, String updatedBy) {
        for (var schedule : scheduleRepository.findByJobIdAndStatusNotOrderByCreatedAtAsc(job.getId(), ScheduleStatus.DELETED)) {
            schedule.delete(updatedBy);
            release(schedule);
            scheduleRepository.save(schedule);
        }
    }

    /**
     * Queue one execution of the job on its priority queue.
     *
     * @return trigger handle of the queued execution
     */
    public String enqueueNow(Job job) {
        var queue = priorityPolicy.queueFor(job.getPriority());
        var handle = callGateway("enqueue", () -> durableScheduler.enqueueNow(job.getId(), queue));
        log.info("Queued immediate execution of job {} on queue {} (handle: {})", job.getId(), queue, handle);
        return handle;
    }

    @Transactional(readOnly = true)
    public List<Schedule> getSchedules(UUID jobId) {
        findJob(jobId);
        return scheduleRepository.findByJobIdAndStatusNotOrderByCreatedAtAsc(jobId, ScheduleStatus.DELETED);
    }

    // === Helpers ===

    private Schedule activateNew(Job job, Schedule schedule, String actor) {
        if (job.isActive()) {
            register(job, schedule);
        }
        schedule.activate(actor);
        var saved = scheduleRepository.save(schedule);

        log.info("Created {} schedule {} for job {} ({})", schedule.getType(), saved.getId(), job.getId(),
                saved.hasTriggerHandle() ? "registered" : "registration deferred until job is active");
        return saved;
    }

    private void register(Job job, Schedule schedule) {
        var queue = priorityPolicy.queueFor(job.getPriority());
        String handle;
        if (schedule.getType() == ScheduleType.ONE_TIME) {
            handle = callGateway("schedule-once",
                    () -> durableScheduler.scheduleOnce(job.getId(), queue, schedule.getExecuteAt()));
        } else {
            handle = callGateway("schedule-recurring",
                    () -> durableScheduler.scheduleRecurring(job.getId(), queue, schedule.toTriggerExpression(),
                            schedule.getStartTime(), schedule.getEndTime()));
        }
        schedule.assignTriggerHandle(handle);
    }

    /**
     * Clear the handle now and cancel the registration once the current transaction commits.
     * A rollback keeps both the handle and the registration.
     */
    private void release(Schedule schedule) {
        if (!schedule.hasTriggerHandle()) {
            return;
        }
        var handle = schedule.getTriggerHandle();
        var scheduleId = schedule.getId();
        schedule.clearTriggerHandle();

        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            cancelQuietly(handle, scheduleId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                cancelQuietly(handle, scheduleId);
            }
        });
    }

    private void cancelQuietly(String handle, UUID scheduleId) {
        try {
            durableScheduler.cancel(handle);
        } catch (RuntimeException e) {
            metricsConfig.recordGatewayError("cancel");
            log.warn("Cancel of trigger {} for schedule {} failed, handle already cleared: {}", handle, scheduleId, e.getMessage());
        }
    }

    private String callGateway(String operation, Supplier<String> call) {
        try {
            return call.get();
        } catch (GatewayException e) {
            metricsConfig.recordGatewayError(operation);
            throw e;
        } catch (RuntimeException e) {
            metricsConfig.recordGatewayError(operation);
            throw new GatewayException(operation, e);
        }
    }

    private Job findSchedulableJob(UUID jobId) {
        var job = findJob(jobId);
        if (job.getStatus() == JobStatus.DELETED) {
            throw new InvalidStateException("Job", jobId, job.getStatus(), "add a schedule to");
        }
        return job;
    }

    private Job findJob(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> ResourceNotFoundException.job(jobId));
    }

    private Schedule findSchedule(UUID scheduleId) {
        return scheduleRepository.findById(scheduleId).orElseThrow(() -> ResourceNotFoundException.schedule(scheduleId));
    }
}
