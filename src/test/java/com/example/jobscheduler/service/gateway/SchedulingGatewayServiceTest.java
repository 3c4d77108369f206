package com.example.jobscheduler.service.gateway;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.entity.Schedule;
import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.domain.enums.ScheduleStatus;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.domain.repository.ScheduleRepository;
import com.example.jobscheduler.exception.GatewayException;
import com.example.jobscheduler.exception.InvalidStateException;
import com.example.jobscheduler.exception.JobValidationException;
import com.example.jobscheduler.exception.ResourceNotFoundException;
import com.example.jobscheduler.service.policy.PriorityPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.UUID;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("SchedulingGatewayService Tests")
class SchedulingGatewayServiceTest {

    private static final String ACTOR = "tester";
    private static final String EVERY_MINUTE = "0 * * * * *";

    private final Map<UUID, Job> jobs = new LinkedHashMap<>();
    private final Map<UUID, Schedule> schedules = new LinkedHashMap<>();

    private FakeDurableScheduler durableScheduler;
    private MetricsConfig metricsConfig;
    private ScheduleRepository scheduleRepository;
    private SchedulingGatewayService gateway;

    @BeforeEach
    void setUp() {
        durableScheduler = new FakeDurableScheduler();
        metricsConfig = mock(MetricsConfig.class);

        var jobRepository = mock(JobRepository.class);
        when(jobRepository.findById(any())).thenAnswer(inv -> Optional.ofNullable(jobs.get(inv.<UUID>getArgument(0))));

        scheduleRepository = mock(ScheduleRepository.class);
        when(scheduleRepository.save(any(Schedule.class))).thenAnswer(inv -> {
            Schedule schedule = inv.getArgument(0);
            if (schedule.getId() == null) {
                ReflectionTestUtils.setField(schedule, "id", UUID.randomUUID());
            }
            schedules.put(schedule.getId(), schedule);
            return schedule;
        });
        when(scheduleRepository.findById(any())).thenAnswer(inv -> Optional.ofNullable(schedules.get(inv.<UUID>getArgument(0))));
        when(scheduleRepository.findByJobIdAndStatus(any(), any())).thenAnswer(inv ->
                schedulesOf(inv.getArgument(0)).stream()
                        .filter(s -> s.getStatus() == inv.<ScheduleStatus>getArgument(1))
                        .collect(Collectors.toList()));
        when(scheduleRepository.findByJobIdAndTriggerHandleIsNotNull(any())).thenAnswer(inv ->
                schedulesOf(inv.getArgument(0)).stream()
                        .filter(Schedule::hasTriggerHandle)
                        .collect(Collectors.toList()));
        when(scheduleRepository.findByJobIdAndStatusNotOrderByCreatedAtAsc(any(), any())).thenAnswer(inv ->
                schedulesOf(inv.getArgument(0)).stream()
                        .filter(s -> s.getStatus() != inv.<ScheduleStatus>getArgument(1))
                        .collect(Collectors.toList()));

        gateway = new SchedulingGatewayService(jobRepository, scheduleRepository, durableScheduler,
                new PriorityPolicy(), metricsConfig);
    }

    private List<Schedule> schedulesOf(UUID jobId) {
        return schedules.values().stream()
                .filter(s -> s.getJobId().equals(jobId))
                .collect(Collectors.toList());
    }

    private Job newJob(JobPriority priority, JobStatus status) {
        var job = Job.create("job", null, "noop", null, priority, ACTOR);
        ReflectionTestUtils.setField(job, "id", UUID.randomUUID());
        if (status == JobStatus.ACTIVE || status == JobStatus.PAUSED) {
            job.activate(ACTOR);
        }
        if (status == JobStatus.PAUSED) {
            job.pause(ACTOR);
        }
        if (status == JobStatus.DELETED) {
            job.delete(ACTOR);
        }
        jobs.put(job.getId(), job);
        return job;
    }

    private void activateJob(Job job) {
        job.activate(ACTOR);
        gateway.registerPendingSchedules(job);
    }

    private void pauseJob(Job job) {
        job.pause(ACTOR);
        gateway.releaseSchedules(job);
    }

    @Nested
    @DisplayName("Schedule Creation Tests")
    class CreationTests {

        @Test
        @DisplayName("Should register a cron schedule of an active job")
        void shouldRegisterCronScheduleOfActiveJob() {
            // Given
            var job = newJob(JobPriority.HIGH, JobStatus.ACTIVE);

            // When
            var schedule = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);

            // Then
            assertThat(schedule.getStatus()).isEqualTo(ScheduleStatus.ACTIVE);
            assertThat(schedule.getTriggerHandle()).isEqualTo("h-1");
            assertThat(durableScheduler.getCalls()).containsExactly("recurring high " + EVERY_MINUTE);
        }

        @Test
        @DisplayName("Should defer registration while the job is a draft")
        void shouldDeferRegistrationForDraftJob() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.DRAFT);

            var schedule = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);

            assertThat(schedule.getStatus()).isEqualTo(ScheduleStatus.ACTIVE);
            assertThat(schedule.hasTriggerHandle()).isFalse();
            assertThat(durableScheduler.getCalls()).isEmpty();
        }

        @Test
        @DisplayName("Should turn intervals into cron expressions")
        void shouldTranslateIntervals() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);

            gateway.createIntervalSchedule(job.getId(), 30, null, null, ACTOR);
            gateway.createIntervalSchedule(job.getId(), 300, null, null, ACTOR);

            assertThat(durableScheduler.getCalls()).containsExactly(
                    "recurring default */30 * * * * *",
                    "recurring default 0 */5 * * * *");
        }

        @Test
        @DisplayName("Should register one-time schedules as single firings")
        void shouldRegisterOneTimeSchedule() {
            var job = newJob(JobPriority.LOW, JobStatus.ACTIVE);

            var schedule = gateway.createOneTimeSchedule(job.getId(), Instant.now().plus(Duration.ofHours(1)), ACTOR);

            assertThat(schedule.hasTriggerHandle()).isTrue();
            assertThat(durableScheduler.getCalls()).containsExactly("once low");
        }

        @Test
        @DisplayName("Should save nothing when registration fails")
        void shouldSaveNothingWhenRegistrationFails() {
            // Given
            var job = newJob(JobPriority.CRITICAL, JobStatus.ACTIVE);
            durableScheduler.setFailRegister(true);

            // When / Then
            assertThatThrownBy(() -> gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR))
                    .isInstanceOf(GatewayException.class)
                    .extracting("operation").isEqualTo("schedule-recurring");
            assertThat(schedules).isEmpty();
            verify(metricsConfig).recordGatewayError("schedule-recurring");
        }

        @Test
        @DisplayName("Should reject schedules for deleted or unknown jobs")
        void shouldRejectDeletedOrUnknownJobs() {
            var deleted = newJob(JobPriority.DEFAULT, JobStatus.DELETED);

            assertThatThrownBy(() -> gateway.createCronSchedule(deleted.getId(), EVERY_MINUTE, null, null, ACTOR))
                    .isInstanceOf(InvalidStateException.class);
            assertThatThrownBy(() -> gateway.createCronSchedule(UUID.randomUUID(), EVERY_MINUTE, null, null, ACTOR))
                    .isInstanceOf(ResourceNotFoundException.class);
            verifyNoInteractions(scheduleRepository);
        }
    }

    @Nested
    @DisplayName("Schedule Transition Tests")
    class TransitionTests {

        @Test
        @DisplayName("Should cancel the registration when pausing and re-register on activation")
        void shouldPauseAndReactivate() {
            // Given
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);

            // When
            gateway.pauseSchedule(schedule.getId(), ACTOR);

            // Then
            assertThat(schedule.getStatus()).isEqualTo(ScheduleStatus.PAUSED);
            assertThat(schedule.hasTriggerHandle()).isFalse();
            assertThat(durableScheduler.getLive()).isEmpty();

            // When
            gateway.activateSchedule(schedule.getId(), ACTOR);

            // Then
            assertThat(schedule.getTriggerHandle()).isEqualTo("h-2");
            assertThat(durableScheduler.getLive()).containsOnlyKeys("h-2");
        }

        @Test
        @DisplayName("Should reject activating an already active schedule without registering twice")
        void shouldRejectDoubleActivation() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);

            assertThatThrownBy(() -> gateway.activateSchedule(schedule.getId(), ACTOR))
                    .isInstanceOf(InvalidStateException.class);
            assertThat(durableScheduler.getLive()).hasSize(1);
        }

        @Test
        @DisplayName("Should leave schedule paused when re-registration fails")
        void shouldStayPausedWhenRegistrationFails() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);
            gateway.pauseSchedule(schedule.getId(), ACTOR);
            durableScheduler.setFailRegister(true);

            assertThatThrownBy(() -> gateway.activateSchedule(schedule.getId(), ACTOR))
                    .isInstanceOf(GatewayException.class);

            assertThat(schedule.getStatus()).isEqualTo(ScheduleStatus.PAUSED);
            assertThat(schedule.hasTriggerHandle()).isFalse();
        }

        @Test
        @DisplayName("Should clear the handle even when cancel fails")
        void shouldClearHandleWhenCancelFails() {
            // Given
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);
            durableScheduler.setFailCancel(true);

            // When
            gateway.deleteSchedule(schedule.getId(), ACTOR);

            // Then
            assertThat(schedule.getStatus()).isEqualTo(ScheduleStatus.DELETED);
            assertThat(schedule.hasTriggerHandle()).isFalse();
            verify(metricsConfig).recordGatewayError("cancel");
        }

        @Test
        @DisplayName("Should throw for unknown schedule")
        void shouldThrowForUnknownSchedule() {
            assertThatThrownBy(() -> gateway.pauseSchedule(UUID.randomUUID(), ACTOR))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("Job Cascade Tests")
    class CascadeTests {

        @Test
        @DisplayName("Should register deferred schedules when the job becomes active")
        void shouldRegisterDeferredSchedules() {
            // Given
            var job = newJob(JobPriority.DEFAULT, JobStatus.DRAFT);
            var first = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);
            var second = gateway.createIntervalSchedule(job.getId(), 10, null, null, ACTOR);

            // When
            job.activate(ACTOR);
            var registered = gateway.registerPendingSchedules(job);

            // Then
            assertThat(registered).isEqualTo(2);
            assertThat(first.hasTriggerHandle()).isTrue();
            assertThat(second.hasTriggerHandle()).isTrue();
        }

        @Test
        @DisplayName("Should release registrations but keep schedule statuses when the job pauses")
        void shouldReleaseOnJobPause() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);

            job.pause(ACTOR);
            var released = gateway.releaseSchedules(job);

            assertThat(released).isEqualTo(1);
            assertThat(schedule.getStatus()).isEqualTo(ScheduleStatus.ACTIVE);
            assertThat(schedule.hasTriggerHandle()).isFalse();
            assertThat(durableScheduler.getLive()).isEmpty();
        }

        @Test
        @DisplayName("Should delete every schedule of a deleted job")
        void shouldDeleteAllSchedules() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var active = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);
            var paused = gateway.createIntervalSchedule(job.getId(), 10, null, null, ACTOR);
            gateway.pauseSchedule(paused.getId(), ACTOR);

            job.delete(ACTOR);
            gateway.deleteSchedules(job, ACTOR);

            assertThat(active.getStatus()).isEqualTo(ScheduleStatus.DELETED);
            assertThat(paused.getStatus()).isEqualTo(ScheduleStatus.DELETED);
            assertThat(durableScheduler.getLive()).isEmpty();
            assertThat(gateway.getSchedules(job.getId())).isEmpty();
        }

        @Test
        @DisplayName("Should enqueue immediate executions on the priority queue")
        void shouldEnqueueOnPriorityQueue() {
            var job = newJob(JobPriority.HIGH, JobStatus.ACTIVE);

            var handle = gateway.enqueueNow(job);

            assertThat(handle).isEqualTo("h-1");
            assertThat(durableScheduler.getCalls()).containsExactly("enqueue high");
        }

        @Test
        @DisplayName("Should wrap enqueue failures")
        void shouldWrapEnqueueFailures() {
            var job = newJob(JobPriority.HIGH, JobStatus.ACTIVE);
            durableScheduler.setFailRegister(true);

            assertThatThrownBy(() -> gateway.enqueueNow(job))
                    .isInstanceOf(GatewayException.class)
                    .hasMessageContaining("scheduler unavailable");
            verify(metricsConfig).recordGatewayError(eq("enqueue"));
        }
    }

    @Nested
    @DisplayName("One-Time Schedule Tests")
    class OneTimeTests {

        private Schedule fired(Job job) {
            var schedule = gateway.createOneTimeSchedule(job.getId(), Instant.now().plus(Duration.ofHours(1)), ACTOR);
            ReflectionTestUtils.setField(schedule, "executeAt", Instant.now().minusSeconds(60));
            return schedule;
        }

        @Test
        @DisplayName("Should not register a fired one-time schedule again when its job is re-activated")
        void shouldNotRefireAfterJobReactivation() {
            // Given
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = fired(job);

            // When
            pauseJob(job);
            job.activate(ACTOR);
            var registered = gateway.registerPendingSchedules(job);

            // Then
            assertThat(registered).isZero();
            assertThat(durableScheduler.getCalls()).containsExactly("once default", "cancel h-1");
            assertThat(schedule.getStatus()).isEqualTo(ScheduleStatus.ACTIVE);
            assertThat(schedule.hasTriggerHandle()).isFalse();
            assertThat(durableScheduler.getLive()).isEmpty();
        }

        @Test
        @DisplayName("Should reject re-activating a paused one-time schedule whose time has passed")
        void shouldRejectReactivationOfElapsedSchedule() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = fired(job);
            gateway.pauseSchedule(schedule.getId(), ACTOR);

            assertThatThrownBy(() -> gateway.activateSchedule(schedule.getId(), ACTOR))
                    .isInstanceOf(JobValidationException.class)
                    .extracting("field").isEqualTo("executeAt");
            assertThat(schedule.getStatus()).isEqualTo(ScheduleStatus.PAUSED);
            assertThat(durableScheduler.getCalls()).containsExactly("once default", "cancel h-1");
        }

        @Test
        @DisplayName("Should re-register a one-time schedule that has not come due yet")
        void shouldReregisterPendingOneTimeSchedule() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = gateway.createOneTimeSchedule(job.getId(), Instant.now().plus(Duration.ofHours(1)), ACTOR);

            pauseJob(job);
            activateJob(job);

            assertThat(schedule.getTriggerHandle()).isEqualTo("h-2");
            assertThat(durableScheduler.getCalls()).containsExactly("once default", "cancel h-1", "once default");
        }
    }

    @Nested
    @DisplayName("Transactional Cancel Tests")
    class TransactionalCancelTests {

        @BeforeEach
        void beginTransaction() {
            TransactionSynchronizationManager.initSynchronization();
        }

        @AfterEach
        void endTransaction() {
            TransactionSynchronizationManager.clearSynchronization();
        }

        private void complete(int status) {
            for (var synchronization : TransactionSynchronizationManager.getSynchronizations()) {
                if (status == TransactionSynchronization.STATUS_COMMITTED) {
                    synchronization.afterCommit();
                }
                synchronization.afterCompletion(status);
            }
        }

        @Test
        @DisplayName("Should cancel the registration only after the transaction commits")
        void shouldCancelAfterCommit() {
            // Given
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);

            // When
            gateway.pauseSchedule(schedule.getId(), ACTOR);

            // Then
            assertThat(schedule.hasTriggerHandle()).isFalse();
            assertThat(durableScheduler.getLive()).containsOnlyKeys("h-1");

            // When
            complete(TransactionSynchronization.STATUS_COMMITTED);

            // Then
            assertThat(durableScheduler.getCalls()).containsExactly("recurring default " + EVERY_MINUTE, "cancel h-1");
            assertThat(durableScheduler.getLive()).isEmpty();
        }

        @Test
        @DisplayName("Should keep registrations live when the job pause rolls back")
        void shouldKeepRegistrationsOnRollback() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);
            gateway.createIntervalSchedule(job.getId(), 10, null, null, ACTOR);

            pauseJob(job);
            complete(TransactionSynchronization.STATUS_ROLLED_BACK);

            assertThat(durableScheduler.getLive()).containsOnlyKeys("h-1", "h-2");
            assertThat(durableScheduler.getCalls()).noneMatch(call -> call.startsWith("cancel"));
        }

        @Test
        @DisplayName("Should count a cancel that fails after commit")
        void shouldCountCancelFailureAfterCommit() {
            var job = newJob(JobPriority.DEFAULT, JobStatus.ACTIVE);
            var schedule = gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);
            durableScheduler.setFailCancel(true);

            gateway.deleteSchedule(schedule.getId(), ACTOR);
            verify(metricsConfig, never()).recordGatewayError("cancel");
            complete(TransactionSynchronization.STATUS_COMMITTED);

            assertThat(schedule.getStatus()).isEqualTo(ScheduleStatus.DELETED);
            verify(metricsConfig).recordGatewayError("cancel");
        }
    }

    @Test
    @DisplayName("Should keep handles in step with schedule and job state across random operations")
    void shouldKeepHandlesInStepWithState() {
        var random = new Random(42);
        var jobList = List.of(
                newJob(JobPriority.CRITICAL, JobStatus.DRAFT),
                newJob(JobPriority.DEFAULT, JobStatus.ACTIVE),
                newJob(JobPriority.LOW, JobStatus.ACTIVE));

        for (var step = 0; step < 500; step++) {
            var job = jobList.get(random.nextInt(jobList.size()));
            var owned = new ArrayList<>(schedulesOf(job.getId()));
            var schedule = owned.isEmpty() ? null : owned.get(random.nextInt(owned.size()));
            durableScheduler.setFailRegister(random.nextInt(10) == 0);

            try {
                switch (random.nextInt(6)) {
                    case 0:
                        gateway.createCronSchedule(job.getId(), EVERY_MINUTE, null, null, ACTOR);
                        break;
                    case 1:
                        if (schedule != null) {
                            gateway.activateSchedule(schedule.getId(), ACTOR);
                        }
                        break;
                    case 2:
                        if (schedule != null) {
                            gateway.pauseSchedule(schedule.getId(), ACTOR);
                        }
                        break;
                    case 3:
                        if (schedule != null) {
                            gateway.deleteSchedule(schedule.getId(), ACTOR);
                        }
                        break;
                    case 4:
                        durableScheduler.setFailRegister(false);
                        if (!job.isActive()) {
                            activateJob(job);
                        }
                        break;
                    default:
                        if (job.isActive()) {
                            pauseJob(job);
                        }
                        break;
                }
            } catch (InvalidStateException | GatewayException e) {
                // rejected transitions and failed registrations leave state unchanged
            }

            assertHandlesMatchState();
        }
    }

    private void assertHandlesMatchState() {
        var handles = new ArrayList<String>();
        for (var schedule : schedules.values()) {
            var job = jobs.get(schedule.getJobId());
            assertThat(schedule.hasTriggerHandle())
                    .as("schedule %s (%s) of job %s", schedule.getId(), schedule.getStatus(), job.getStatus())
                    .isEqualTo(schedule.isActive() && job.isActive() && !schedule.hasElapsed());
            if (schedule.hasTriggerHandle()) {
                handles.add(schedule.getTriggerHandle());
            }
        }
        assertThat(handles).containsExactlyInAnyOrderElementsOf(durableScheduler.getLive().keySet());
    }
}
