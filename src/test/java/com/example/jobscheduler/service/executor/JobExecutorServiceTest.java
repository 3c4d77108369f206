package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.entity.JobExecutionLog;
import com.example.jobscheduler.domain.enums.ExecutionStatus;
import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.domain.repository.JobExecutionLogRepository;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.exception.InvalidStateException;
import com.example.jobscheduler.exception.JobHandlerException;
import com.example.jobscheduler.exception.ResourceNotFoundException;
import com.example.jobscheduler.service.alert.SlackAlertService;
import com.example.jobscheduler.service.handler.JobHandler;
import com.example.jobscheduler.service.handler.JobHandlerRegistry;
import com.example.jobscheduler.service.policy.ExecutionBudget;
import com.example.jobscheduler.service.policy.PriorityPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("JobExecutorService Tests")
class JobExecutorServiceTest {

    @Mock
    private JobRepository jobRepository;

    @Mock
    private JobExecutionLogRepository executionLogRepository;

    @Mock
    private JobHandlerRegistry handlerRegistry;

    @Mock
    private RetryBackoff retryBackoff;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    @Mock
    private JobHandler handler;

    private PriorityPolicy priorityPolicy;
    private ExecutorService handlerExecutor;
    private JobExecutorService jobExecutorService;

    private UUID jobId;

    @BeforeEach
    void setUp() {
        priorityPolicy = spy(new PriorityPolicy());
        handlerExecutor = Executors.newCachedThreadPool();
        jobExecutorService = new JobExecutorService(jobRepository, executionLogRepository, handlerRegistry, priorityPolicy,
                new RetryClassifier(), retryBackoff, slackAlertService, metricsConfig, handlerExecutor);
        jobId = UUID.randomUUID();
    }

    @AfterEach
    void tearDown() {
        handlerExecutor.shutdownNow();
    }

    private Job job(JobStatus status, JobPriority priority) {
        return Job.builder()
                .id(jobId)
                .name("test-job")
                .handlerType("test-handler")
                .parameters("{\"k\":1}")
                .status(status)
                .priority(priority)
                .build();
    }

    private void givenRunnableJob(JobPriority priority) {
        when(jobRepository.findById(jobId)).thenReturn(Optional.of(job(JobStatus.ACTIVE, priority)));
        when(executionLogRepository.save(any(JobExecutionLog.class))).thenAnswer(inv -> inv.getArgument(0));
        lenient().when(handlerRegistry.getHandler("test-handler")).thenReturn(Optional.of(handler));
    }

    @Nested
    @DisplayName("Precondition Tests")
    class PreconditionTests {

        @Test
        @DisplayName("Should fail with NotFound and write no log when job is missing")
        void shouldFailWhenJobMissing() {
            when(jobRepository.findById(jobId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> jobExecutorService.execute(jobId, "t:1"))
                    .isInstanceOf(ResourceNotFoundException.class);
            verifyNoInteractions(executionLogRepository);
        }

        @Test
        @DisplayName("Should fail with InvalidState and write no log when job is paused")
        void shouldFailWhenJobPaused() {
            when(jobRepository.findById(jobId)).thenReturn(Optional.of(job(JobStatus.PAUSED, JobPriority.DEFAULT)));

            assertThatThrownBy(() -> jobExecutorService.execute(jobId, "t:1"))
                    .isInstanceOf(InvalidStateException.class);
            verifyNoInteractions(executionLogRepository, handlerRegistry);
        }
    }

    @Nested
    @DisplayName("Successful Execution Tests")
    class SuccessTests {

        @Test
        @DisplayName("Should complete on first attempt")
        void shouldCompleteOnFirstAttempt() throws Exception {
            // Given
            givenRunnableJob(JobPriority.DEFAULT);
            when(handler.execute("{\"k\":1}")).thenReturn("done");

            // When
            var executionLog = jobExecutorService.execute(jobId, "trigger:1");

            // Then
            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(executionLog.getResult()).isEqualTo("done");
            assertThat(executionLog.getErrorMessage()).isNull();
            assertThat(executionLog.getAttempts()).isEqualTo(1);
            assertThat(executionLog.getExecutionId()).isEqualTo("trigger:1");
            assertThat(executionLog.getDurationMs()).isNotNull();
            verify(executionLogRepository, times(2)).save(executionLog);
            verify(retryBackoff, never()).pause(anyInt());
            verify(metricsConfig).recordExecution(any(), eq(JobPriority.DEFAULT), eq(true));
        }

        @Test
        @DisplayName("Should use manual execution id when none is given")
        void shouldUseManualExecutionId() throws Exception {
            givenRunnableJob(JobPriority.LOW);
            when(handler.execute(anyString())).thenReturn("ok");

            var executionLog = jobExecutorService.execute(jobId, null);

            assertThat(executionLog.getExecutionId()).isEqualTo(JobExecutorService.MANUAL_EXECUTION_ID);
        }

        @Test
        @DisplayName("Should retry a transient failure and prefix the result")
        void shouldRetryTransientFailure() throws Exception {
            // Given
            givenRunnableJob(JobPriority.HIGH);
            when(handler.execute(anyString()))
                    .thenThrow(new RuntimeException("upstream timeout"))
                    .thenReturn("done");

            // When
            var executionLog = jobExecutorService.execute(jobId, "trigger:1");

            // Then
            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.SUCCEEDED);
            assertThat(executionLog.getResult()).isEqualTo("succeeded on retry 1: done");
            assertThat(executionLog.getAttempts()).isEqualTo(2);
            verify(retryBackoff).pause(1);
            verify(metricsConfig).recordFailure(JobPriority.HIGH, FailureKind.TRANSIENT);
            verify(metricsConfig).recordRetry(JobPriority.HIGH, 1);
        }
    }

    @Nested
    @DisplayName("Failed Execution Tests")
    class FailureTests {

        @Test
        @DisplayName("Should not retry a fatal failure")
        void shouldNotRetryFatalFailure() throws Exception {
            givenRunnableJob(JobPriority.DEFAULT);
            when(handler.execute(anyString())).thenThrow(new IllegalArgumentException("bad input"));

            var executionLog = jobExecutorService.execute(jobId, "trigger:1");

            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(executionLog.getErrorMessage()).isEqualTo("bad input");
            assertThat(executionLog.getErrorStack()).startsWith(IllegalArgumentException.class.getName());
            assertThat(executionLog.getResult()).isNull();
            assertThat(executionLog.getAttempts()).isEqualTo(1);
            verify(retryBackoff, never()).pause(anyInt());
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Should trust the handler's non-retryable flag over the message")
        void shouldTrustHandlerFlag() throws Exception {
            givenRunnableJob(JobPriority.DEFAULT);
            when(handler.execute(anyString())).thenThrow(JobHandlerException.fatal("test-handler", "network policy rejected"));

            var executionLog = jobExecutorService.execute(jobId, "trigger:1");

            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(executionLog.getAttempts()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should exhaust the retry budget of a LOW job")
        void shouldExhaustLowRetryBudget() throws Exception {
            givenRunnableJob(JobPriority.LOW);
            when(handler.execute(anyString())).thenThrow(new IOException("connection reset"));

            var executionLog = jobExecutorService.execute(jobId, "trigger:1");

            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(executionLog.getAttempts()).isEqualTo(2);
            assertThat(executionLog.getErrorMessage()).isEqualTo("connection reset");
            verify(retryBackoff).pause(1);
            verifyNoInteractions(slackAlertService);
        }

        @Test
        @DisplayName("Should fail without retry when no handler is registered")
        void shouldFailWhenHandlerMissing() throws Exception {
            givenRunnableJob(JobPriority.HIGH);
            when(handlerRegistry.getHandler("test-handler")).thenReturn(Optional.empty());

            var executionLog = jobExecutorService.execute(jobId, "trigger:1");

            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(executionLog.getErrorMessage()).isEqualTo("No handler registered for type: test-handler");
            assertThat(executionLog.getAttempts()).isEqualTo(1);
            verify(retryBackoff, never()).pause(anyInt());
        }
    }

    @Nested
    @DisplayName("Critical Job Tests")
    class CriticalTests {

        @BeforeEach
        void shortenCriticalTimeout() {
            doReturn(new ExecutionBudget("critical", Duration.ofMillis(100), 5))
                    .when(priorityPolicy).budgetFor(JobPriority.CRITICAL);
        }

        @Test
        @DisplayName("Should time out six times and notify exactly once")
        void shouldTimeOutAndNotifyOnce() throws Exception {
            // Given
            givenRunnableJob(JobPriority.CRITICAL);
            when(handler.execute(anyString())).thenAnswer(inv -> {
                Thread.sleep(5_000);
                return "too late";
            });

            // When
            var executionLog = jobExecutorService.execute(jobId, "trigger:1");

            // Then
            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(executionLog.getAttempts()).isEqualTo(6);
            assertThat(executionLog.getErrorMessage()).contains("timed out");
            verify(retryBackoff, times(5)).pause(anyInt());
            verify(metricsConfig, times(6)).recordFailure(JobPriority.CRITICAL, FailureKind.TIMEOUT);
            verify(metricsConfig).recordCriticalFailure();
            verify(slackAlertService, times(1)).sendCriticalJobFailureAlert(any(Job.class), eq(executionLog));
        }

        @Test
        @DisplayName("Should finalize the log even when notification fails")
        void shouldFinalizeWhenNotificationFails() throws Exception {
            givenRunnableJob(JobPriority.CRITICAL);
            when(handler.execute(anyString())).thenThrow(new IllegalStateException("broken"));
            doThrow(new RuntimeException("slack down")).when(slackAlertService).sendCriticalJobFailureAlert(any(), any());

            var executionLog = jobExecutorService.execute(jobId, "trigger:1");

            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.FAILED);
            assertThat(executionLog.getErrorMessage()).isEqualTo("broken");
        }
    }

    @Nested
    @DisplayName("Interruption Tests")
    class InterruptionTests {

        @Test
        @DisplayName("Should cancel the log when interrupted during backoff")
        void shouldCancelWhenInterrupted() throws Exception {
            // Given
            givenRunnableJob(JobPriority.DEFAULT);
            when(handler.execute(anyString())).thenThrow(new IOException("connection refused"));
            doThrow(new InterruptedException()).when(retryBackoff).pause(1);

            // When
            var executionLog = jobExecutorService.execute(jobId, "trigger:1");
            var interrupted = Thread.interrupted();

            // Then
            assertThat(interrupted).isTrue();
            assertThat(executionLog.getStatus()).isEqualTo(ExecutionStatus.CANCELED);
            assertThat(executionLog.getErrorMessage()).isEqualTo("Execution interrupted");
            assertThat(executionLog.getAttempts()).isEqualTo(1);
            verifyNoInteractions(slackAlertService);
        }
    }
}
