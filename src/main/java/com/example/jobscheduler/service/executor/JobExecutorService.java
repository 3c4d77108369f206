package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.Job;
import com.example.jobscheduler.domain.entity.JobExecutionLog;
import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.repository.JobExecutionLogRepository;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.exception.InvalidStateException;
import com.example.jobscheduler.exception.JobTimeoutException;
import com.example.jobscheduler.exception.ResourceNotFoundException;
import com.example.jobscheduler.service.alert.SlackAlertService;
import com.example.jobscheduler.service.handler.JobHandler;
import com.example.jobscheduler.service.handler.JobHandlerRegistry;
import com.example.jobscheduler.service.policy.ExecutionBudget;
import com.example.jobscheduler.service.policy.PriorityPolicy;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one logical execution of a job.
 * <p>
 * Handles:
 * - Loading the job and checking it is still active
 * - Opening and finalizing exactly one execution log
 * - Racing each attempt against the priority timeout
 * - Classifying failures and retrying with exponential backoff
 * - Metrics recording
 * - Alerting on terminal failure of CRITICAL jobs
 * <p>
 * Not transactional across attempts: each repository write commits on its own so
 * the RUNNING log is visible while the handler works.
 */
@Slf4j
@Service
public class JobExecutorService {

    public static final String MANUAL_EXECUTION_ID = "manual";

    private final JobRepository jobRepository;
    private final JobExecutionLogRepository executionLogRepository;
    private final JobHandlerRegistry handlerRegistry;
    private final PriorityPolicy priorityPolicy;
    private final RetryClassifier retryClassifier;
    private final RetryBackoff retryBackoff;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final ExecutorService handlerExecutor;

    public JobExecutorService(JobRepository jobRepository,
                              JobExecutionLogRepository executionLogRepository,
                              JobHandlerRegistry handlerRegistry,
                              PriorityPolicy priorityPolicy,
                              RetryClassifier retryClassifier,
                              RetryBackoff retryBackoff,
                              SlackAlertService slackAlertService,
                              MetricsConfig metricsConfig,
                              @Qualifier("jobHandlerExecutor") ExecutorService handlerExecutor) {
        this.jobRepository = jobRepository;
        this.executionLogRepository = executionLogRepository;
        this.handlerRegistry = handlerRegistry;
        this.priorityPolicy = priorityPolicy;
        this.retryClassifier = retryClassifier;
        this.retryBackoff = retryBackoff;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.handlerExecutor = handlerExecutor;
    }

    /**
     * Execute a job once, retrying within the same execution as its priority allows.
     *
     * @param jobId       job to run
     * @param executionId id of the firing in the durable scheduler, or {@code null} for a direct call
     * @return the finalized execution log
     * @throws ResourceNotFoundException if the job does not exist (no log is written)
     * @throws InvalidStateException     if the job is not ACTIVE (no log is written)
     */
    public JobExecutionLog execute(UUID jobId, String executionId) {
        var job = jobRepository.findById(jobId).orElseThrow(() -> ResourceNotFoundException.job(jobId));
        if (!job.isActive()) {
            log.warn("Job {} cannot be executed in current state: {}", jobId, job.getStatus());
            throw new InvalidStateException("Job", jobId, job.getStatus(), "execute");
        }

        var budget = priorityPolicy.budgetFor(job.getPriority());
        var timerSample = metricsConfig.startExecutionTimer();
        var executionLog = executionLogRepository.save(
                JobExecutionLog.start(jobId, executionId != null ? executionId : MANUAL_EXECUTION_ID));

        log.info("Starting execution {} of job {} (handler: {}, priority: {}, queue: {})",
                executionLog.getExecutionId(), jobId, job.getHandlerType(), job.getPriority(), budget.getQueue());

        AttemptOutcome outcome;
        try {
            outcome = runAttempts(job, budget, executionLog);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Execution {} of job {} interrupted after {} attempt(s)", executionLog.getExecutionId(), jobId, executionLog.getAttempts());
            executionLog.cancel("Execution interrupted");
            executionLogRepository.save(executionLog);
            metricsConfig.recordExecution(timerSample, job.getPriority(), false);
            return executionLog;
        } catch (RuntimeException e) {
            log.error("Unexpected error executing job {}: {}", jobId, e.getMessage(), e);
            outcome = AttemptOutcome.failure(e, FailureKind.FATAL);
        }

        return finalizeLog(job, executionLog, outcome, timerSample);
    }

    private AttemptOutcome runAttempts(Job job, ExecutionBudget budget, JobExecutionLog executionLog) throws InterruptedException {
        var priority = job.getPriority();
        AttemptOutcome outcome = null;

        for (var attempt = 0; attempt <= budget.getMaxRetries(); attempt++) {
            if (attempt > 0) {
                log.info("Retrying job {} ({}/{}) in {}ms", job.getId(), attempt, budget.getMaxRetries(), retryBackoff.delayMillis(attempt));
                metricsConfig.recordRetry(priority, attempt);
                retryBackoff.pause(attempt);
            }

            executionLog.recordAttempt();
            outcome = runAttempt(job, budget);

            if (outcome.isSuccess()) {
                return attempt > 0 ? outcome.onRetry(attempt) : outcome;
            }

            metricsConfig.recordFailure(priority, outcome.getFailureKind());
            if (!outcome.isRetryable()) {
                log.warn("Job {} attempt {} failed with non-retryable {}: {}", job.getId(), attempt + 1, outcome.getErrorType(), outcome.getErrorMessage());
                return outcome;
            }
            log.warn("Job {} attempt {} failed ({}): {}", job.getId(), attempt + 1, outcome.getFailureKind(), outcome.getErrorMessage());
        }
        return outcome;
    }

    private AttemptOutcome runAttempt(Job job, ExecutionBudget budget) throws InterruptedException {
        var handlerType = job.getHandlerType();
        var handler = handlerRegistry.getHandler(handlerType).orElse(null);
        if (handler == null) {
            return AttemptOutcome.fatal("No handler registered for type: " + handlerType, "HANDLER_NOT_FOUND");
        }

        Future<String> future = handlerExecutor.submit(() -> invoke(handler, job));
        try {
            return AttemptOutcome.success(future.get(budget.getTimeout().toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            // Best effort: a handler that ignores interruption keeps running on its own thread
            future.cancel(true);
            var timeout = new JobTimeoutException(job.getId(), budget.getTimeoutSeconds());
            return AttemptOutcome.failure(timeout, retryClassifier.classify(timeout));
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            return AttemptOutcome.failure(cause, retryClassifier.classify(cause));
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private String invoke(JobHandler handler, Job job) throws Exception {
        return handler.execute(job.getParameters());
    }

    private JobExecutionLog finalizeLog(Job job, JobExecutionLog executionLog, AttemptOutcome outcome, Timer.Sample timerSample) {
        if (outcome.isSuccess()) {
            executionLog.complete(outcome.getResult());
            executionLogRepository.save(executionLog);
            log.info("Job {} completed successfully in {}ms after {} attempt(s)", job.getId(), executionLog.getDurationMs(), executionLog.getAttempts());
            metricsConfig.recordExecution(timerSample, job.getPriority(), true);
            return executionLog;
        }

        executionLog.fail(outcome.getErrorMessage(), outcome.getStackTrace());
        executionLogRepository.save(executionLog);
        log.error("Job {} failed after {} attempt(s): {}", job.getId(), executionLog.getAttempts(), outcome.getErrorMessage());
        metricsConfig.recordExecution(timerSample, job.getPriority(), false);

        if (job.getPriority() == JobPriority.CRITICAL) {
            notifyCriticalFailure(job, executionLog);
        }
        return executionLog;
    }

    private void notifyCriticalFailure(Job job, JobExecutionLog executionLog) {
        try {
            metricsConfig.recordCriticalFailure();
            slackAlertService.sendCriticalJobFailureAlert(job, executionLog);
        } catch (RuntimeException e) {
            log.error("Could not deliver critical failure alert for job {}: {}", job.getId(), e.getMessage(), e);
        }
    }
}
