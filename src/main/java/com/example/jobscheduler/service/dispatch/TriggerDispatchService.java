package com.example.jobscheduler.service.dispatch;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.entity.TriggerRegistration;
import com.example.jobscheduler.domain.repository.TriggerRegistrationRepository;
import com.example.jobscheduler.exception.InvalidStateException;
import com.example.jobscheduler.exception.ResourceNotFoundException;
import com.example.jobscheduler.service.alert.SlackAlertService;
import com.example.jobscheduler.service.executor.JobExecutorService;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fires due trigger registrations and dispatches them to their queue's workers.
 * <p>
 * Flow:
 * 1. Poll runs on a fixed delay, guarded by ShedLock across instances
 * 2. Due rows are claimed with FOR UPDATE SKIP LOCKED and advanced in one transaction
 * 3. After commit, each firing is handed to the worker pool of its queue
 * <p>
 * A recurring trigger whose due times were missed (downtime) fires once and moves to
 * its next future time. Firings are delivered at most once: a crash between commit and
 * execution loses that firing.
 */
@Slf4j
@Service
public class TriggerDispatchService {

    private final TriggerRegistrationRepository triggerRepository;
    private final JobExecutorService jobExecutorService;
    private final QueueWorkerPool workerPool;
    private final JobSchedulerProperties properties;
    private final TransactionTemplate transactionTemplate;
    private final SlackAlertService slackAlertService;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public TriggerDispatchService(TriggerRegistrationRepository triggerRepository, JobExecutorService jobExecutorService,
                                  QueueWorkerPool workerPool, JobSchedulerProperties properties,
                                  TransactionTemplate transactionTemplate, SlackAlertService slackAlertService) {
        this.triggerRepository = triggerRepository;
        this.jobExecutorService = jobExecutorService;
        this.workerPool = workerPool;
        this.properties = properties;
        this.transactionTemplate = transactionTemplate;
        this.slackAlertService = slackAlertService;
    }

    @Scheduled(fixedDelayString = "${job-scheduler.poll-interval-ms:1000}")
    @SchedulerLock(name = "triggerDispatch", lockAtMostFor = "1m")
    public void pollAndDispatch() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous dispatch cycle still running, skipping");
            return;
        }

        try {
            var firings = claimDueFirings(Instant.now());
            if (firings.isEmpty()) {
                log.debug("No triggers due");
                return;
            }

            log.info("Dispatching {} due firing(s)", firings.size());
            firings.forEach(this::dispatch);
        } catch (Exception e) {
            log.error("Error in trigger dispatch cycle: {}", e.getMessage(), e);
            slackAlertService.sendErrorAlert("Trigger dispatch failed", "Due triggers could not be claimed", e.getMessage());
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Claim due registrations and advance them past this firing in a single transaction.
     */
    List<Firing> claimDueFirings(Instant now) {
        var firings = transactionTemplate.execute(status -> {
            var due = triggerRepository.findDueForUpdate(now, properties.getBatchSize());
            var claimed = new ArrayList<Firing>(due.size());
            for (TriggerRegistration registration : due) {
                registration.markFired(now);
                triggerRepository.save(registration);
                claimed.add(new Firing(registration.getJobId(), registration.getQueue(), registration.currentExecutionId()));
            }
            return claimed;
        });
        return firings != null ? firings : List.of();
    }

    private void dispatch(Firing firing) {
        try {
            workerPool.submit(firing.getQueue(), () -> run(firing));
        } catch (RuntimeException e) {
            log.error("Could not dispatch execution {} of job {}: {}", firing.getExecutionId(), firing.getJobId(), e.getMessage(), e);
        }
    }

    private void run(Firing firing) {
        try {
            jobExecutorService.execute(firing.getJobId(), firing.getExecutionId());
        } catch (ResourceNotFoundException | InvalidStateException e) {
            log.warn("Skipping execution {}: {}", firing.getExecutionId(), e.getMessage());
        } catch (Exception e) {
            log.error("Error running execution {} of job {}: {}", firing.getExecutionId(), firing.getJobId(), e.getMessage(), e);
        }
    }

    @Value
    static class Firing {
        UUID jobId;
        String queue;
        String executionId;
    }
}
