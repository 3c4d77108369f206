package com.example.jobscheduler.config;

import com.example.jobscheduler.domain.enums.JobPriority;
import com.example.jobscheduler.domain.enums.JobStatus;
import com.example.jobscheduler.domain.enums.TriggerStatus;
import com.example.jobscheduler.domain.repository.JobRepository;
import com.example.jobscheduler.domain.repository.TriggerRegistrationRepository;
import com.example.jobscheduler.service.executor.FailureKind;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for job scheduler health and execution outcomes.
 * <p>
 * Exposes Prometheus metrics for:
 * - Job counts by status
 * - Live trigger registrations
 * - Execution times, failures and retries by priority
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final JobRepository jobRepository;
    private final TriggerRegistrationRepository triggerRepository;

    private final ConcurrentHashMap<String, AtomicLong> gauges = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : JobStatus.values()) {
            var key = "status_" + status.getCode();
            gauges.put(key, new AtomicLong(0));

            Gauge.builder("job_scheduler_jobs", gauges.get(key), AtomicLong::get)
                    .tag("status", status.getCode())
                    .description("Number of jobs by status")
                    .register(meterRegistry);
        }

        gauges.put("active_triggers", new AtomicLong(0));
        Gauge.builder("job_scheduler_active_triggers", gauges.get("active_triggers"), AtomicLong::get)
                .description("Number of live registrations in the durable scheduler")
                .register(meterRegistry);
    }

    /**
     * Periodically refresh gauges from the database
     */
    @Scheduled(fixedDelayString = "${job-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        for (var status : JobStatus.values()) {
            gauges.get("status_" + status.getCode()).set(jobRepository.countByStatus(status));
        }
        gauges.get("active_triggers").set(triggerRepository.countByStatus(TriggerStatus.ACTIVE));
    }

    public Timer.Sample startExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record the duration of one logical execution (all attempts)
     */
    public void recordExecution(Timer.Sample sample, JobPriority priority, boolean success) {
        sample.stop(Timer.builder("job_scheduler_execution_time")
                .tag("priority", priority.name().toLowerCase())
                .tag("success", String.valueOf(success))
                .description("Job execution time including retries")
                .register(meterRegistry));
    }

    public void recordFailure(JobPriority priority, FailureKind kind) {
        meterRegistry.counter("job_scheduler_failures",
                "priority", priority.name().toLowerCase(),
                "kind", kind.name().toLowerCase()
        ).increment();
    }

    public void recordRetry(JobPriority priority, int attemptNumber) {
        meterRegistry.counter("job_scheduler_retries",
                "priority", priority.name().toLowerCase(),
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordCriticalFailure() {
        meterRegistry.counter("job_scheduler_critical_failures").increment();
    }

    public void recordGatewayError(String operation) {
        meterRegistry.counter("job_scheduler_gateway_errors", "operation", operation).increment();
    }
}
