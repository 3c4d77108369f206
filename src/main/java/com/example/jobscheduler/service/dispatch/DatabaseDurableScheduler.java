package com.example.jobscheduler.service.dispatch;

import com.example.jobscheduler.domain.entity.TriggerRegistration;
import com.example.jobscheduler.domain.repository.TriggerRegistrationRepository;
import com.example.jobscheduler.exception.GatewayException;
import com.example.jobscheduler.service.gateway.DurableScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Durable scheduler backed by the trigger_registrations table.
 * The handle is the registration id; {@link TriggerDispatchService} fires due rows.
 * <p>
 * Registrations join the caller's transaction, so a schedule's status and its
 * registration commit together.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DatabaseDurableScheduler implements DurableScheduler {

    private final TriggerRegistrationRepository triggerRepository;

    @Override
    @Transactional
    public String enqueueNow(UUID jobId, String queue) {
        var registration = save("enqueue", () -> TriggerRegistration.immediate(jobId, queue));
        log.info("Enqueued job {} on queue {} (trigger {})", jobId, queue, registration.getId());
        return registration.getId().toString();
    }

    @Override
    @Transactional
    public String scheduleRecurring(UUID jobId, String queue, String cronExpression, Instant startTime, Instant endTime) {
        var registration = save("schedule-recurring",
                () -> TriggerRegistration.recurring(jobId, queue, cronExpression, startTime, endTime));
        log.info("Registered recurring trigger {} for job {} with cron '{}', first fire at {}",
                registration.getId(), jobId, cronExpression, registration.getNextFireTime());
        return registration.getId().toString();
    }

    @Override
    @Transactional
    public String scheduleOnce(UUID jobId, String queue, Instant runAt) {
        var registration = save("schedule-once", () -> TriggerRegistration.once(jobId, queue, runAt));
        log.info("Registered one-time trigger {} for job {} at {}", registration.getId(), jobId, runAt);
        return registration.getId().toString();
    }

    /**
     * Runs in its own transaction: the gateway calls it after the caller's transaction
     * has committed, when that transaction can no longer take new work.
     */
    @Override
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void cancel(String handle) {
        UUID id;
        try {
            id = UUID.fromString(handle);
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new GatewayException("cancel", "Malformed trigger handle: " + handle, e);
        }

        try {
            var registration = triggerRepository.findById(id).orElse(null);
            if (registration == null || !registration.isActive()) {
                log.debug("Trigger {} already gone, nothing to cancel", handle);
                return;
            }
            registration.cancel();
            triggerRepository.save(registration);
            log.info("Cancelled trigger {} for job {}", handle, registration.getJobId());
        } catch (DataAccessException e) {
            throw new GatewayException("cancel", e);
        }
    }

    private TriggerRegistration save(String operation, Supplier<TriggerRegistration> factory) {
        try {
            return triggerRepository.save(factory.get());
        } catch (DataAccessException | IllegalArgumentException e) {
            throw new GatewayException(operation, e);
        }
    }
}
