package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.JobSchedulerProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Exponential backoff between attempts: retry n waits base^n seconds.
 */
@Component
@RequiredArgsConstructor
public class RetryBackoff {

    private final JobSchedulerProperties properties;

    public long delayMillis(int retryNumber) {
        if (retryNumber <= 0) {
            return 0;
        }
        return (long) Math.pow(properties.getRetryBaseDelaySeconds(), retryNumber) * 1000L;
    }

    /**
     * Sleep before the given retry. Interruption (shutdown) aborts the wait.
     */
    public void pause(int retryNumber) throws InterruptedException {
        var delay = delayMillis(retryNumber);
        if (delay > 0) {
            TimeUnit.MILLISECONDS.sleep(delay);
        }
    }
}
