package com.example.jobscheduler.service.gateway;

import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-memory durable scheduler for gateway tests. Tracks live handles and can be told to fail.
 */
@Getter
@Setter
class FakeDurableScheduler implements DurableScheduler {

    private final Map<String, String> live = new HashMap<>();
    private final List<String> calls = new ArrayList<>();
    private boolean failRegister;
    private boolean failCancel;
    private int sequence;

    @Override
    public String enqueueNow(UUID jobId, String queue) {
        return register("enqueue " + queue);
    }

    @Override
    public String scheduleRecurring(UUID jobId, String queue, String cronExpression, Instant startTime, Instant endTime) {
        return register("recurring " + queue + " " + cronExpression);
    }

    @Override
    public String scheduleOnce(UUID jobId, String queue, Instant runAt) {
        return register("once " + queue);
    }

    @Override
    public void cancel(String handle) {
        calls.add("cancel " + handle);
        if (failCancel) {
            throw new IllegalStateException("scheduler unavailable");
        }
        live.remove(handle);
    }

    private String register(String call) {
        calls.add(call);
        if (failRegister) {
            throw new IllegalStateException("scheduler unavailable");
        }
        var handle = "h-" + (++sequence);
        live.put(handle, call);
        return handle;
    }
}
