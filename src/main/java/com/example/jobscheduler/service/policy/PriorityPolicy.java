package com.example.jobscheduler.service.policy;

import com.example.jobscheduler.domain.enums.JobPriority;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Maps a job priority to its queue, per-attempt timeout and retry budget.
 * <p>
 * Critical work fails fast and is retried aggressively; low priority work gets a
 * longer timeout and a single retry. The table is immutable and safe to share.
 */
@Component
public class PriorityPolicy {

    private static final Map<JobPriority, ExecutionBudget> BUDGETS;

    static {
        var budgets = new EnumMap<JobPriority, ExecutionBudget>(JobPriority.class);
        budgets.put(JobPriority.CRITICAL, new ExecutionBudget("critical", Duration.ofSeconds(60), 5));
        budgets.put(JobPriority.HIGH, new ExecutionBudget("high", Duration.ofSeconds(300), 3));
        budgets.put(JobPriority.DEFAULT, new ExecutionBudget("default", Duration.ofSeconds(300), 3));
        budgets.put(JobPriority.LOW, new ExecutionBudget("low", Duration.ofSeconds(600), 1));
        BUDGETS = Collections.unmodifiableMap(budgets);
    }

    public ExecutionBudget budgetFor(JobPriority priority) {
        Objects.requireNonNull(priority, "priority");
        return BUDGETS.get(priority);
    }

    public String queueFor(JobPriority priority) {
        return budgetFor(priority).getQueue();
    }
}
