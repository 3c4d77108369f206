package com.example.jobscheduler.service.handler;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry for job handlers.
 * <p>
 * Collects every JobHandler bean once at startup and resolves handler types by key.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<String, JobHandler> handlers = new HashMap<>();
    private final List<JobHandler> handlerBeans;

    public JobHandlerRegistry(List<JobHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var type = handler.getHandlerType();
            if (handlers.containsKey(type)) {
                log.warn("Duplicate handler for type {}: {} will override {}",
                        type, handler.getClass().getSimpleName(),
                        handlers.get(type).getClass().getSimpleName());
            }
            handlers.put(type, handler);
            log.info("Registered handler for type {}: {}", type, handler.getClass().getSimpleName());
        }
    }

    public Optional<JobHandler> getHandler(String handlerType) {
        return Optional.ofNullable(handlers.get(handlerType));
    }

    public boolean hasHandler(String handlerType) {
        return handlers.containsKey(handlerType);
    }

    /**
     * Registered handler types, sorted for display
     */
    public Set<String> getRegisteredTypes() {
        return Collections.unmodifiableSet(new TreeSet<>(handlers.keySet()));
    }
}
