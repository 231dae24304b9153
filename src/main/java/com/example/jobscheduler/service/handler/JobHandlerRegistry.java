package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry for job handlers.
 * <p>
 * Automatically discovers and registers all JobHandler beans.
 * Provides lookup by job type.
 */
@Slf4j
@Component
public class JobHandlerRegistry {

    private final Map<SchedulerJobType, JobHandler> handlers = new EnumMap<>(SchedulerJobType.class);
    private final List<JobHandler> handlerBeans;

    public JobHandlerRegistry(List<JobHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var type = handler.getJobType();
            if (handlers.containsKey(type)) {
                log.warn("Duplicate handler for job type {}: {} will override {}",
                        type, handler.getClass().getSimpleName(),
                        handlers.get(type).getClass().getSimpleName());
            }
            handlers.put(type, handler);
            log.info("Registered handler for job type {}: {}", type, handler.getClass().getSimpleName());
        }

        for (var type : SchedulerJobType.values()) {
            if (!handlers.containsKey(type)) {
                log.warn("No handler registered for job type: {}", type);
            }
        }
    }

    public Optional<JobHandler> getHandler(SchedulerJobType jobType) {
        return Optional.ofNullable(handlers.get(jobType));
    }

    public Collection<JobHandler> getHandlers() {
        return Collections.unmodifiableCollection(handlers.values());
    }
}
