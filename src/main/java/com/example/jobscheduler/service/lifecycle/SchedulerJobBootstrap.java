package com.example.jobscheduler.service.lifecycle;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.entity.SchedulerJob;
import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.domain.model.JobMetadata;
import com.example.jobscheduler.exception.MetadataDeserializationException;
import com.example.jobscheduler.exception.ScheduleParseException;
import com.example.jobscheduler.service.handler.JobHandlerRegistry;
import com.example.jobscheduler.service.schedule.ScheduleAnalyzer;
import com.example.jobscheduler.service.store.SchedulerJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Reconciles stored jobs with the current configuration on startup, before the first tick.
 * <p>
 * For every stored job:
 * - unreadable metadata: the job is stopped and startup continues
 * - no handler for its type: the job is removed
 * - a second job of a unique type: the duplicate is removed
 * - otherwise the job is resumed or replaced, see {@link JobLifecycleService#resumeOrReplace}
 * <p>
 * Unique job types with a configured schedule and no surviving job are then created.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SchedulerJobBootstrap implements SmartLifecycle {

    private final SchedulerJobStore jobStore;
    private final JobHandlerRegistry handlerRegistry;
    private final JobLifecycleService lifecycleService;
    private final ScheduleAnalyzer scheduleAnalyzer;
    private final JobSchedulerProperties properties;

    private volatile boolean running = false;

    @Override
    public void start() {
        log.info("Resuming stored scheduler jobs...");

        var definitions = configuredDefinitions();
        var liveUniqueTypes = EnumSet.noneOf(SchedulerJobType.class);

        // Collected up front: replaced jobs get new ids that would otherwise show up later in the walk.
        var storedJobs = jobStore.all(properties.getJobsPageSize()).toList();
        for (var job : storedJobs) {
            try {
                reconcile(job, definitions, liveUniqueTypes);
            } catch (RuntimeException e) {
                log.error("Failed to resume job {}: {}", job.getId(), e.getMessage(), e);
            }
        }

        for (var definition : definitions.values()) {
            if (liveUniqueTypes.contains(definition.getJobType())) {
                continue;
            }
            try {
                lifecycleService.create(definition);
            } catch (RuntimeException e) {
                log.error("Failed to create {} job: {}", definition.getJobType(), e.getMessage(), e);
            }
        }

        log.info("Scheduler bootstrap finished, {} stored jobs processed", storedJobs.size());
        this.running = true;
    }

    private void reconcile(SchedulerJob job, Map<SchedulerJobType, SchedulerJobDefinition> definitions,
                           Set<SchedulerJobType> liveUniqueTypes) {
        if (job.isStopped()) {
            log.debug("Job {} is stopped, leaving it as is", job.getId());
            return;
        }

        var jobId = job.getId();
        JobMetadata metadata;
        try {
            metadata = jobStore.decodeMetadata(job);
        } catch (MetadataDeserializationException e) {
            log.error("Job {} has unreadable metadata and will be stopped: {}", jobId, e.getMessage());
            jobStore.stop(jobId);
            return;
        }
        var jobType = metadata.getJobType();

        if (handlerRegistry.getHandler(jobType).isEmpty()) {
            log.warn("No handler registered for {} job {}, removing it", jobType, jobId);
            jobStore.remove(jobId);
            return;
        }

        if (jobType.isUnique()) {
            if (liveUniqueTypes.contains(jobType)) {
                log.error("Found a duplicate of unique {} job: {}, removing it", jobType, jobId);
                jobStore.remove(jobId);
                return;
            }

            var fresh = definitions.get(jobType);
            if (fresh == null) {
                log.warn("No schedule configured for unique {} job {}, removing it", jobType, jobId);
                jobStore.remove(jobId);
                return;
            }

            lifecycleService.resumeOrReplace(job, metadata, fresh);
            liveUniqueTypes.add(jobType);
            return;
        }

        // On-demand jobs carry their own schedule, so their definition can only be checked for validity.
        try {
            scheduleAnalyzer.parse(job.getSchedule());
        } catch (ScheduleParseException e) {
            log.error("Job {} has an invalid schedule and will be stopped: {}", jobId, e.getMessage());
            jobStore.stop(jobId);
            return;
        }
        lifecycleService.resumeOrReplace(job, metadata, new SchedulerJobDefinition(jobType, job.getSchedule()));
    }

    private Map<SchedulerJobType, SchedulerJobDefinition> configuredDefinitions() {
        var definitions = new EnumMap<SchedulerJobType, SchedulerJobDefinition>(SchedulerJobType.class);
        for (var handler : handlerRegistry.getHandlers()) {
            var type = handler.getJobType();
            if (!type.isUnique()) {
                continue;
            }
            handler.getSchedule().ifPresentOrElse(
                    schedule -> definitions.put(type, new SchedulerJobDefinition(type, schedule)),
                    () -> log.warn("Unique job type {} has no schedule and will not be created", type));
        }
        return definitions;
    }

    @Override
    public void stop() {
        this.running = false;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
