package com.example.jobscheduler.service.lifecycle;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.entity.SchedulerJob;
import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.domain.model.JobMetadata;
import com.example.jobscheduler.domain.model.RetryState;
import com.example.jobscheduler.domain.model.RetryStrategy;
import com.example.jobscheduler.domain.model.ScheduleInfo;
import com.example.jobscheduler.exception.DuplicateJobException;
import com.example.jobscheduler.exception.MetadataDeserializationException;
import com.example.jobscheduler.exception.ScheduleParseException;
import com.example.jobscheduler.service.handler.JobContext;
import com.example.jobscheduler.service.handler.JobHandler;
import com.example.jobscheduler.service.handler.JobHandlerRegistry;
import com.example.jobscheduler.service.handler.SchedulerHandle;
import com.example.jobscheduler.service.retry.SchedulerJobRetryService;
import com.example.jobscheduler.service.schedule.ScheduleAnalyzer;
import com.example.jobscheduler.service.store.SchedulerJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Creates, resumes and runs scheduler jobs.
 * <p>
 * Execution contains every failure of a job body: the failure is logged with the job id and
 * attempt count, handed to the retry service when the job has a retry strategy, and turned
 * into an {@link ExecutionOutcome}. Nothing a job body throws reaches the tick loop.
 * <p>
 * This service is also the {@link SchedulerHandle} given to job bodies.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JobLifecycleService implements SchedulerHandle {

    private final SchedulerJobStore jobStore;
    private final JobHandlerRegistry handlerRegistry;
    private final ScheduleAnalyzer scheduleAnalyzer;
    private final SchedulerJobRetryService retryService;
    private final MetricsConfig metricsConfig;
    private final JobSchedulerProperties properties;
    private final Clock clock;

    // === Creation ===

    /**
     * Build a fresh job from its definition and persist it.
     *
     * @throws ScheduleParseException if the schedule is malformed
     */
    public SchedulerJob create(SchedulerJobDefinition definition) {
        var now = clock.instant();
        var nextTick = scheduleAnalyzer.next(definition.getSchedule(), now)
                .orElseThrow(() -> new ScheduleParseException(definition.getSchedule(), "schedule has no upcoming occurrences"));

        var job = SchedulerJob.builder()
                .id(UUID.randomUUID())
                .schedule(definition.getSchedule())
                .nextTick(nextTick.getEpochSecond())
                .extra(jobStore.encodeMetadata(JobMetadata.of(definition.getJobType())))
                .build();
        jobStore.upsert(job);

        log.info("Created {} job {} with schedule '{}', first run at {}",
                definition.getJobType(), job.getId(), definition.getSchedule(), nextTick);
        return job;
    }

    /**
     * Create a job on demand. Unique job types are refused when a live job of the type exists.
     */
    @Override
    public synchronized UUID createJob(SchedulerJobType jobType, String schedule) {
        var definition = new SchedulerJobDefinition(jobType, schedule);
        scheduleAnalyzer.parse(definition.getSchedule());

        if (jobType.isUnique()) {
            var existing = findLiveJobOfType(jobType);
            if (existing.isPresent()) {
                throw new DuplicateJobException(jobType, existing.get());
            }
        }

        return create(definition).getId();
    }

    @Override
    public boolean removeJob(UUID jobId) {
        return jobStore.remove(jobId);
    }

    // === Resume or replace ===

    /**
     * Reconcile a stored job with the definition the current configuration produces.
     * <p>
     * Equal definitions resume the stored job, keeping its id, ticks, run count and retry
     * state. Different definitions replace it with a fresh job, dropping any retry state.
     *
     * @return the job that is live afterwards
     */
    public SchedulerJob resumeOrReplace(SchedulerJob stored, JobMetadata metadata, SchedulerJobDefinition fresh) {
        var storedDefinition = stored.getSchedule() != null
                ? new SchedulerJobDefinition(metadata.getJobType(), stored.getSchedule())
                : null;

        if (!fresh.equals(storedDefinition)) {
            log.info("Definition of {} job {} changed from {} to {}, replacing it",
                    metadata.getJobType(), stored.getId(), storedDefinition, fresh);
            jobStore.remove(stored.getId());
            return create(fresh);
        }

        if (stored.getNextTick() == null) {
            var nextTick = scheduleAnalyzer.next(fresh.getSchedule(), clock.instant())
                    .orElseThrow(() -> new ScheduleParseException(fresh.getSchedule(), "schedule has no upcoming occurrences"));
            jobStore.updateNextTick(stored.getId(), nextTick);
            stored.setNextTick(nextTick.getEpochSecond());
        }

        log.info("Resumed {} job {} (runs: {}, next run at {}, retry: {})", metadata.getJobType(), stored.getId(),
                stored.getRunCount(), stored.getNextTickInstant(), metadata.getRetry());
        return stored;
    }

    // === Execution ===

    /**
     * Run a due job once and advance its schedule.
     *
     * @throws com.example.jobscheduler.exception.SchedulerStoreException if the store fails outside the job body,
     *                                                                    the job then stays due
     */
    public ExecutionOutcome execute(UUID jobId) {
        var storedJob = jobStore.get(jobId);
        if (storedJob.isEmpty()) {
            log.warn("Job {} no longer exists, skipping", jobId);
            return ExecutionOutcome.SKIPPED;
        }

        var job = storedJob.get();
        if (job.isStopped()) {
            log.debug("Job {} is stopped, skipping", jobId);
            return ExecutionOutcome.SKIPPED;
        }

        // The tick may hand over a job that another execution already advanced.
        var now = clock.instant();
        if (job.getNextTick() == null || job.getNextTick() > now.getEpochSecond()) {
            log.debug("Job {} is not due until {}, skipping", jobId, job.getNextTickInstant());
            return ExecutionOutcome.SKIPPED;
        }

        JobMetadata metadata;
        try {
            metadata = jobStore.decodeMetadata(job);
        } catch (MetadataDeserializationException e) {
            log.error("Job {} has unreadable metadata and will be stopped: {}", jobId, e.getMessage());
            jobStore.stop(jobId);
            return ExecutionOutcome.SKIPPED;
        }

        var handler = handlerRegistry.getHandler(metadata.getJobType());
        if (handler.isEmpty()) {
            log.error("No handler registered for {} job {}, it will be stopped", metadata.getJobType(), jobId);
            jobStore.stop(jobId);
            return ExecutionOutcome.SKIPPED;
        }

        if (!isRetryPermitted(job, metadata, now)) {
            log.debug("Retry of job {} is not permitted before {}, skipping", jobId, metadata.getRetry().getNextAt());
            return ExecutionOutcome.SKIPPED;
        }

        var timerSample = metricsConfig.startJobExecutionTimer();

        log.debug("Running {} job {}", metadata.getJobType(), jobId);
        var failure = runBody(handler.get(), new JobContext(jobId, metadata, this));

        ExecutionOutcome outcome;
        RetryState retry = null;
        if (failure == null) {
            if (metadata.getRetry() != null) {
                retryService.clearRetry(jobId);
                log.info("{} job {} succeeded after {} retry attempts", metadata.getJobType(), jobId, metadata.getRetry().getAttempts());
            }
            outcome = ExecutionOutcome.SUCCEEDED;
        } else {
            var attempts = metadata.getRetryState().map(RetryState::getAttempts).orElse(0);
            log.error("{} job {} failed (retry attempts used: {}): {}",
                    metadata.getJobType(), jobId, attempts, failure.getMessage(), failure);

            var strategy = handler.get().getRetryStrategy();
            if (strategy.isEmpty()) {
                outcome = ExecutionOutcome.FAILED;
            } else {
                retry = retryService.scheduleRetry(jobId, strategy.get()).orElse(null);
                if (retry != null) {
                    log.warn("{} job {} will be retried (attempt {}) at {}",
                            metadata.getJobType(), jobId, retry.getAttempts(), retry.getNextAt());
                    outcome = ExecutionOutcome.RETRY_SCHEDULED;
                } else {
                    log.error("{} job {} failed permanently: {} retry attempts exhausted",
                            metadata.getJobType(), jobId, strategy.get().getMaxAttempts());
                    outcome = ExecutionOutcome.RETRY_EXHAUSTED;
                }
            }
        }

        metricsConfig.recordJobExecution(timerSample, metadata.getJobType(), outcome);
        advanceSchedule(job, now, clock.instant(), retry);
        return outcome;
    }

    /**
     * A pending retry may run once its time has come, or earlier when a regular occurrence
     * falls due in the meantime.
     */
    private boolean isRetryPermitted(SchedulerJob job, JobMetadata metadata, Instant now) {
        var retry = metadata.getRetry();
        if (retry == null || !now.isBefore(retry.getNextAt())) {
            return true;
        }
        if (job.getLastTick() == null) {
            return true;
        }

        try {
            return scheduleAnalyzer.next(job.getSchedule(), job.getLastTickInstant())
                    .map(occurrence -> !occurrence.isAfter(now))
                    .orElse(false);
        } catch (ScheduleParseException e) {
            return false;
        }
    }

    private Throwable runBody(JobHandler handler, JobContext context) {
        try {
            handler.execute(context);
            return null;
        } catch (Throwable e) {
            return e;
        }
    }

    /**
     * Record the run and move the next tick to the next occurrence after the run finished,
     * or to the pending retry if that comes first. Occurrences missed while the body ran are
     * not caught up. A job without further occurrences and no pending retry is stopped.
     */
    private void advanceSchedule(SchedulerJob job, Instant startedAt, Instant finishedAt, RetryState retry) {
        Instant nextTick;
        try {
            nextTick = scheduleAnalyzer.next(job.getSchedule(), finishedAt).orElse(null);
        } catch (ScheduleParseException e) {
            log.error("Job {} has an invalid schedule and will be stopped: {}", job.getId(), e.getMessage());
            nextTick = null;
        }

        if (retry != null && (nextTick == null || retry.getNextAt().isBefore(nextTick))) {
            nextTick = retry.getNextAt();
        }

        if (nextTick == null) {
            jobStore.recordTick(job.getId(), startedAt, startedAt);
            jobStore.stop(job.getId());
            return;
        }

        jobStore.recordTick(job.getId(), startedAt, nextTick);
    }

    // === Scheduler handle ===

    @Override
    public Optional<RetryState> scheduleRetry(UUID jobId, RetryStrategy strategy) {
        return retryService.scheduleRetry(jobId, strategy);
    }

    @Override
    public ScheduleInfo parseSchedule(String schedule) {
        return scheduleAnalyzer.parseSchedule(schedule);
    }

    private Optional<UUID> findLiveJobOfType(SchedulerJobType jobType) {
        try (var jobs = jobStore.all(properties.getJobsPageSize())) {
            return jobs.filter(job -> !job.isStopped())
                    .filter(job -> hasType(job, jobType))
                    .map(SchedulerJob::getId)
                    .findFirst();
        }
    }

    private boolean hasType(SchedulerJob job, SchedulerJobType jobType) {
        try {
            return jobStore.decodeMetadata(job).getJobType() == jobType;
        } catch (MetadataDeserializationException e) {
            log.warn("Ignoring job {} with unreadable metadata: {}", job.getId(), e.getMessage());
            return false;
        }
    }
}
