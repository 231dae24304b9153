package com.example.jobscheduler.service.executor;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.exception.SchedulerStoreException;
import com.example.jobscheduler.service.lifecycle.ExecutionOutcome;
import com.example.jobscheduler.service.lifecycle.JobLifecycleService;
import com.example.jobscheduler.service.store.SchedulerJobStore;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * The scheduler tick loop: finds due jobs and dispatches them to the job executor.
 * <p>
 * Flow:
 * 1. Tick runs on a fixed delay, guarded by ShedLock across processes
 * 2. Walks the due jobs page by page, ordered by next tick
 * 3. Submits each job that is not already running to the executor
 * 4. Does not wait for job bodies, a slow job never holds up the others
 * <p>
 * A job stays due until its execution records the next tick, so a job that is still
 * running is seen again by later ticks and skipped.
 */
@Slf4j
@Service
@ConditionalOnProperty(prefix = "job-scheduler", name = "tick-enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerTickService {

    private final SchedulerJobStore jobStore;
    private final JobLifecycleService lifecycleService;
    private final JobSchedulerProperties properties;
    private final ExecutorService schedulerJobExecutor;
    private final Clock clock;

    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public SchedulerTickService(SchedulerJobStore jobStore, JobLifecycleService lifecycleService, JobSchedulerProperties properties,
                                @Qualifier("schedulerJobExecutor") ExecutorService schedulerJobExecutor, Clock clock) {
        this.jobStore = jobStore;
        this.lifecycleService = lifecycleService;
        this.properties = properties;
        this.schedulerJobExecutor = schedulerJobExecutor;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${job-scheduler.tick-interval-ms:1000}", initialDelayString = "${job-scheduler.initial-delay-ms:5000}")
    @SchedulerLock(name = "schedulerJobsTick", lockAtMostFor = "5m")
    public void tick() {
        if (!isRunning.compareAndSet(false, true)) {
            log.debug("Previous tick still running, skipping");
            return;
        }

        try {
            var now = clock.instant();
            var dispatched = 0;

            try (var dueJobs = jobStore.dueBefore(now, properties.getJobsPageSize())) {
                var iterator = dueJobs.iterator();
                while (iterator.hasNext()) {
                    if (dispatch(iterator.next())) {
                        dispatched++;
                    }
                }
            }

            if (dispatched > 0) {
                log.debug("Dispatched {} due jobs", dispatched);
            }
        } catch (SchedulerStoreException e) {
            log.error("Failed to load due jobs, will try again on next tick: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Error in scheduler tick: {}", e.getMessage(), e);
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Submit a job unless it is already running.
     *
     * @return true if the job was submitted
     */
    boolean dispatch(UUID jobId) {
        if (!inFlight.add(jobId)) {
            log.debug("Job {} is still running, skipping", jobId);
            return false;
        }

        try {
            CompletableFuture.supplyAsync(() -> runJob(jobId), schedulerJobExecutor)
                    .whenComplete((outcome, error) -> {
                        inFlight.remove(jobId);
                        if (error != null) {
                            log.error("Job {} terminated abnormally: {}", jobId, error.getMessage(), error);
                        }
                    });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(jobId);
            log.warn("Job executor rejected job {}, it stays due: {}", jobId, e.getMessage());
            return false;
        }
    }

    private ExecutionOutcome runJob(UUID jobId) {
        try {
            var outcome = lifecycleService.execute(jobId);
            log.debug("Job {} finished: {}", jobId, outcome);
            return outcome;
        } catch (SchedulerStoreException e) {
            log.error("Store error while running job {}, it stays due: {}", jobId, e.getMessage());
            return ExecutionOutcome.SKIPPED;
        } catch (Exception e) {
            log.error("Unexpected error while running job {}: {}", jobId, e.getMessage(), e);
            return ExecutionOutcome.SKIPPED;
        }
    }

    /**
     * Number of jobs currently executing
     */
    public int getInFlightCount() {
        return inFlight.size();
    }
}
