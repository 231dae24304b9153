package com.example.jobscheduler.service.retry;

import com.example.jobscheduler.config.MetricsConfig;
import com.example.jobscheduler.domain.model.JobMetadata;
import com.example.jobscheduler.domain.model.RetryState;
import com.example.jobscheduler.domain.model.RetryStrategy;
import com.example.jobscheduler.service.store.SchedulerJobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Maintains the retry state of scheduler jobs.
 * <p>
 * Each call to {@link #scheduleRetry(UUID, RetryStrategy)} consumes exactly one attempt,
 * so it must be called once per failed execution. The read-modify-write of the retry state
 * happens under a row lock, which serializes concurrent calls for the same job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchedulerJobRetryService {

    private final SchedulerJobStore jobStore;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Schedule the next retry of a failed job.
     *
     * @param jobId    the failed job
     * @param strategy backoff policy of the job
     * @return the new retry state, or empty if the strategy is exhausted and the job
     * should be treated as permanently failed
     * @throws com.example.jobscheduler.exception.JobNotFoundException if the job does not exist
     */
    public Optional<RetryState> scheduleRetry(UUID jobId, RetryStrategy strategy) {
        var consumedAttempts = new AtomicInteger();

        var updated = jobStore.modifyMetadata(jobId, metadata -> {
            var attempts = metadata.getRetryState().map(RetryState::getAttempts).orElse(0);
            consumedAttempts.set(attempts);

            if (attempts >= strategy.getMaxAttempts()) {
                return metadata.withoutRetry();
            }

            var nextAt = clock.instant().plus(strategy.interval(attempts));
            return metadata.withRetry(new RetryState(attempts + 1, nextAt));
        });

        var retry = updated.getRetryState();
        if (retry.isEmpty()) {
            log.warn("Retry attempts exhausted for job {} ({} of {} attempts used)",
                    jobId, consumedAttempts.get(), strategy.getMaxAttempts());
            metricsConfig.recordRetryExhausted(updated.getJobType());
        } else {
            log.debug("Scheduled retry {} for job {} at {}", retry.get().getAttempts(), jobId, retry.get().getNextAt());
            metricsConfig.recordRetry(updated.getJobType(), retry.get().getAttempts());
        }

        return retry;
    }

    /**
     * Drop any outstanding retry state after a successful execution.
     */
    public void clearRetry(UUID jobId) {
        jobStore.modifyMetadata(jobId, JobMetadata::withoutRetry);
        log.debug("Cleared retry state of job {}", jobId);
    }
}
