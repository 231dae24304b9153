package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.domain.model.RetryStrategy;

import java.util.Optional;

/**
 * Body of a scheduler job.
 * <p>
 * Each job type should have exactly one handler. Handlers should:
 * - Be stateless
 * - Signal failure by throwing, the scheduler contains and logs it
 * - Bound the amount of work done per execution themselves
 */
public interface JobHandler {

    /**
     * Get the job type this handler runs
     */
    SchedulerJobType getJobType();

    /**
     * Run the job once.
     *
     * @throws Exception on failure, which triggers the retry strategy if one is defined
     */
    void execute(JobContext context) throws Exception;

    /**
     * Backoff policy applied when {@link #execute(JobContext)} fails. No retry by default.
     */
    default Optional<RetryStrategy> getRetryStrategy() {
        return Optional.empty();
    }

    /**
     * Schedule of the single job of a unique type, created at startup. Types whose jobs
     * are created on demand return empty.
     */
    default Optional<String> getSchedule() {
        return Optional.empty();
    }
}
