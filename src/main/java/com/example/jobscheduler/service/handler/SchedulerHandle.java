package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.domain.model.RetryState;
import com.example.jobscheduler.domain.model.RetryStrategy;
import com.example.jobscheduler.domain.model.ScheduleInfo;

import java.util.Optional;
import java.util.UUID;

/**
 * Operations of the running scheduler that job bodies may call.
 * <p>
 * Passed to every job body through its {@link JobContext} rather than reached through a
 * global, so several independent schedulers can coexist in tests.
 */
public interface SchedulerHandle {

    /**
     * Consume one retry attempt of the job.
     *
     * @return the new retry state, or empty once the strategy is exhausted
     */
    Optional<RetryState> scheduleRetry(UUID jobId, RetryStrategy strategy);

    ScheduleInfo parseSchedule(String schedule);

    /**
     * Create and persist a new job.
     *
     * @return id of the new job
     * @throws com.example.jobscheduler.exception.DuplicateJobException if the type is unique and a job of it exists
     */
    UUID createJob(SchedulerJobType jobType, String schedule);

    boolean removeJob(UUID jobId);
}
