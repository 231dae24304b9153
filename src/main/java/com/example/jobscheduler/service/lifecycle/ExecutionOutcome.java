package com.example.jobscheduler.service.lifecycle;

/**
 * What happened to a single execution of a scheduler job.
 */
public enum ExecutionOutcome {

    /**
     * The job body completed normally
     */
    SUCCEEDED,

    /**
     * The job body failed and another attempt was scheduled
     */
    RETRY_SCHEDULED,

    /**
     * The job body failed and the retry strategy is exhausted
     */
    RETRY_EXHAUSTED,

    /**
     * The job body failed and the job has no retry strategy
     */
    FAILED,

    /**
     * The job was not run (missing, stopped or unreadable)
     */
    SKIPPED
}
