package com.example.jobscheduler.domain.repository;

import com.example.jobscheduler.domain.entity.SchedulerJob;

/**
 * Atomic insert-or-replace of scheduler jobs.
 */
public interface SchedulerJobUpsertRepository {

    /**
     * Insert the job, or overwrite every column of the row with the same id, in one statement.
     */
    void upsert(SchedulerJob job);
}
