package com.example.jobscheduler.exception;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import lombok.Getter;

import java.util.UUID;

/**
 * Exception for a second live instance of a unique job kind
 */
@Getter
public class DuplicateJobException extends RuntimeException {

    private final SchedulerJobType jobType;
    private final UUID existingJobId;

    public DuplicateJobException(SchedulerJobType jobType, UUID existingJobId) {
        super(String.format("Job of unique type %s already exists: %s", jobType, existingJobId));
        this.jobType = jobType;
        this.existingJobId = existingJobId;
    }
}
