package com.example.jobscheduler.domain.model;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;
import java.util.Optional;

/**
 * Application metadata stored in the opaque extra slot of a scheduler job.
 */
@Getter
@ToString
@EqualsAndHashCode
public class JobMetadata {

    private final SchedulerJobType jobType;

    /**
     * Present only while a retry is outstanding
     */
    private final RetryState retry;

    public JobMetadata(SchedulerJobType jobType, RetryState retry) {
        this.jobType = Objects.requireNonNull(jobType, "jobType");
        this.retry = retry;
    }

    public static JobMetadata of(SchedulerJobType jobType) {
        return new JobMetadata(jobType, null);
    }

    public Optional<RetryState> getRetryState() {
        return Optional.ofNullable(retry);
    }

    public JobMetadata withRetry(RetryState retry) {
        return new JobMetadata(jobType, retry);
    }

    public JobMetadata withoutRetry() {
        return new JobMetadata(jobType, null);
    }
}
