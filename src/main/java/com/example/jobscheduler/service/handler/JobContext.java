package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.domain.model.JobMetadata;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.UUID;

/**
 * Everything a job body receives for a single execution.
 */
@Getter
@ToString
@AllArgsConstructor
public class JobContext {

    private final UUID jobId;

    /**
     * Metadata as it was when the execution started
     */
    private final JobMetadata metadata;

    @ToString.Exclude
    private final SchedulerHandle scheduler;
}
