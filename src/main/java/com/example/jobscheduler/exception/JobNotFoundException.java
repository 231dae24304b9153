package com.example.jobscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for scheduler job not found
 */
@Getter
public class JobNotFoundException extends RuntimeException {

    private final UUID jobId;

    public JobNotFoundException(UUID jobId) {
        super(String.format("Could not find a job state for the scheduler job ('%s').", jobId));
        this.jobId = jobId;
    }
}
