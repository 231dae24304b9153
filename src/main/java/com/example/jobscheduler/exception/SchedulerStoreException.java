package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for persistence failures of the job store
 */
@Getter
public class SchedulerStoreException extends RuntimeException {

    private final String operation;

    public SchedulerStoreException(String operation, Exception cause) {
        super(String.format("Job store operation '%s' failed: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }
}
