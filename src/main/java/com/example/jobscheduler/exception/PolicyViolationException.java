package com.example.jobscheduler.exception;

/**
 * Exception for schedules that parse but are rejected by the interval policy
 */
public class PolicyViolationException extends RuntimeException {

    public PolicyViolationException(String message) {
        super(message);
    }
}
