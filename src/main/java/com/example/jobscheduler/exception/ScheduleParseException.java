package com.example.jobscheduler.exception;

import lombok.Getter;

/**
 * Exception for malformed or unusable cron expressions
 */
@Getter
public class ScheduleParseException extends RuntimeException {

    private final String schedule;

    public ScheduleParseException(String schedule, String message) {
        super(String.format("Invalid schedule '%s': %s", schedule, message));
        this.schedule = schedule;
    }

    public ScheduleParseException(String schedule, Exception cause) {
        super(String.format("Invalid schedule '%s': %s", schedule, cause.getMessage()), cause);
        this.schedule = schedule;
    }
}
