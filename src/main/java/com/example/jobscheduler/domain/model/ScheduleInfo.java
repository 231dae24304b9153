package com.example.jobscheduler.domain.model;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Result of analyzing a cron expression.
 */
@Getter
@ToString
@AllArgsConstructor
public class ScheduleInfo {

    private final Duration minInterval;
    private final List<Instant> nextOccurrences;
}
