package com.example.jobscheduler.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Result of analyzing a cron expression
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseScheduleResponse {

    /**
     * Minimum interval between two consecutive occurrences, in seconds
     */
    private long minInterval;

    private List<Instant> nextOccurrences;
}
