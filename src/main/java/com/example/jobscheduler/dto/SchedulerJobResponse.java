package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Stored state of a scheduler job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchedulerJobResponse {

    private UUID id;
    private SchedulerJobType jobType;
    private String schedule;
    private Instant lastTick;
    private Instant nextTick;
    private int runCount;
    private boolean stopped;
    private Integer retryAttempts;
    private Instant retryNextAt;
}
