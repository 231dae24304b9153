package com.example.jobscheduler.service.lifecycle;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Objects;

/**
 * The parameters that define a job. Two jobs with equal definitions are interchangeable,
 * which is what decides between resuming and replacing a stored job at startup.
 */
@Getter
@ToString
@EqualsAndHashCode
public class SchedulerJobDefinition {

    private final SchedulerJobType jobType;
    private final String schedule;

    public SchedulerJobDefinition(SchedulerJobType jobType, String schedule) {
        this.jobType = Objects.requireNonNull(jobType, "jobType");
        this.schedule = Objects.requireNonNull(schedule, "schedule").trim();
    }
}
