package com.example.jobscheduler.dto;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to create a job on demand
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateJobRequest {

    @NotNull(message = "Job type is required")
    private SchedulerJobType jobType;

    /**
     * Six-field cron expression
     */
    @NotBlank(message = "Schedule is required")
    private String schedule;
}
