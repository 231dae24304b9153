package com.example.jobscheduler.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to analyze a cron expression
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ParseScheduleRequest {

    @NotBlank(message = "Schedule is required")
    private String schedule;
}
