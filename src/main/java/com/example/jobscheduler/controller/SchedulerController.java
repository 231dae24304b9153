package com.example.jobscheduler.controller;

import com.example.jobscheduler.dto.ApiResponse;
import com.example.jobscheduler.dto.CreateJobRequest;
import com.example.jobscheduler.dto.ParseScheduleRequest;
import com.example.jobscheduler.dto.ParseScheduleResponse;
import com.example.jobscheduler.dto.SchedulerJobResponse;
import com.example.jobscheduler.exception.JobNotFoundException;
import com.example.jobscheduler.mapper.SchedulerJobMapper;
import com.example.jobscheduler.service.lifecycle.JobLifecycleService;
import com.example.jobscheduler.service.schedule.ScheduleAnalyzer;
import com.example.jobscheduler.service.store.SchedulerJobStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API controller for the scheduler.
 * <p>
 * Provides endpoints for:
 * - Validating cron schedules against the minimum interval policy
 * - Creating on-demand jobs
 * - Inspecting and removing stored jobs
 */
@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/scheduler")
@Tag(name = "Scheduler", description = "APIs for schedules and scheduler jobs")
public class SchedulerController {

    private final ScheduleAnalyzer scheduleAnalyzer;
    private final JobLifecycleService lifecycleService;
    private final SchedulerJobStore jobStore;
    private final SchedulerJobMapper jobMapper;

    @PostMapping("/parse-schedule")
    @Operation(summary = "Parse a schedule", description = "Compute the minimum interval and the next occurrences of a cron expression")
    public ResponseEntity<ApiResponse<ParseScheduleResponse>> parseSchedule(@Valid @RequestBody ParseScheduleRequest request) {
        log.info("API: Parse schedule '{}'", request.getSchedule());

        var info = scheduleAnalyzer.validateSchedule(request.getSchedule());
        var response = ParseScheduleResponse.builder()
                .minInterval(info.getMinInterval().getSeconds())
                .nextOccurrences(info.getNextOccurrences())
                .build();
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @PostMapping("/jobs")
    @Operation(summary = "Create a job", description = "Create a job on demand, unique job types are refused if one already exists")
    public ResponseEntity<ApiResponse<SchedulerJobResponse>> createJob(@Valid @RequestBody CreateJobRequest request) {
        log.info("API: Create {} job with schedule '{}'", request.getJobType(), request.getSchedule());

        scheduleAnalyzer.validateSchedule(request.getSchedule());
        var jobId = lifecycleService.createJob(request.getJobType(), request.getSchedule());
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(toResponse(jobId), "Job created successfully"));
    }

    @GetMapping("/jobs/{jobId}")
    @Operation(summary = "Get a job", description = "Retrieve the stored state of a job")
    public ResponseEntity<ApiResponse<SchedulerJobResponse>> getJob(@Parameter(description = "Job ID") @PathVariable UUID jobId) {
        return ResponseEntity.ok(ApiResponse.success(toResponse(jobId)));
    }

    @DeleteMapping("/jobs/{jobId}")
    @Operation(summary = "Remove a job", description = "Delete a job from the store")
    public ResponseEntity<ApiResponse<Void>> removeJob(@Parameter(description = "Job ID") @PathVariable UUID jobId) {
        log.info("API: Remove job {}", jobId);

        if (!lifecycleService.removeJob(jobId)) {
            throw new JobNotFoundException(jobId);
        }
        return ResponseEntity.ok(ApiResponse.success(null, "Job removed successfully"));
    }

    private SchedulerJobResponse toResponse(UUID jobId) {
        var job = jobStore.get(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
        return jobMapper.toResponse(job, jobStore.decodeMetadata(job));
    }
}
