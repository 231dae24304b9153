package com.example.jobscheduler.config;

import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.domain.repository.SchedulerJobRepository;
import com.example.jobscheduler.service.lifecycle.ExecutionOutcome;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics for monitoring scheduler health.
 * <p>
 * Exposes Prometheus metrics for:
 * - Stored and stopped job counts
 * - Execution times by job type and outcome
 * - Scheduled and exhausted retries
 * - Sent notifications
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final SchedulerJobRepository jobRepository;

    private final AtomicLong storedJobs = new AtomicLong(0);
    private final AtomicLong stoppedJobs = new AtomicLong(0);

    @PostConstruct
    public void initializeMetrics() {
        Gauge.builder("job_scheduler_jobs", storedJobs, AtomicLong::get)
                .description("Number of stored scheduler jobs")
                .register(meterRegistry);

        Gauge.builder("job_scheduler_stopped_jobs", stoppedJobs, AtomicLong::get)
                .description("Number of stopped scheduler jobs")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${job-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            storedJobs.set(jobRepository.count());
            stoppedJobs.set(jobRepository.countByStoppedTrue());
        } catch (Exception e) {
            log.warn("Failed to refresh scheduler job gauges: {}", e.getMessage());
        }
    }

    public Timer.Sample startJobExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordJobExecution(Timer.Sample sample, SchedulerJobType jobType, ExecutionOutcome outcome) {
        sample.stop(Timer.builder("job_scheduler_execution_time")
                .tag("type", jobType.name().toLowerCase())
                .tag("outcome", outcome.name().toLowerCase())
                .description("Job execution time")
                .register(meterRegistry));
    }

    public void recordRetry(SchedulerJobType jobType, int attemptNumber) {
        meterRegistry.counter("job_scheduler_retries",
                "type", jobType.name().toLowerCase(),
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordRetryExhausted(SchedulerJobType jobType) {
        meterRegistry.counter("job_scheduler_retries_exhausted",
                "type", jobType.name().toLowerCase()
        ).increment();
    }

    public void recordNotificationsSent(int count) {
        meterRegistry.counter("job_scheduler_notifications_sent").increment(count);
    }
}
