package com.example.jobscheduler.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the job scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler")
public class JobSchedulerProperties {

    /**
     * Delay in milliseconds between two ticks of the scheduler loop
     */
    @Min(100)
    private long tickIntervalMs = 1000;

    /**
     * Delay in milliseconds before the first tick after startup
     */
    @Min(0)
    private long initialDelayMs = 5000;

    /**
     * Whether the tick loop is started at all
     */
    private boolean tickEnabled = true;

    /**
     * Page size used when iterating over stored jobs
     */
    @Min(1)
    private int jobsPageSize = 1000;

    /**
     * Number of threads executing job bodies
     */
    @Min(1)
    private int executorPoolSize = 20;

    /**
     * Cron schedule of the notifications send job
     */
    @NotBlank
    private String notificationsSendSchedule = "0/30 * * * * *";

    /**
     * Maximum number of notifications sent per run of the notifications send job
     */
    @Min(1)
    private int maxNotificationsToSend = 100;

    /**
     * Page size used when fetching pending notifications
     */
    @Min(1)
    private int notificationsPageSize = 100;

    /**
     * Schedules accepted through the API must not fire more often than this
     */
    @NotNull
    private Duration minScheduleInterval = Duration.ofHours(1);

    /**
     * Number of upcoming occurrences returned when a schedule is analyzed
     */
    @Min(1)
    private int upcomingOccurrences = 5;

    /**
     * Retry policy of web page tracker jobs
     */
    @Valid
    @NotNull
    private Retry trackerRetry = new Retry();

    @Data
    public static class Retry {

        @NotNull
        private Duration initialInterval = Duration.ofMinutes(1);

        @Min(1)
        private int multiplier = 2;

        @NotNull
        private Duration maxInterval = Duration.ofMinutes(10);

        @Min(0)
        private int maxAttempts = 3;
    }
}
