package com.example.jobscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Job Scheduler Service Application
 * <p>
 * A persistent job scheduler with a backoff-based retry engine.
 * <p>
 * Features:
 * - Durable cron-driven jobs that survive process restarts
 * - Resume or replace of persisted jobs at startup
 * - Constant, linear and exponential retry strategies
 * - Tick loop guarded by ShedLock so only one instance dispatches at a time
 * - Schedule validation API with minimum interval policy
 */
@EnableScheduling
@SpringBootApplication
public class JobSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(JobSchedulerApplication.class, args);
    }
}
