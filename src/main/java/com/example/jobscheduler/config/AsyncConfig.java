package com.example.jobscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Configuration of the worker pool that runs job bodies.
 * <p>
 * Job bodies are mostly I/O bound, so the pool is sized independently of the CPU count.
 * The tick loop only submits work here and never waits for it.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "schedulerJobExecutor", destroyMethod = "shutdown")
    public ExecutorService schedulerJobExecutor(JobSchedulerProperties properties) {
        log.info("Creating scheduler job executor with {} threads", properties.getExecutorPoolSize());

        var factory = new CustomizableThreadFactory("scheduler-job-");
        factory.setDaemon(true);

        return Executors.newFixedThreadPool(properties.getExecutorPoolSize(), factory);
    }
}
