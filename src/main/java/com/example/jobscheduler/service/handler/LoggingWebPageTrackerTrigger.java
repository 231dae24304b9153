package com.example.jobscheduler.service.handler;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Default trigger used when no tracker integration is deployed. An integration replaces it
 * by declaring its own {@code @Primary} bean.
 */
@Slf4j
@Component
public class LoggingWebPageTrackerTrigger implements WebPageTrackerTrigger {

    @Override
    public void trigger(UUID jobId) {
        log.info("Web page tracker triggered by job {}", jobId);
    }
}
