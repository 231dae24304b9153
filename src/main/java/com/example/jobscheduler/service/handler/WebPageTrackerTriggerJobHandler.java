package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.config.JobSchedulerProperties;
import com.example.jobscheduler.domain.enums.SchedulerJobType;
import com.example.jobscheduler.domain.model.RetryStrategy;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Runs a web page tracker. One job exists per tracker, created on demand with the
 * tracker's own schedule. Failures are retried with exponential backoff.
 */
@Component
@RequiredArgsConstructor
public class WebPageTrackerTriggerJobHandler implements JobHandler {

    private final WebPageTrackerTrigger trigger;
    private final JobSchedulerProperties properties;

    @Override
    public SchedulerJobType getJobType() {
        return SchedulerJobType.WEB_PAGE_TRACKERS_TRIGGER;
    }

    @Override
    public void execute(JobContext context) throws Exception {
        trigger.trigger(context.getJobId());
    }

    @Override
    public Optional<RetryStrategy> getRetryStrategy() {
        var retry = properties.getTrackerRetry();
        return Optional.of(RetryStrategy.exponential(
                retry.getInitialInterval(), retry.getMultiplier(), retry.getMaxInterval(), retry.getMaxAttempts()));
    }
}
