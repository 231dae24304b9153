package com.example.jobscheduler.service.handler;

import java.util.UUID;

/**
 * Runs the web page tracker bound to a scheduler job.
 */
public interface WebPageTrackerTrigger {

    /**
     * @throws Exception if the tracker could not be run
     */
    void trigger(UUID jobId) throws Exception;
}
