package com.pandora.orchestrator.queue;

import com.pandora.orchestrator.model.BackgroundJob;

import java.util.Map;

/**
 * Processes jobs of one type. Throwing marks the attempt failed; the job is
 * retried until it runs out of attempts.
 */
public interface JobHandler {

    String jobType();

    void handle(BackgroundJob job, Map<String, Object> payload) throws Exception;
}
