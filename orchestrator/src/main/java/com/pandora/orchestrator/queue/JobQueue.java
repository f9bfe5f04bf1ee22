package com.pandora.orchestrator.queue;

import java.util.UUID;

/**
 * Job queue as seen by producers. Enqueueing joins the caller's transaction,
 * so a job is visible to workers only if the caller commits.
 */
public interface JobQueue {

    UUID createJob(JobRequest request);
}
