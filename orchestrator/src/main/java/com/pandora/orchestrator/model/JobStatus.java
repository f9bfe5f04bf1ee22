package com.pandora.orchestrator.model;

/**
 * State of a background job.
 *
 * Transitions:
 *   PENDING → RUNNING   (claimed by a worker)
 *   RUNNING → COMPLETED (handler returned)
 *   RUNNING → PENDING   (handler threw, attempts left)
 *   RUNNING → FAILED    (attempts exhausted)
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED
}
