package com.pandora.orchestrator.model;

/**
 * Lifecycle of a connector sync.
 *
 * Transitions:
 *   PENDING → RUNNING   (worker picked up the job)
 *   RUNNING → COMPLETED (connector pull finished)
 *   RUNNING → FAILED    (connector error, or reaped after the staleness window)
 */
public enum SyncStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isActive() {
        return this == PENDING || this == RUNNING;
    }
}
