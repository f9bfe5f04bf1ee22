package com.pandora.orchestrator.runtime;

/**
 * Lifecycle of a skill run. A run with at least one failed step is FAILED even
 * when independent branches completed; their outputs are still returned.
 */
public enum RunStatus {
    RUNNING,
    COMPLETED,
    FAILED
}
