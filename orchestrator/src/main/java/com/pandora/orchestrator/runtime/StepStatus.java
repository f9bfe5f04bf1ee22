package com.pandora.orchestrator.runtime;

public enum StepStatus {
    COMPLETED,
    FAILED,
    SKIPPED   // an upstream step failed or was skipped
}
