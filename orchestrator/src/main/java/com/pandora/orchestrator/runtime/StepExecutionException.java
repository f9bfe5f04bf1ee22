package com.pandora.orchestrator.runtime;

/**
 * A step's underlying function or model call failed. Fails that step only;
 * its dependents are skipped and independent branches keep running.
 */
public class StepExecutionException extends RuntimeException {

    public enum Kind { FUNCTION_ERROR, MODEL_ERROR, TIMEOUT, PARSE_ERROR }

    private final String stepId;
    private final Kind kind;

    public StepExecutionException(String stepId, Kind kind, String message) {
        super("[" + kind + "] step '" + stepId + "': " + message);
        this.stepId = stepId;
        this.kind = kind;
    }

    public StepExecutionException(String stepId, Kind kind, String message, Throwable cause) {
        super("[" + kind + "] step '" + stepId + "': " + message, cause);
        this.stepId = stepId;
        this.kind = kind;
    }

    public String getStepId() { return stepId; }
    public Kind   getKind()   { return kind; }
}
