package com.pandora.orchestrator.runtime;

import java.time.Duration;

/**
 * Final state of one step in a run.
 *
 * @param errorType {@code FUNCTION_ERROR}, {@code MODEL_ERROR}, {@code TIMEOUT},
 *                  {@code PARSE_ERROR} or {@code UNKNOWN_FUNCTION}; null unless FAILED
 */
public record StepOutcome(
        String     stepId,
        String     outputKey,
        StepStatus status,
        Duration   duration,
        String     errorType,
        String     error,
        long       tokensUsed) {

    public static StepOutcome completed(String stepId, String outputKey, Duration duration, long tokens) {
        return new StepOutcome(stepId, outputKey, StepStatus.COMPLETED, duration, null, null, tokens);
    }

    public static StepOutcome failed(String stepId, String outputKey, Duration duration,
                                     String errorType, String error) {
        return new StepOutcome(stepId, outputKey, StepStatus.FAILED, duration, errorType, error, 0);
    }

    public static StepOutcome skipped(String stepId, String outputKey, String reason) {
        return new StepOutcome(stepId, outputKey, StepStatus.SKIPPED, Duration.ZERO, null, reason, 0);
    }

    public boolean isCompleted() { return status == StepStatus.COMPLETED; }
}
