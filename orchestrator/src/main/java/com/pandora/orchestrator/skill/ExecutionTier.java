package com.pandora.orchestrator.skill;

/**
 * Who produces a step's result.
 *
 * COMPUTE: a deterministic function resolved by name from the step function table.
 * MODEL: a language-model call described by a {@link ModelStepDescriptor}.
 */
public enum ExecutionTier {
    COMPUTE,
    MODEL
}
