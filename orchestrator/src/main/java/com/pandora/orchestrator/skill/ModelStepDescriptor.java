package com.pandora.orchestrator.skill;

import java.time.Duration;
import java.util.Map;

/**
 * Describes a MODEL-tier step.
 *
 * @param capability     what the model is asked to do; selects temperature
 * @param promptTemplate user prompt with {@code {{path.to.value}}} placeholders
 * @param outputSchema   JSON schema the answer must follow, or empty for free text
 * @param maxTokens      response budget
 * @param timeout        wall-clock limit for the call, or null for the configured default
 */
public record ModelStepDescriptor(
        Capability          capability,
        String              promptTemplate,
        Map<String, Object> outputSchema,
        int                 maxTokens,
        Duration            timeout) {

    public enum Capability { REASON, EXTRACT, CLASSIFY, GENERATE }

    public static final int DEFAULT_MAX_TOKENS = 4096;

    public ModelStepDescriptor {
        if (promptTemplate == null || promptTemplate.isBlank()) {
            throw new IllegalArgumentException("Model step needs a prompt template");
        }
        if (capability == null) capability = Capability.REASON;
        outputSchema = outputSchema == null ? Map.of() : Map.copyOf(outputSchema);
        if (maxTokens <= 0) maxTokens = DEFAULT_MAX_TOKENS;
    }

    public static ModelStepDescriptor reason(String promptTemplate) {
        return new ModelStepDescriptor(Capability.REASON, promptTemplate, Map.of(), DEFAULT_MAX_TOKENS, null);
    }

    public static ModelStepDescriptor classify(String promptTemplate, Map<String, Object> schema) {
        return new ModelStepDescriptor(Capability.CLASSIFY, promptTemplate, schema, DEFAULT_MAX_TOKENS, null);
    }

    /** True when the answer should be parsed as JSON. */
    public boolean expectsJson() {
        return !outputSchema.isEmpty();
    }
}
