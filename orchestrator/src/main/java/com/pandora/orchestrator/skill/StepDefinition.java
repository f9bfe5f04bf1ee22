package com.pandora.orchestrator.skill;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One unit of work within a skill.
 *
 * <p>A COMPUTE step names a function ({@code computeFn}); a MODEL step carries a
 * {@link ModelStepDescriptor}. {@code computeArgs} are static parameters merged
 * with the run's accumulated outputs at invocation time. The result becomes
 * visible to later steps and to the evidence builder under {@code outputKey}.
 *
 * <p>Shape checks that involve other steps (dangling or cyclic dependencies)
 * belong to {@code StepGraph}; this record only normalises its own fields.
 */
public record StepDefinition(
        String              id,
        String              name,
        ExecutionTier       tier,
        String              computeFn,
        ModelStepDescriptor model,
        Map<String, Object> computeArgs,
        Set<String>         dependsOn,
        String              outputKey) {

    public StepDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Step id is required");
        }
        if (tier == null) {
            throw new IllegalArgumentException("Step '" + id + "' has no tier");
        }
        if (name == null || name.isBlank()) name = id;
        if (outputKey == null || outputKey.isBlank()) outputKey = id;
        // insertion order is kept so prompts and logs list args as declared
        computeArgs = computeArgs == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(computeArgs));
        dependsOn = dependsOn == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependsOn));
    }

    public static StepDefinition compute(String id, String computeFn, String outputKey,
                                         Map<String, Object> computeArgs, String... dependsOn) {
        return new StepDefinition(id, id, ExecutionTier.COMPUTE, computeFn, null,
                computeArgs, new LinkedHashSet<>(List.of(dependsOn)), outputKey);
    }

    public static StepDefinition model(String id, ModelStepDescriptor model, String outputKey,
                                       String... dependsOn) {
        return new StepDefinition(id, id, ExecutionTier.MODEL, null, model,
                Map.of(), new LinkedHashSet<>(List.of(dependsOn)), outputKey);
    }

    public StepDefinition named(String displayName) {
        return new StepDefinition(id, displayName, tier, computeFn, model, computeArgs, dependsOn, outputKey);
    }
}
