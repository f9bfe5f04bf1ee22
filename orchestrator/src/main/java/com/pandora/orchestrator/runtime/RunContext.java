package com.pandora.orchestrator.runtime;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-execution state of one skill run. Discarded when the run ends.
 *
 * <p>{@code stepOutputs} is append-only: each output key is written exactly
 * once, by the step that owns it, before any dependent step starts. Concurrent
 * branches therefore never write the same slot.
 */
public class RunContext {

    private final String runId;
    private final String skillId;
    private final String workspaceId;
    private final TimeWindows timeWindows;
    private final Map<String, Object> businessContext;
    private final Map<String, Object> triggerPayload;
    private final Map<String, Object> skillOutputs;
    private final Map<String, Object> stepOutputs = new ConcurrentHashMap<>();

    public RunContext(String runId, String skillId, String workspaceId, TimeWindows timeWindows,
                      Map<String, Object> businessContext, Map<String, Object> triggerPayload,
                      Map<String, Object> skillOutputs) {
        this.runId           = runId;
        this.skillId         = skillId;
        this.workspaceId     = workspaceId;
        this.timeWindows     = timeWindows;
        this.businessContext = businessContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(businessContext));
        this.triggerPayload  = triggerPayload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(triggerPayload));
        this.skillOutputs    = skillOutputs == null ? new ConcurrentHashMap<>() : new ConcurrentHashMap<>(skillOutputs);
    }

    public String              runId()           { return runId; }
    public String              skillId()         { return skillId; }
    public String              workspaceId()     { return workspaceId; }
    public TimeWindows         timeWindows()     { return timeWindows; }
    public Map<String, Object> businessContext() { return businessContext; }
    public Map<String, Object> triggerPayload()  { return triggerPayload; }

    /** Cross-skill state; agents pass one skill's final output to the next. */
    public Map<String, Object> skillOutputs()    { return skillOutputs; }

    /**
     * Publish a step result. A {@code null} result is stored as an empty map.
     *
     * @throws IllegalStateException if the key has already been written
     */
    public void recordOutput(String outputKey, Object value) {
        Object previous = stepOutputs.putIfAbsent(outputKey, value == null ? Map.of() : value);
        if (previous != null) {
            throw new IllegalStateException("Step output '" + outputKey + "' was already recorded in run " + runId);
        }
    }

    public Optional<Object> output(String outputKey) {
        return Optional.ofNullable(stepOutputs.get(outputKey));
    }

    public boolean hasOutput(String outputKey) {
        return stepOutputs.containsKey(outputKey);
    }

    /**
     * Dotted-path lookup in the business context, e.g.
     * {@code goals_and_targets.thresholds.stale_deal_days}; empty when any segment is missing.
     */
    public Optional<Object> contextValue(String path) {
        Object current = businessContext;
        for (String segment : path.split("\\.")) {
            if (!(current instanceof Map<?, ?> map)) return Optional.empty();
            current = map.get(segment);
            if (current == null) return Optional.empty();
        }
        return Optional.of(current);
    }

    /** Read-only view of the outputs recorded so far. */
    public Map<String, Object> stepOutputs() {
        return Collections.unmodifiableMap(stepOutputs);
    }
}
