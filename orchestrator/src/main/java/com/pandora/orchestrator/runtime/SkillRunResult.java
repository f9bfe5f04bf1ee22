package com.pandora.orchestrator.runtime;

import com.pandora.orchestrator.evidence.EvidenceBundle;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything a finished skill run produced.
 *
 * @param steps       per-step outcome in declaration order
 * @param evidence    null when the skill has no evidence builder or the builder failed
 * @param finalOutput output of the last declared step, if it completed
 */
public record SkillRunResult(
        String                   runId,
        String                   skillId,
        String                   workspaceId,
        RunStatus                status,
        Map<String, Object>      outputs,
        Map<String, StepOutcome> steps,
        EvidenceBundle           evidence,
        Duration                 duration,
        long                     tokenUsage,
        List<String>             errors,
        Object                   finalOutput) {

    public SkillRunResult {
        outputs = Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        steps   = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        errors  = List.copyOf(errors);
    }

    public StepStatus stepStatus(String stepId) {
        StepOutcome outcome = steps.get(stepId);
        return outcome == null ? null : outcome.status();
    }

    public long count(StepStatus status) {
        return steps.values().stream().filter(o -> o.status() == status).count();
    }
}
