package com.pandora.orchestrator.runtime;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pandora.orchestrator.model.SkillRun;
import com.pandora.orchestrator.repository.SkillRunRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Persists skill runs to {@code skill_runs}.
 *
 * A failed write is logged and dropped: losing the history row must not turn
 * a successful analysis into a failed one.
 */
@Component
public class SkillRunRecorder {

    private static final Logger log = LoggerFactory.getLogger(SkillRunRecorder.class);

    private final SkillRunRepository runs;
    private final ObjectMapper json;

    public SkillRunRecorder(SkillRunRepository runs, ObjectMapper objectMapper) {
        this.runs = runs;
        this.json = objectMapper;
    }

    public void started(RunContext ctx, String trigger, Instant startedAt) {
        try {
            runs.save(new SkillRun(ctx.runId(), ctx.skillId(), ctx.workspaceId(), trigger, startedAt));
        } catch (RuntimeException e) {
            log.warn("Could not record start of skill '{}' run {} (workspace {}): {}",
                    ctx.skillId(), ctx.runId(), ctx.workspaceId(), e.getMessage());
        }
    }

    public void finished(SkillRunResult result, String trigger, Instant startedAt, Instant completedAt) {
        try {
            SkillRun row = runs.findById(result.runId())
                    .orElseGet(() -> new SkillRun(result.runId(), result.skillId(), result.workspaceId(), trigger, startedAt));
            row.setStatus(result.status());
            row.setCompletedAt(completedAt);
            row.setDurationMs(result.duration().toMillis());
            row.setTokenUsage(result.tokenUsage());
            row.setStepsJson(toJson(result.steps()));
            row.setOutputJson(toJson(result.finalOutput()));
            row.setEvidenceJson(result.evidence() == null ? null : toJson(result.evidence()));
            row.setErrorsJson(toJson(result.errors()));
            runs.save(row);
        } catch (RuntimeException e) {
            log.warn("Could not record result of skill '{}' run {} (workspace {}): {}",
                    result.skillId(), result.runId(), result.workspaceId(), e.getMessage());
        }
    }

    private String toJson(Object value) {
        try {
            return json.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.warn("Skill run field is not serialisable ({}); storing its string form", e.getOriginalMessage());
            return json.valueToTree(String.valueOf(value)).toString();
        }
    }
}
