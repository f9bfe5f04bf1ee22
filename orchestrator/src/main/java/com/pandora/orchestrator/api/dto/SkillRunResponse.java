package com.pandora.orchestrator.api.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pandora.orchestrator.model.SkillRun;

import java.time.Instant;

/**
 * Response body for GET /workspaces/{ws}/skill-runs/{runId}. The stored JSON
 * columns are returned as nested objects.
 */
public record SkillRunResponse(
        String   runId,
        String   skillId,
        String   trigger,
        String   status,
        Instant  startedAt,
        Instant  completedAt,
        Long     durationMs,
        long     tokenUsage,
        JsonNode steps,
        JsonNode output,
        JsonNode evidence,
        JsonNode errors
) {
    public static SkillRunResponse from(SkillRun run, ObjectMapper objectMapper) {
        return new SkillRunResponse(
                run.getId(),
                run.getSkillId(),
                run.getTrigger(),
                run.getStatus().name(),
                run.getStartedAt(),
                run.getCompletedAt(),
                run.getDurationMs(),
                run.getTokenUsage(),
                parse(objectMapper, run.getStepsJson()),
                parse(objectMapper, run.getOutputJson()),
                parse(objectMapper, run.getEvidenceJson()),
                parse(objectMapper, run.getErrorsJson())
        );
    }

    private static JsonNode parse(ObjectMapper objectMapper, String json) {
        if (json == null) return null;
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            // stored by SkillRunRecorder, so this only happens on hand-edited rows
            return objectMapper.getNodeFactory().textNode(json);
        }
    }
}
