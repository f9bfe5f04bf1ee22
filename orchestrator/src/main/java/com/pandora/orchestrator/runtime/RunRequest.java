package com.pandora.orchestrator.runtime;

import com.pandora.orchestrator.skill.AnalysisWindow;

import java.util.Map;
import java.util.UUID;

/**
 * Seed for one skill run.
 *
 * @param runId          pre-assigned id, or null to let the runtime pick one
 * @param trigger        what started the run: {@code on_demand}, {@code post_sync}, {@code cron}, {@code agent}
 * @param payload        trigger payload, e.g. the sync results for a post-sync run
 * @param params         caller parameters merged into every compute step's args
 * @param windowOverride replaces the skill's own analysis window when set
 * @param skillOutputs   outputs of skills that ran earlier in the same agent run
 */
public record RunRequest(
        String              runId,
        String              workspaceId,
        String              trigger,
        Map<String, Object> payload,
        Map<String, Object> params,
        AnalysisWindow      windowOverride,
        Map<String, Object> skillOutputs) {

    public static final String ON_DEMAND = "on_demand";
    public static final String POST_SYNC = "post_sync";
    public static final String CRON      = "cron";
    public static final String AGENT     = "agent";

    public RunRequest {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId is required for a skill run");
        }
        if (runId == null || runId.isBlank()) runId = UUID.randomUUID().toString();
        if (trigger == null || trigger.isBlank()) trigger = ON_DEMAND;
        payload      = payload == null ? Map.of() : payload;
        params       = params == null ? Map.of() : params;
        skillOutputs = skillOutputs == null ? Map.of() : skillOutputs;
    }

    public static RunRequest onDemand(String workspaceId, Map<String, Object> params) {
        return new RunRequest(null, workspaceId, ON_DEMAND, null, params, null, null);
    }

    public static RunRequest postSync(String workspaceId, Map<String, Object> payload) {
        return new RunRequest(null, workspaceId, POST_SYNC, payload, null, null, null);
    }

    public static RunRequest cron(String workspaceId) {
        return new RunRequest(null, workspaceId, CRON, null, null, null, null);
    }

    public RunRequest withRunId(String id) {
        return new RunRequest(id, workspaceId, trigger, payload, params, windowOverride, skillOutputs);
    }
}
