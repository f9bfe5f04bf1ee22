package com.pandora.orchestrator.api.dto;

import java.util.Map;

/** Optional body for POST /workspaces/{ws}/skills/{skillId}/runs. */
public record RunSkillRequest(Map<String, Object> params) {

    public RunSkillRequest {
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
