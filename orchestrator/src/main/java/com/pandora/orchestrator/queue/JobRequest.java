package com.pandora.orchestrator.queue;

import java.util.Map;

/**
 * Work to enqueue. Higher priority is claimed first.
 */
public record JobRequest(String workspaceId, String jobType, Map<String, Object> payload, int priority) {

    public JobRequest {
        if (jobType == null || jobType.isBlank()) {
            throw new IllegalArgumentException("jobType is required");
        }
        payload = payload == null ? Map.of() : payload;
    }
}
