package com.pandora.orchestrator.sync;

import com.pandora.orchestrator.model.SyncMode;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Raised when connector syncs for a workspace have finished.
 */
public record SyncCompletedEvent(String workspaceId, List<ConnectorOutcome> results) {

    public record ConnectorOutcome(String connectorType, UUID syncId, SyncMode mode,
                                   long recordsSynced, Map<String, Object> summary) {}

    public SyncCompletedEvent {
        results = results == null ? List.of() : List.copyOf(results);
    }

    /** JSON-shaped form handed to triggered skills as their trigger payload. */
    public Map<String, Object> toPayload() {
        List<Map<String, Object>> items = new ArrayList<>();
        for (ConnectorOutcome r : results) {
            Map<String, Object> item = new LinkedHashMap<>();
            item.put("connector", r.connectorType());
            item.put("syncId", r.syncId() == null ? null : r.syncId().toString());
            item.put("mode", r.mode() == null ? null : r.mode().name().toLowerCase());
            item.put("recordsSynced", r.recordsSynced());
            item.put("summary", r.summary() == null ? Map.of() : r.summary());
            items.add(item);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("event", "sync_completed");
        payload.put("workspaceId", workspaceId);
        payload.put("syncResults", items);
        return payload;
    }
}
