package com.pandora.orchestrator.sync;

import com.pandora.orchestrator.model.SyncMode;
import com.pandora.orchestrator.model.SyncType;

/**
 * @param modeOverride explicit mode, or null to pick one from the watermark
 */
public record SyncRequest(String workspaceId, String connectorType, SyncType syncType, SyncMode modeOverride) {

    public SyncRequest {
        if (workspaceId == null || workspaceId.isBlank()) {
            throw new IllegalArgumentException("workspaceId is required");
        }
        if (connectorType == null || connectorType.isBlank()) {
            throw new IllegalArgumentException("connectorType is required");
        }
        if (syncType == null) syncType = SyncType.MANUAL;
    }

    public static SyncRequest manual(String workspaceId, String connectorType) {
        return new SyncRequest(workspaceId, connectorType, SyncType.MANUAL, null);
    }

    public static SyncRequest scheduled(String workspaceId, String connectorType) {
        return new SyncRequest(workspaceId, connectorType, SyncType.SCHEDULED, null);
    }
}
