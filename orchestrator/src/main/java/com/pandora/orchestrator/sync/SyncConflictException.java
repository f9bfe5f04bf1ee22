package com.pandora.orchestrator.sync;

import java.util.UUID;

/**
 * A sync for the same workspace and connector is already pending or running.
 * Not retried automatically; the caller gets the id of the active sync.
 */
public class SyncConflictException extends RuntimeException {

    private final String workspaceId;
    private final String connectorType;
    private final UUID existingSyncId;

    public SyncConflictException(String workspaceId, String connectorType, UUID existingSyncId) {
        super("A " + connectorType + " sync is already in progress for workspace " + workspaceId
                + " (sync " + existingSyncId + ")");
        this.workspaceId    = workspaceId;
        this.connectorType  = connectorType;
        this.existingSyncId = existingSyncId;
    }

    public String getWorkspaceId()    { return workspaceId; }
    public String getConnectorType()  { return connectorType; }
    public UUID   getExistingSyncId() { return existingSyncId; }
}
