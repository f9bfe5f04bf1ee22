package com.pandora.orchestrator.sync;

import com.pandora.orchestrator.model.SyncMode;

import java.time.Instant;

/**
 * Pulls data for one connector type. The connector's API client lives behind
 * this interface; implementations are Spring beans.
 */
public interface ConnectorSyncer {

    String connectorType();

    /**
     * @param since watermark for an incremental pull; null for a full pull
     * @throws Exception any failure; the sync is marked failed with its message
     */
    ConnectorSyncResult sync(String workspaceId, SyncMode mode, Instant since) throws Exception;
}
