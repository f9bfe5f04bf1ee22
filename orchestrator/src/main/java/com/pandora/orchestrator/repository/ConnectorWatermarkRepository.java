package com.pandora.orchestrator.repository;

import com.pandora.orchestrator.model.ConnectorWatermark;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface ConnectorWatermarkRepository extends JpaRepository<ConnectorWatermark, UUID> {

    Optional<ConnectorWatermark> findByWorkspaceIdAndConnectorType(String workspaceId, String connectorType);

    List<ConnectorWatermark> findByWorkspaceIdOrderByConnectorTypeAsc(String workspaceId);

    /** Workspaces with at least one synced connector; the cron scheduler runs skills for these. */
    @Query("SELECT DISTINCT w.workspaceId FROM ConnectorWatermark w WHERE w.lastSyncAt IS NOT NULL ORDER BY w.workspaceId")
    List<String> findSyncedWorkspaceIds();
}
