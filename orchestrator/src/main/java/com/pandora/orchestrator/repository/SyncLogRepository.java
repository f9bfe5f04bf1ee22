package com.pandora.orchestrator.repository;

import com.pandora.orchestrator.model.SyncLog;
import com.pandora.orchestrator.model.SyncStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Queries behind the sync lock protocol.
 */
public interface SyncLogRepository extends JpaRepository<SyncLog, UUID> {

    /** RUNNING rows for the pair whose worker started before {@code cutoff}. */
    List<SyncLog> findByWorkspaceIdAndConnectorTypeAndStatusAndStartedAtBefore(
            String workspaceId, String connectorType, SyncStatus status, Instant cutoff);

    /** The active (PENDING or RUNNING) sync for the pair, oldest first. */
    Optional<SyncLog> findFirstByWorkspaceIdAndConnectorTypeAndStatusInOrderByCreatedAtAsc(
            String workspaceId, String connectorType, Collection<SyncStatus> statuses);

    Optional<SyncLog> findByActiveLockKey(String activeLockKey);

    Optional<SyncLog> findByIdAndWorkspaceId(UUID id, String workspaceId);

    List<SyncLog> findTop20ByWorkspaceIdOrderByCreatedAtDesc(String workspaceId);
}
