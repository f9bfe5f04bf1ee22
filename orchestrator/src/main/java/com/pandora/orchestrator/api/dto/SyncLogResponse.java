package com.pandora.orchestrator.api.dto;

import com.pandora.orchestrator.model.SyncLog;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/** Response body for GET /workspaces/{ws}/sync/{syncId}. */
public record SyncLogResponse(
        UUID         id,
        String       connectorType,
        String       syncType,
        String       status,
        String       mode,
        long         recordsSynced,
        List<String> errors,
        Instant      createdAt,
        Instant      startedAt,
        Instant      completedAt
) {
    public static SyncLogResponse from(SyncLog log) {
        return new SyncLogResponse(
                log.getId(),
                log.getConnectorType(),
                log.getSyncType().name(),
                log.getStatus().name(),
                log.getMode().name(),
                log.getRecordsSynced(),
                List.copyOf(log.getErrors()),
                log.getCreatedAt(),
                log.getStartedAt(),
                log.getCompletedAt()
        );
    }
}
