package com.pandora.orchestrator.api;

import com.pandora.orchestrator.api.dto.SyncAcceptedResponse;
import com.pandora.orchestrator.api.dto.SyncLogResponse;
import com.pandora.orchestrator.api.dto.SyncRequestBody;
import com.pandora.orchestrator.model.SyncType;
import com.pandora.orchestrator.sync.SyncJobCoordinator;
import com.pandora.orchestrator.sync.SyncRequest;
import com.pandora.orchestrator.sync.SyncSubmission;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.UUID;

/**
 * REST API for connector syncs.
 *
 * POST /workspaces/{ws}/connectors/{connector}/sync  queue a sync (202, or 409 if one is active)
 * GET  /workspaces/{ws}/sync/{syncId}                poll a sync
 * GET  /workspaces/{ws}/sync                         the 20 most recent syncs
 */
@RestController
@RequestMapping("/workspaces/{workspaceId}")
public class SyncController {

    private final SyncJobCoordinator coordinator;

    public SyncController(SyncJobCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/workspaces/ws-1/connectors/hubspot/sync \
     *     -H "Content-Type: application/json" -d '{"mode":"FULL"}'
     */
    @PostMapping("/connectors/{connectorType}/sync")
    public ResponseEntity<SyncAcceptedResponse> sync(@PathVariable String workspaceId,
                                                     @PathVariable String connectorType,
                                                     @RequestBody(required = false) SyncRequestBody body) {
        SyncRequest request = new SyncRequest(workspaceId, connectorType, SyncType.MANUAL,
                body == null ? null : body.mode());
        SyncSubmission submission = coordinator.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(SyncAcceptedResponse.from(submission));
    }

    @GetMapping("/sync/{syncId}")
    public SyncLogResponse getSync(@PathVariable String workspaceId, @PathVariable UUID syncId) {
        return coordinator.find(workspaceId, syncId)
                .map(SyncLogResponse::from)
                .orElseThrow(() -> new ResponseStatusException(
                        HttpStatus.NOT_FOUND, "Sync not found: " + syncId));
    }

    @GetMapping("/sync")
    public List<SyncLogResponse> recent(@PathVariable String workspaceId) {
        return coordinator.recent(workspaceId).stream()
                .map(SyncLogResponse::from)
                .toList();
    }
}
