package com.pandora.orchestrator.sync;

import com.pandora.orchestrator.model.SyncLog;
import com.pandora.orchestrator.repository.SyncLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Admits connector sync requests: at most one active sync per workspace and
 * connector, with stale locks reaped and the mode picked from the watermark.
 *
 * Returns as soon as the sync is queued; the job queue runs it.
 */
@Service
public class SyncJobCoordinator {

    private static final Logger log = LoggerFactory.getLogger(SyncJobCoordinator.class);

    private final SyncLockManager   lockManager;
    private final SyncLogRepository syncLogs;

    public SyncJobCoordinator(SyncLockManager lockManager, SyncLogRepository syncLogs) {
        this.lockManager = lockManager;
        this.syncLogs    = syncLogs;
    }

    /**
     * @throws SyncConflictException if a sync for the pair is already pending or
     *                               running, including one that won a race with this call
     */
    public SyncSubmission submit(SyncRequest request) {
        try {
            return lockManager.acquire(request);
        } catch (DataIntegrityViolationException e) {
            String key = SyncLog.lockKey(request.workspaceId(), request.connectorType());
            Optional<SyncLog> winner = syncLogs.findByActiveLockKey(key);
            if (winner.isEmpty()) {
                // the constraint that fired was not the lock key
                throw e;
            }
            log.info("Concurrent {} sync submission for workspace {} lost to sync {}",
                    request.connectorType(), request.workspaceId(), winner.get().getId());
            throw new SyncConflictException(request.workspaceId(), request.connectorType(), winner.get().getId());
        }
    }

    @Transactional(readOnly = true)
    public Optional<SyncLog> find(String workspaceId, UUID syncId) {
        return syncLogs.findByIdAndWorkspaceId(syncId, workspaceId);
    }

    @Transactional(readOnly = true)
    public List<SyncLog> recent(String workspaceId) {
        return syncLogs.findTop20ByWorkspaceIdOrderByCreatedAtDesc(workspaceId);
    }
}
