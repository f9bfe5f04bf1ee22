package com.pandora.orchestrator.sync;

import com.pandora.orchestrator.model.ConnectorWatermark;
import com.pandora.orchestrator.model.SyncLog;
import com.pandora.orchestrator.model.SyncMode;
import com.pandora.orchestrator.model.SyncStatus;
import com.pandora.orchestrator.model.SyncType;
import com.pandora.orchestrator.queue.JobQueue;
import com.pandora.orchestrator.queue.JobRequest;
import com.pandora.orchestrator.repository.ConnectorWatermarkRepository;
import com.pandora.orchestrator.repository.SyncLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persisted per-(workspace, connector) sync lock.
 *
 * <p>{@link #acquire} runs reap, duplicate check, mode resolution, insert and
 * enqueue in one transaction. The UNIQUE {@code active_lock_key} column is
 * what actually serialises two racing submissions: the loser's insert fails
 * with a constraint violation and its whole transaction rolls back.
 *
 * <p>The other methods move a sync through its lifecycle on behalf of the worker.
 */
@Service
public class SyncLockManager {

    private static final Logger log = LoggerFactory.getLogger(SyncLockManager.class);

    static final int MANUAL_PRIORITY    = 1;
    static final int SCHEDULED_PRIORITY = 0;

    private final SyncLogRepository            syncLogs;
    private final ConnectorWatermarkRepository watermarks;
    private final JobQueue                     jobQueue;
    private final Clock                        clock;
    private final Duration                     staleLockTimeout;
    private final String                       connectorJobType;

    public SyncLockManager(SyncLogRepository syncLogs,
                           ConnectorWatermarkRepository watermarks,
                           JobQueue jobQueue,
                           Clock clock,
                           @Value("${pandora.sync.stale-lock-timeout:PT1H}") Duration staleLockTimeout,
                           @Value("${pandora.sync.connector-job-type:connector_sync}") String connectorJobType) {
        this.syncLogs         = syncLogs;
        this.watermarks       = watermarks;
        this.jobQueue         = jobQueue;
        this.clock            = clock;
        this.staleLockTimeout = staleLockTimeout;
        this.connectorJobType = connectorJobType;
    }

    // ------------------------------------------------------------------
    // Admission
    // ------------------------------------------------------------------

    /**
     * @throws SyncConflictException if a sync for the pair is still pending or running
     * @throws org.springframework.dao.DataIntegrityViolationException if a concurrent
     *         submission inserted its lock first
     */
    @Transactional
    public SyncSubmission acquire(SyncRequest request) {
        String ws = request.workspaceId();
        String connector = request.connectorType();
        Instant now = clock.instant();

        // 1. reap
        List<StaleLockReaped> reaped = reapStale(ws, connector, now);

        // 2. duplicate check
        Optional<SyncLog> active = syncLogs.findFirstByWorkspaceIdAndConnectorTypeAndStatusInOrderByCreatedAtAsc(
                ws, connector, EnumSet.of(SyncStatus.PENDING, SyncStatus.RUNNING));
        if (active.isPresent()) {
            log.info("Rejecting {} sync for workspace {}: sync {} is {}",
                    connector, ws, active.get().getId(), active.get().getStatus());
            throw new SyncConflictException(ws, connector, active.get().getId());
        }

        // 3. mode
        SyncMode mode = resolveMode(request);

        // 4. lock row, then the job that will carry the sync out
        SyncLog syncLog = syncLogs.saveAndFlush(new SyncLog(ws, connector, request.syncType(), mode, now));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("syncId", syncLog.getId().toString());
        payload.put("connectorType", connector);
        payload.put("mode", mode.name());
        int priority = request.syncType() == SyncType.MANUAL ? MANUAL_PRIORITY : SCHEDULED_PRIORITY;
        UUID jobId = jobQueue.createJob(new JobRequest(ws, connectorJobType, payload, priority));
        syncLog.setJobId(jobId);
        syncLogs.save(syncLog);

        log.info("Acquired {} sync lock for workspace {} (sync={}, job={}, mode={}, type={})",
                connector, ws, syncLog.getId(), jobId, mode, request.syncType());
        return new SyncSubmission(syncLog.getId(), jobId, mode, reaped);
    }

    List<StaleLockReaped> reapStale(String ws, String connector, Instant now) {
        Instant cutoff = now.minus(staleLockTimeout);
        List<SyncLog> stale = syncLogs.findByWorkspaceIdAndConnectorTypeAndStatusAndStartedAtBefore(
                ws, connector, SyncStatus.RUNNING, cutoff);
        List<StaleLockReaped> reaped = new ArrayList<>(stale.size());
        for (SyncLog s : stale) {
            s.markFailed(now, "Sync timed out (exceeded " + describe(staleLockTimeout) + ")");
            // flush before the new lock row reuses the key
            syncLogs.saveAndFlush(s);
            log.warn("Reaped stale {} sync {} for workspace {} (running since {})",
                    connector, s.getId(), ws, s.getStartedAt());
            reaped.add(new StaleLockReaped(s.getId(), ws, connector, s.getStartedAt(), now));
        }
        return reaped;
    }

    SyncMode resolveMode(SyncRequest request) {
        if (request.modeOverride() != null) {
            return request.modeOverride();
        }
        return watermarks.findByWorkspaceIdAndConnectorType(request.workspaceId(), request.connectorType())
                .map(ConnectorWatermark::getLastSyncAt)
                .map(t -> SyncMode.INCREMENTAL)
                .orElse(SyncMode.FULL);
    }

    /** Watermark an incremental pull should start from, if the pair has one. */
    @Transactional(readOnly = true)
    public Optional<Instant> watermarkFor(String workspaceId, String connectorType) {
        return watermarks.findByWorkspaceIdAndConnectorType(workspaceId, connectorType)
                .map(ConnectorWatermark::getLastSyncAt);
    }

    static String describe(Duration d) {
        if (d.toMinutes() % 60 == 0) {
            long hours = d.toHours();
            return hours + (hours == 1 ? " hour" : " hours");
        }
        long minutes = d.toMinutes();
        return minutes + (minutes == 1 ? " minute" : " minutes");
    }

    // ------------------------------------------------------------------
    // Lifecycle, driven by the sync worker
    // ------------------------------------------------------------------

    /**
     * Move a PENDING sync to RUNNING.
     *
     * @return the running log, or empty if the sync is unknown or no longer pending
     */
    @Transactional
    public Optional<SyncLog> begin(UUID syncId) {
        Optional<SyncLog> found = syncLogs.findById(syncId);
        if (found.isEmpty() || found.get().getStatus() != SyncStatus.PENDING) {
            return Optional.empty();
        }
        SyncLog syncLog = found.get();
        syncLog.markRunning(clock.instant());
        return Optional.of(syncLogs.save(syncLog));
    }

    /**
     * Mark the sync completed, release its lock and advance the watermark to
     * the time the sync started. Empty when the sync already ended, e.g. it
     * was reaped while the connector was still running.
     */
    @Transactional
    public Optional<SyncLog> complete(UUID syncId, ConnectorSyncResult result) {
        SyncLog syncLog = syncLogs.findById(syncId)
                .orElseThrow(() -> new IllegalStateException("Sync " + syncId + " disappeared"));
        if (!syncLog.isActive()) {
            log.warn("{} sync {} finished after it was marked {}; result discarded",
                    syncLog.getConnectorType(), syncId, syncLog.getStatus());
            return Optional.empty();
        }
        Instant now = clock.instant();
        syncLog.markCompleted(now, result.recordsSynced());
        result.warnings().forEach(syncLog::addError);
        syncLogs.save(syncLog);

        ConnectorWatermark wm = watermarks
                .findByWorkspaceIdAndConnectorType(syncLog.getWorkspaceId(), syncLog.getConnectorType())
                .orElseGet(() -> new ConnectorWatermark(syncLog.getWorkspaceId(), syncLog.getConnectorType()));
        Instant startedAt = syncLog.getStartedAt() != null ? syncLog.getStartedAt() : syncLog.getCreatedAt();
        wm.advance(startedAt, result.recordsSynced(), now);
        watermarks.save(wm);

        log.info("{} sync {} completed for workspace {} ({} records, watermark={})",
                syncLog.getConnectorType(), syncId, syncLog.getWorkspaceId(), result.recordsSynced(), wm.getLastSyncAt());
        return Optional.of(syncLog);
    }

    /** Mark the sync failed and release its lock. A sync that already ended is left alone. */
    @Transactional
    public void fail(UUID syncId, String error) {
        syncLogs.findById(syncId).ifPresent(syncLog -> {
            if (!syncLog.isActive()) {
                return;
            }
            syncLog.markFailed(clock.instant(), error);
            syncLogs.save(syncLog);
            log.warn("{} sync {} failed for workspace {}: {}",
                    syncLog.getConnectorType(), syncId, syncLog.getWorkspaceId(), error);
        });
    }
}
