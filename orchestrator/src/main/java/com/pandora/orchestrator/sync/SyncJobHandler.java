package com.pandora.orchestrator.sync;

import com.pandora.orchestrator.model.BackgroundJob;
import com.pandora.orchestrator.model.SyncLog;
import com.pandora.orchestrator.model.SyncMode;
import com.pandora.orchestrator.queue.JobHandler;
import com.pandora.orchestrator.trigger.PostSyncTrigger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Worker side of a connector sync: runs the queued job created by
 * {@link SyncLockManager#acquire}.
 *
 * A connector failure marks the sync failed and completes the job; retrying
 * is the caller's decision, not the queue's. A sync that is no longer pending
 * (for example reaped while queued) is skipped.
 */
@Component
public class SyncJobHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(SyncJobHandler.class);

    private final SyncLockManager              lockManager;
    private final PostSyncTrigger              postSyncTrigger;
    private final Map<String, ConnectorSyncer> syncers = new ConcurrentHashMap<>();
    private final String                       jobType;

    public SyncJobHandler(SyncLockManager lockManager,
                          PostSyncTrigger postSyncTrigger,
                          List<ConnectorSyncer> allSyncers,
                          @Value("${pandora.sync.connector-job-type:connector_sync}") String jobType) {
        this.lockManager     = lockManager;
        this.postSyncTrigger = postSyncTrigger;
        this.jobType         = jobType;
        allSyncers.forEach(s -> syncers.put(s.connectorType(), s));
    }

    @Override
    public String jobType() { return jobType; }

    @Override
    public void handle(BackgroundJob job, Map<String, Object> payload) {
        Object rawId = payload.get("syncId");
        if (rawId == null) {
            throw new IllegalArgumentException("connector sync job " + job.getId() + " has no syncId");
        }
        UUID syncId = UUID.fromString(rawId.toString());

        Optional<SyncLog> running = lockManager.begin(syncId);
        if (running.isEmpty()) {
            log.warn("Skipping job {}: sync {} is not pending any more", job.getId(), syncId);
            return;
        }
        SyncLog syncLog = running.get();
        String ws = syncLog.getWorkspaceId();
        String connector = syncLog.getConnectorType();

        ConnectorSyncer syncer = syncers.get(connector);
        if (syncer == null) {
            lockManager.fail(syncId, "No connector registered for '" + connector + "'");
            return;
        }

        Instant since = syncLog.getMode() == SyncMode.INCREMENTAL
                ? lockManager.watermarkFor(ws, connector).orElse(null)
                : null;
        ConnectorSyncResult result;
        try {
            result = syncer.sync(ws, syncLog.getMode(), since);
        } catch (Exception e) {
            log.warn("{} sync {} for workspace {} threw: {}", connector, syncId, ws, e.getMessage(), e);
            lockManager.fail(syncId, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
            return;
        }

        Optional<SyncLog> finished = lockManager.complete(syncId, result);
        if (finished.isEmpty()) {
            return;
        }
        SyncLog completed = finished.get();
        postSyncTrigger.onSyncCompleted(new SyncCompletedEvent(ws, List.of(
                new SyncCompletedEvent.ConnectorOutcome(connector, syncId, completed.getMode(),
                        result.recordsSynced(), result.summary()))));
    }
}
