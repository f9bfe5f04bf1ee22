package com.pandora.orchestrator.sync;

import com.pandora.orchestrator.model.SyncMode;

import java.util.List;
import java.util.UUID;

/**
 * Acknowledgement of an admitted sync request. The sync itself runs later on the job queue.
 */
public record SyncSubmission(UUID syncId, UUID jobId, SyncMode mode, List<StaleLockReaped> reaped) {

    public SyncSubmission {
        reaped = reaped == null ? List.of() : List.copyOf(reaped);
    }
}
