package com.pandora.orchestrator.api.dto;

import com.pandora.orchestrator.sync.SyncSubmission;

import java.util.UUID;

/**
 * Response body for an admitted sync. {@code reapedSyncs} counts stale syncs
 * that were failed to make room for this one.
 */
public record SyncAcceptedResponse(
        UUID   syncId,
        UUID   jobId,
        String mode,
        int    reapedSyncs
) {
    public static SyncAcceptedResponse from(SyncSubmission submission) {
        return new SyncAcceptedResponse(
                submission.syncId(),
                submission.jobId(),
                submission.mode().name().toLowerCase(),
                submission.reaped().size()
        );
    }
}
