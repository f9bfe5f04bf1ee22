package com.pandora.orchestrator.sync;

import java.time.Instant;
import java.util.UUID;

/**
 * A RUNNING sync that outlived the staleness window and was marked failed
 * while a new request was being admitted. Informational: the new request
 * proceeds normally.
 */
public record StaleLockReaped(UUID syncId, String workspaceId, String connectorType,
                              Instant startedAt, Instant reapedAt) {}
