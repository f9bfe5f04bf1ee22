package com.pandora.orchestrator.api.dto;

import com.pandora.orchestrator.model.SyncMode;

/**
 * Optional request body for POST /workspaces/{ws}/connectors/{connector}/sync.
 * Without a mode the watermark decides between a full and an incremental pull.
 */
public record SyncRequestBody(SyncMode mode) {}
