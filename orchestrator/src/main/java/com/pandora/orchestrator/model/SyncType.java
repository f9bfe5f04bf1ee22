package com.pandora.orchestrator.model;

/** Who asked for the sync. Manual syncs are queued ahead of scheduled ones. */
public enum SyncType {
    MANUAL,
    SCHEDULED
}
