package com.pandora.orchestrator.model;

public enum SyncMode {
    FULL,
    INCREMENTAL
}
