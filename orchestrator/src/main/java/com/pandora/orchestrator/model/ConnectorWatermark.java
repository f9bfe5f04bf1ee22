package com.pandora.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Last successful sync per (workspace, connector). Its presence makes an
 * incremental sync legal; a connector without one always gets a full pull.
 *
 * DB table: connector_watermarks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "connector_watermarks",
       uniqueConstraints = @UniqueConstraint(columnNames = {"workspace_id", "connector_type"}))
public class ConnectorWatermark {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(name = "connector_type", nullable = false)
    private String connectorType;

    @Column(name = "last_sync_at")
    private Instant lastSyncAt;

    // Records the connector reported on its last sync.
    @Column(name = "record_count", nullable = false)
    private long recordCount = 0;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected ConnectorWatermark() {}   // required by JPA

    public ConnectorWatermark(String workspaceId, String connectorType) {
        this.workspaceId   = workspaceId;
        this.connectorType = connectorType;
    }

    /** Move the watermark forward; an older timestamp never rewinds it. */
    public void advance(Instant syncStartedAt, long records, Instant now) {
        if (lastSyncAt == null || syncStartedAt.isAfter(lastSyncAt)) {
            this.lastSyncAt = syncStartedAt;
        }
        this.recordCount = records;
        this.updatedAt   = now;
    }

    public UUID    getId()            { return id; }
    public String  getWorkspaceId()   { return workspaceId; }
    public String  getConnectorType() { return connectorType; }
    public Instant getLastSyncAt()    { return lastSyncAt; }
    public long    getRecordCount()   { return recordCount; }
    public Instant getUpdatedAt()     { return updatedAt; }

    public void setLastSyncAt(Instant t) { this.lastSyncAt = t; }
    public void setUpdatedAt(Instant t)  { this.updatedAt = t; }
}
