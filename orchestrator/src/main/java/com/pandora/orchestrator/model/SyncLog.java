package com.pandora.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One sync attempt for a (workspace, connector) pair.
 *
 * While the row is PENDING or RUNNING, {@code active_lock_key} holds
 * {@code <workspace>:<connector>}; the column is UNIQUE, so the database
 * refuses a second active row for the same pair. Terminal rows clear it.
 *
 * DB table: sync_log  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "sync_log")
public class SyncLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(name = "connector_type", nullable = false)
    private String connectorType;

    @Enumerated(EnumType.STRING)
    @Column(name = "sync_type", nullable = false)
    private SyncType syncType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SyncStatus status = SyncStatus.PENDING;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private SyncMode mode;

    @Column(name = "active_lock_key", unique = true)
    private String activeLockKey;

    // Background job that carries out the sync.
    @Column(name = "job_id")
    private UUID jobId;

    @Column(name = "records_synced", nullable = false)
    private long recordsSynced = 0;

    @Convert(converter = StringListConverter.class)
    @Column(columnDefinition = "TEXT")
    private List<String> errors = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected SyncLog() {}   // required by JPA

    public SyncLog(String workspaceId, String connectorType, SyncType syncType, SyncMode mode, Instant createdAt) {
        this.workspaceId   = workspaceId;
        this.connectorType = connectorType;
        this.syncType      = syncType;
        this.mode          = mode;
        this.createdAt     = createdAt;
        this.activeLockKey = lockKey(workspaceId, connectorType);
    }

    public static String lockKey(String workspaceId, String connectorType) {
        return workspaceId + ":" + connectorType;
    }

    // ------------------------------------------------------------------
    // Transitions
    // ------------------------------------------------------------------

    public void markRunning(Instant now) {
        this.status    = SyncStatus.RUNNING;
        this.startedAt = now;
    }

    public void markCompleted(Instant now, long recordsSynced) {
        this.status        = SyncStatus.COMPLETED;
        this.completedAt   = now;
        this.recordsSynced = recordsSynced;
        this.activeLockKey = null;
    }

    public void markFailed(Instant now, String error) {
        this.status        = SyncStatus.FAILED;
        this.completedAt   = now;
        this.activeLockKey = null;
        if (error != null) this.errors.add(error);
    }

    public boolean isActive() { return status.isActive(); }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID         getId()            { return id; }
    public String       getWorkspaceId()   { return workspaceId; }
    public String       getConnectorType() { return connectorType; }
    public SyncType     getSyncType()      { return syncType; }
    public SyncStatus   getStatus()        { return status; }
    public SyncMode     getMode()          { return mode; }
    public String       getActiveLockKey() { return activeLockKey; }
    public UUID         getJobId()         { return jobId; }
    public long         getRecordsSynced() { return recordsSynced; }
    public List<String> getErrors()        { return errors; }
    public Instant      getCreatedAt()     { return createdAt; }
    public Instant      getStartedAt()     { return startedAt; }
    public Instant      getCompletedAt()   { return completedAt; }

    public void setJobId(UUID jobId)           { this.jobId = jobId; }
    public void setStartedAt(Instant t)        { this.startedAt = t; }
    public void addError(String error)         { this.errors.add(error); }
}
