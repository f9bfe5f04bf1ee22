package com.pandora.orchestrator.model;

import jakarta.persistence.*;

import java.time.Instant;
import java.util.UUID;

/**
 * One unit of queued background work. The database is the queue: workers
 * claim the highest-priority, oldest PENDING row under a row lock.
 *
 * DB table: jobs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "jobs")
public class BackgroundJob {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    // Selects the JobHandler, e.g. "connector_sync".
    @Column(name = "job_type", nullable = false)
    private String jobType;

    // JSON object handed to the handler.
    @Column(columnDefinition = "TEXT")
    private String payload;

    @Column(nullable = false)
    private int priority = 0;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private JobStatus status = JobStatus.PENDING;

    @Column(nullable = false)
    private int attempts = 0;

    @Column(name = "max_attempts", nullable = false)
    private int maxAttempts = 3;

    @Column(name = "worker_id")
    private String workerId;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "heartbeat_at")
    private Instant heartbeatAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected BackgroundJob() {}   // required by JPA

    public BackgroundJob(String workspaceId, String jobType, String payload,
                         int priority, int maxAttempts, Instant createdAt) {
        this.workspaceId = workspaceId;
        this.jobType     = jobType;
        this.payload     = payload;
        this.priority    = priority;
        this.maxAttempts = maxAttempts;
        this.createdAt   = createdAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID      getId()          { return id; }
    public String    getWorkspaceId() { return workspaceId; }
    public String    getJobType()     { return jobType; }
    public String    getPayload()     { return payload; }
    public int       getPriority()    { return priority; }
    public JobStatus getStatus()      { return status; }
    public int       getAttempts()    { return attempts; }
    public int       getMaxAttempts() { return maxAttempts; }
    public String    getWorkerId()    { return workerId; }
    public String    getLastError()   { return lastError; }
    public Instant   getCreatedAt()   { return createdAt; }
    public Instant   getStartedAt()   { return startedAt; }
    public Instant   getHeartbeatAt() { return heartbeatAt; }
    public Instant   getCompletedAt() { return completedAt; }

    public void setStatus(JobStatus status)   { this.status = status; }
    public void setWorkerId(String workerId)  { this.workerId = workerId; }
    public void setLastError(String error)    { this.lastError = error; }
    public void setStartedAt(Instant t)       { this.startedAt = t; }
    public void setHeartbeatAt(Instant t)     { this.heartbeatAt = t; }
    public void setCompletedAt(Instant t)     { this.completedAt = t; }
    public void incrementAttempts()           { this.attempts++; }
}
