package com.pandora.orchestrator.model;

import com.pandora.orchestrator.runtime.RunStatus;
import jakarta.persistence.*;

import java.time.Instant;

/**
 * Persisted record of one skill run. Written RUNNING when the run starts and
 * overwritten with the final state when it ends.
 *
 * DB table: skill_runs  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "skill_runs")
public class SkillRun {

    // Assigned by the runtime so callers can poll before the run finishes.
    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "skill_id", nullable = false)
    private String skillId;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    @Column(name = "trigger_type", nullable = false)
    private String trigger;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private RunStatus status = RunStatus.RUNNING;

    @Column(name = "started_at", nullable = false)
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "token_usage", nullable = false)
    private long tokenUsage = 0;

    // Per-step outcomes, JSON-encoded.
    @Column(name = "steps_json", columnDefinition = "TEXT")
    private String stepsJson;

    // Output of the last step, JSON-encoded.
    @Column(name = "output_json", columnDefinition = "TEXT")
    private String outputJson;

    @Column(name = "evidence_json", columnDefinition = "TEXT")
    private String evidenceJson;

    @Column(name = "errors_json", columnDefinition = "TEXT")
    private String errorsJson;

    protected SkillRun() {}   // required by JPA

    public SkillRun(String id, String skillId, String workspaceId, String trigger, Instant startedAt) {
        this.id          = id;
        this.skillId     = skillId;
        this.workspaceId = workspaceId;
        this.trigger     = trigger;
        this.startedAt   = startedAt;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String    getId()           { return id; }
    public String    getSkillId()      { return skillId; }
    public String    getWorkspaceId()  { return workspaceId; }
    public String    getTrigger()      { return trigger; }
    public RunStatus getStatus()       { return status; }
    public Instant   getStartedAt()    { return startedAt; }
    public Instant   getCompletedAt()  { return completedAt; }
    public Long      getDurationMs()   { return durationMs; }
    public long      getTokenUsage()   { return tokenUsage; }
    public String    getStepsJson()    { return stepsJson; }
    public String    getOutputJson()   { return outputJson; }
    public String    getEvidenceJson() { return evidenceJson; }
    public String    getErrorsJson()   { return errorsJson; }

    public void setStatus(RunStatus status)     { this.status = status; }
    public void setCompletedAt(Instant t)       { this.completedAt = t; }
    public void setDurationMs(Long ms)          { this.durationMs = ms; }
    public void setTokenUsage(long tokens)      { this.tokenUsage = tokens; }
    public void setStepsJson(String json)       { this.stepsJson = json; }
    public void setOutputJson(String json)      { this.outputJson = json; }
    public void setEvidenceJson(String json)    { this.evidenceJson = json; }
    public void setErrorsJson(String json)      { this.errorsJson = json; }
}
