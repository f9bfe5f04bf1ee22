package com.pandora.orchestrator.model;

import jakarta.persistence.*;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * A CRM opportunity as normalised by the connector sync. The pipeline
 * skills read this table; only connectors write it.
 *
 * DB table: deals  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "deals")
public class Deal {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "workspace_id", nullable = false)
    private String workspaceId;

    // Connector that owns the row, e.g. "hubspot".
    @Column(nullable = false)
    private String source;

    @Column(name = "source_id", nullable = false)
    private String sourceId;

    @Column(nullable = false)
    private String name;

    @Column(precision = 18, scale = 2)
    private BigDecimal amount = BigDecimal.ZERO;

    private String stage;

    @Column(name = "owner_email")
    private String ownerEmail;

    @Column(name = "owner_name")
    private String ownerName;

    @Column(name = "close_date")
    private LocalDate closeDate;

    @Column(name = "last_activity_at")
    private Instant lastActivityAt;

    @Column(name = "days_in_stage", nullable = false)
    private int daysInStage = 0;

    @Column(nullable = false)
    private boolean closed = false;

    protected Deal() {}   // required by JPA

    public Deal(String id, String workspaceId, String source, String sourceId, String name) {
        this.id          = id;
        this.workspaceId = workspaceId;
        this.source      = source;
        this.sourceId    = sourceId;
        this.name        = name;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public String     getId()             { return id; }
    public String     getWorkspaceId()    { return workspaceId; }
    public String     getSource()         { return source; }
    public String     getSourceId()       { return sourceId; }
    public String     getName()           { return name; }
    public BigDecimal getAmount()         { return amount; }
    public String     getStage()          { return stage; }
    public String     getOwnerEmail()     { return ownerEmail; }
    public String     getOwnerName()      { return ownerName; }
    public LocalDate  getCloseDate()      { return closeDate; }
    public Instant    getLastActivityAt() { return lastActivityAt; }
    public int        getDaysInStage()    { return daysInStage; }
    public boolean    isClosed()          { return closed; }

    public void setAmount(BigDecimal amount)     { this.amount = amount; }
    public void setStage(String stage)           { this.stage = stage; }
    public void setOwnerEmail(String email)      { this.ownerEmail = email; }
    public void setOwnerName(String name)        { this.ownerName = name; }
    public void setCloseDate(LocalDate d)        { this.closeDate = d; }
    public void setLastActivityAt(Instant t)     { this.lastActivityAt = t; }
    public void setDaysInStage(int days)         { this.daysInStage = days; }
    public void setClosed(boolean closed)        { this.closed = closed; }
}
