package com.scenepilot.orchestrator.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * One video production: a script split into ordered scenes.
 *
 * The stage field is written only by the StageOrchestrator and the cost
 * field only by the CostTracker. Every write goes through the StateStore's
 * optimistic read-modify-write loop, guarded by the version column.
 *
 * DB table: projects  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "projects")
public class Project {

    @Id
    private UUID id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private ProjectStage stage = ProjectStage.DRAFT;

    // Incremented on every advance into a generation stage; tasks carry it
    // so a re-run of a stage never mixes with tasks of an earlier run.
    @Column(name = "stage_run", nullable = false)
    private int stageRun = 0;

    // Advisory running total reported by adapters. Never decreases.
    @Column(name = "cost_credits", nullable = false, precision = 19, scale = 4)
    private BigDecimal costCredits = BigDecimal.ZERO;

    // Aggregated failure summary while a stage is blocked; null otherwise.
    @Column(name = "blocked_summary", columnDefinition = "TEXT")
    private String blockedSummary;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    @Version
    private Long version;

    // Audit records produced by the current mutation, flushed by the StateStore
    // in the same write as the stage change.
    @Transient
    private List<StageTransitionRecord> pendingTransitions = new ArrayList<>();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Project() {}   // required by JPA

    public Project(String name) {
        this.id   = UUID.randomUUID();
        this.name = name;
    }

    // ------------------------------------------------------------------
    // Stage changes
    // ------------------------------------------------------------------

    /**
     * Move to a new stage and queue the matching audit record.
     * Entering a generation stage starts a new stage run and clears any
     * blocked summary left by the previous stage.
     */
    public StageTransitionRecord transitionTo(ProjectStage to, TransitionActor actor, String reason) {
        StageTransitionRecord rec = new StageTransitionRecord(id, stage, to, actor, reason);
        if (to.taskKind().isPresent()) {
            stageRun++;
        }
        this.stage          = to;
        this.blockedSummary = null;
        this.updatedAt      = Instant.now();
        pendingTransitions.add(rec);
        return rec;
    }

    /** Hand the queued audit records to the store and forget them. */
    public List<StageTransitionRecord> drainPendingTransitions() {
        List<StageTransitionRecord> out = List.copyOf(pendingTransitions);
        pendingTransitions.clear();
        return out;
    }

    /** Add adapter-reported credits. The total is monotonically non-decreasing. */
    public void addCost(BigDecimal credits) {
        if (credits == null || credits.signum() < 0) {
            throw new IllegalArgumentException("Cost increment must be >= 0, got " + credits);
        }
        this.costCredits = costCredits.add(credits);
    }

    /** Detached copy used by the in-memory store. Pending transitions are not copied. */
    public Project copy() {
        Project p = new Project();
        p.id             = id;
        p.name           = name;
        p.stage          = stage;
        p.stageRun       = stageRun;
        p.costCredits    = costCredits;
        p.blockedSummary = blockedSummary;
        p.createdAt      = createdAt;
        p.updatedAt      = updatedAt;
        p.version        = version;
        return p;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()             { return id; }
    public String        getName()           { return name; }
    public ProjectStage  getStage()          { return stage; }
    public int           getStageRun()       { return stageRun; }
    public BigDecimal    getCostCredits()    { return costCredits; }
    public String        getBlockedSummary() { return blockedSummary; }
    public Instant       getCreatedAt()      { return createdAt; }
    public Instant       getUpdatedAt()      { return updatedAt; }
    public Long          getVersion()        { return version; }

    public boolean isBlocked()                          { return blockedSummary != null; }
    public void setBlockedSummary(String summary)       { this.blockedSummary = summary; }
    public void setVersion(Long version)                { this.version = version; }
}
