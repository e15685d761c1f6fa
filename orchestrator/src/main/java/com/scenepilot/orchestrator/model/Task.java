package com.scenepilot.orchestrator.model;

import jakarta.persistence.*;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;
import java.util.function.IntFunction;

/**
 * One unit of generation work: one scene, one kind, one stage run.
 *
 * Status changes are funnelled through {@link #moveTo} so the state machine
 * in {@link TaskStatus} is enforced on every write path. The attempt count
 * only grows. The external reference is persisted in the same write that
 * marks the task SUBMITTED, which is what lets a restarted process resume
 * polling instead of submitting the job a second time.
 *
 * DB table: tasks
 */
@Entity
@Table(name = "tasks")
public class Task {

    @Id
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Column(name = "scene_id", nullable = false, updatable = false)
    private UUID sceneId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TaskKind kind;

    @Column(name = "stage_run", nullable = false, updatable = false)
    private int stageRun;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskStatus status = TaskStatus.QUEUED;

    // Number of failed attempts so far. Never decreases.
    @Column(name = "attempt_count", nullable = false)
    private int attemptCount = 0;

    // Provider job id for the current attempt.
    @Column(name = "external_ref")
    private String externalRef;

    @Enumerated(EnumType.STRING)
    @Column(name = "last_error_class")
    private ErrorClass lastErrorClass;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @Column(name = "progress_percent", nullable = false)
    private int progressPercent = 0;

    // Set on success only.
    @Column(name = "cost_credits", precision = 19, scale = 4)
    private BigDecimal costCredits;

    @Column(name = "queued_at", nullable = false)
    private Instant queuedAt;

    @Column(name = "submitted_at")
    private Instant submittedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    // Earliest time the dispatcher may (re)submit a QUEUED task.
    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Version
    private Long version;

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected Task() {}   // required by JPA

    public Task(UUID projectId, UUID sceneId, TaskKind kind, int stageRun, Instant queuedAt) {
        this.id        = UUID.randomUUID();
        this.projectId = projectId;
        this.sceneId   = sceneId;
        this.kind      = kind;
        this.stageRun  = stageRun;
        this.queuedAt  = queuedAt;
    }

    // ------------------------------------------------------------------
    // State machine
    // ------------------------------------------------------------------

    private void moveTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalTaskTransitionException(id, status, next);
        }
        this.status = next;
    }

    public void markSubmitted(String externalRef, Instant now) {
        if (externalRef == null || externalRef.isBlank()) {
            throw new IllegalArgumentException("Adapter returned a blank external reference for task " + id);
        }
        moveTo(TaskStatus.SUBMITTED);
        this.externalRef     = externalRef;
        this.submittedAt     = now;
        this.nextAttemptAt   = null;
        this.progressPercent = 0;
    }

    public void markRunning(int percent) {
        moveTo(TaskStatus.RUNNING);
        this.progressPercent = Math.max(0, Math.min(100, percent));
    }

    public void markSucceeded(BigDecimal cost, Instant now) {
        moveTo(TaskStatus.SUCCEEDED);
        this.costCredits     = cost;
        this.progressPercent = 100;
        this.completedAt     = now;
    }

    public void markFailed(ErrorClass errorClass, String reason, Instant now) {
        moveTo(TaskStatus.FAILED);
        this.lastErrorClass = errorClass;
        this.lastError      = reason;
        this.completedAt    = now;
    }

    public void markCancelled(Instant now) {
        moveTo(TaskStatus.CANCELLED);
        this.lastErrorClass = ErrorClass.CANCELLED;
        this.completedAt    = now;
    }

    /**
     * Count a retryable failure against the attempt budget.
     *
     * @param retryAt maps the new attempt count to the time of the next submit
     * @return true if the task was re-queued, false if the budget is spent and
     *         the task is now FAILED
     */
    public boolean recordTransientFailure(ErrorClass errorClass, String reason,
                                          int maxAttempts, IntFunction<Instant> retryAt,
                                          Instant now) {
        if (status.isTerminal()) {
            throw new IllegalTaskTransitionException(id, status, TaskStatus.QUEUED);
        }
        attemptCount++;
        this.lastErrorClass = errorClass;
        this.lastError      = reason;
        if (attemptCount >= maxAttempts) {
            moveTo(TaskStatus.FAILED);
            this.completedAt = now;
            return false;
        }
        moveTo(TaskStatus.QUEUED);
        this.externalRef     = null;
        this.submittedAt     = null;
        this.progressPercent = 0;
        this.nextAttemptAt   = retryAt.apply(attemptCount);
        return true;
    }

    /** Provider refused the submit because of its rate limit. No attempt is consumed. */
    public void deferSubmit(Instant retryAt) {
        moveTo(TaskStatus.QUEUED);
        this.nextAttemptAt = retryAt;
    }

    public boolean isDue(Instant now) {
        return status == TaskStatus.QUEUED
                && (nextAttemptAt == null || !now.isBefore(nextAttemptAt));
    }

    /** Detached copy used by the in-memory store. */
    public Task copy() {
        Task t = new Task();
        t.id              = id;
        t.projectId       = projectId;
        t.sceneId         = sceneId;
        t.kind            = kind;
        t.stageRun        = stageRun;
        t.status          = status;
        t.attemptCount    = attemptCount;
        t.externalRef     = externalRef;
        t.lastErrorClass  = lastErrorClass;
        t.lastError       = lastError;
        t.progressPercent = progressPercent;
        t.costCredits     = costCredits;
        t.queuedAt        = queuedAt;
        t.submittedAt     = submittedAt;
        t.completedAt     = completedAt;
        t.nextAttemptAt   = nextAttemptAt;
        t.version         = version;
        return t;
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID       getId()              { return id; }
    public UUID       getProjectId()       { return projectId; }
    public UUID       getSceneId()         { return sceneId; }
    public TaskKind   getKind()            { return kind; }
    public int        getStageRun()        { return stageRun; }
    public TaskStatus getStatus()          { return status; }
    public int        getAttemptCount()    { return attemptCount; }
    public String     getExternalRef()     { return externalRef; }
    public ErrorClass getLastErrorClass()  { return lastErrorClass; }
    public String     getLastError()       { return lastError; }
    public int        getProgressPercent() { return progressPercent; }
    public BigDecimal getCostCredits()     { return costCredits; }
    public Instant    getQueuedAt()        { return queuedAt; }
    public Instant    getSubmittedAt()     { return submittedAt; }
    public Instant    getCompletedAt()     { return completedAt; }
    public Instant    getNextAttemptAt()   { return nextAttemptAt; }
    public Long       getVersion()         { return version; }

    public boolean isTerminal()            { return status.isTerminal(); }
    public void setVersion(Long version)   { this.version = version; }
}
