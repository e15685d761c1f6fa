package com.scenepilot.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Append-only audit entry for one project stage change.
 *
 * Created by {@link Project#transitionTo} and persisted together with the
 * stage change itself. Never updated afterwards.
 *
 * DB table: stage_transitions
 */
@Entity
@Table(name = "stage_transitions")
public class StageTransitionRecord {

    @Id
    private UUID id;

    @Column(name = "project_id", nullable = false, updatable = false)
    private UUID projectId;

    @Enumerated(EnumType.STRING)
    @Column(name = "from_stage", nullable = false, updatable = false)
    private ProjectStage fromStage;

    @Enumerated(EnumType.STRING)
    @Column(name = "to_stage", nullable = false, updatable = false)
    private ProjectStage toStage;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false)
    private TransitionActor actor;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String reason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    protected StageTransitionRecord() {}   // required by JPA

    public StageTransitionRecord(UUID projectId, ProjectStage fromStage, ProjectStage toStage,
                                 TransitionActor actor, String reason) {
        this.id        = UUID.randomUUID();
        this.projectId = projectId;
        this.fromStage = fromStage;
        this.toStage   = toStage;
        this.actor     = actor;
        this.reason    = reason;
    }

    public UUID            getId()        { return id; }
    public UUID            getProjectId() { return projectId; }
    public ProjectStage    getFromStage() { return fromStage; }
    public ProjectStage    getToStage()   { return toStage; }
    public TransitionActor getActor()     { return actor; }
    public String          getReason()    { return reason; }
    public Instant         getCreatedAt() { return createdAt; }
}
