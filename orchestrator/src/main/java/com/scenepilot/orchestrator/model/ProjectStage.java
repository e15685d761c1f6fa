package com.scenepilot.orchestrator.model;

import java.util.Optional;

/**
 * Project-level production stages.
 *
 * Transitions (happy path):
 *   DRAFT → SCRIPT_ANALYZED → STORYBOARD_IN_PROGRESS → STORYBOARD_READY
 *         → VOICE_IN_PROGRESS → VOICE_READY → VIDEO_IN_PROGRESS → VIDEO_READY
 *         → ASSEMBLING → EXPORTED
 *
 * FAILED is reachable from any in-progress stage on an unrecoverable error
 * and only left through an administrative reset.
 */
public enum ProjectStage {
    DRAFT,
    SCRIPT_ANALYZED,
    STORYBOARD_IN_PROGRESS(TaskKind.IMAGE),
    STORYBOARD_READY,
    VOICE_IN_PROGRESS(TaskKind.VOICE),
    VOICE_READY,
    VIDEO_IN_PROGRESS(TaskKind.VIDEO),
    VIDEO_READY,
    ASSEMBLING,
    EXPORTED,
    FAILED;

    private final TaskKind taskKind;

    ProjectStage() {
        this(null);
    }

    ProjectStage(TaskKind taskKind) {
        this.taskKind = taskKind;
    }

    /** The kind of task this stage runs, if it is a generation stage. */
    public Optional<TaskKind> taskKind() {
        return Optional.ofNullable(taskKind);
    }

    public boolean isInProgress() {
        return taskKind != null || this == ASSEMBLING;
    }

    /** Stable stages are valid rollback targets and starting points for advance(). */
    public boolean isStable() {
        return !isInProgress() && this != FAILED;
    }

    /** Stage entered by a regular advance() from this stage, if any. */
    public Optional<ProjectStage> advanceTarget() {
        return Optional.ofNullable(switch (this) {
            case DRAFT            -> SCRIPT_ANALYZED;
            case SCRIPT_ANALYZED  -> STORYBOARD_IN_PROGRESS;
            case STORYBOARD_READY -> VOICE_IN_PROGRESS;
            case VOICE_READY      -> VIDEO_IN_PROGRESS;
            case VIDEO_READY      -> ASSEMBLING;
            default               -> null;
        });
    }

    /** Stage reached when this in-progress stage completes. */
    public ProjectStage completedStage() {
        return switch (this) {
            case STORYBOARD_IN_PROGRESS -> STORYBOARD_READY;
            case VOICE_IN_PROGRESS      -> VOICE_READY;
            case VIDEO_IN_PROGRESS      -> VIDEO_READY;
            case ASSEMBLING             -> EXPORTED;
            default -> throw new IllegalStateException(this + " is not an in-progress stage");
        };
    }

    /** The in-progress stage that produces assets of the given kind. */
    public static ProjectStage producing(TaskKind kind) {
        return switch (kind) {
            case IMAGE -> STORYBOARD_IN_PROGRESS;
            case VOICE -> VOICE_IN_PROGRESS;
            case VIDEO -> VIDEO_IN_PROGRESS;
        };
    }
}
