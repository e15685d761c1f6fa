package com.scenepilot.orchestrator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Execution state of a single generation Task.
 *
 * Transitions:
 *   QUEUED    → SUBMITTED (adapter accepted the job)
 *   SUBMITTED → RUNNING   (first progress report)
 *   RUNNING   → RUNNING   (progress update)
 *   SUBMITTED / RUNNING → SUCCEEDED | FAILED
 *   SUBMITTED / RUNNING → QUEUED    (retry, attempt count incremented)
 *   QUEUED    → QUEUED    (submit rejected transiently, retry later)
 *   QUEUED    → FAILED    (submit rejected permanently, missing prerequisite)
 *   any non-terminal → CANCELLED
 *
 * SUCCEEDED, FAILED and CANCELLED are terminal: nothing leaves them.
 */
public enum TaskStatus {
    QUEUED,
    SUBMITTED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    public static final Set<TaskStatus> ACTIVE = EnumSet.of(SUBMITTED, RUNNING);

    public boolean isTerminal() {
        return this == SUCCEEDED || this == FAILED || this == CANCELLED;
    }

    public boolean canTransitionTo(TaskStatus next) {
        if (isTerminal()) return false;
        if (next == CANCELLED) return true;
        return switch (this) {
            case QUEUED    -> next == QUEUED || next == SUBMITTED || next == FAILED;
            case SUBMITTED -> next == RUNNING || next == QUEUED
                              || next == SUCCEEDED || next == FAILED;
            case RUNNING   -> next == RUNNING || next == QUEUED
                              || next == SUCCEEDED || next == FAILED;
            default        -> false;
        };
    }
}
