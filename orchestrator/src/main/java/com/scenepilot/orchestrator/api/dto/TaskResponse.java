package com.scenepilot.orchestrator.api.dto;

import com.scenepilot.orchestrator.model.ErrorClass;
import com.scenepilot.orchestrator.model.Task;
import com.scenepilot.orchestrator.model.TaskKind;
import com.scenepilot.orchestrator.model.TaskStatus;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Read-only view of a task returned by GET /projects/{id}/tasks.
 */
public record TaskResponse(
        UUID       id,
        UUID       sceneId,
        TaskKind   kind,
        int        stageRun,
        TaskStatus status,
        int        attemptCount,
        String     externalRef,
        ErrorClass lastErrorClass,
        String     lastError,
        int        progressPercent,
        BigDecimal costCredits,
        Instant    queuedAt,
        Instant    submittedAt,
        Instant    completedAt
) {
    public static TaskResponse from(Task t) {
        return new TaskResponse(
                t.getId(),
                t.getSceneId(),
                t.getKind(),
                t.getStageRun(),
                t.getStatus(),
                t.getAttemptCount(),
                t.getExternalRef(),
                t.getLastErrorClass(),
                t.getLastError(),
                t.getProgressPercent(),
                t.getCostCredits(),
                t.getQueuedAt(),
                t.getSubmittedAt(),
                t.getCompletedAt()
        );
    }
}
