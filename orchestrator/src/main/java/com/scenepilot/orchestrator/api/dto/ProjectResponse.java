package com.scenepilot.orchestrator.api.dto;

import com.scenepilot.orchestrator.model.Project;
import com.scenepilot.orchestrator.model.ProjectStage;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * Response body for project reads and every stage operation.
 */
public record ProjectResponse(
        UUID         id,
        String       name,
        ProjectStage stage,
        int          stageRun,
        BigDecimal   costCredits,
        String       blockedSummary,
        Instant      createdAt,
        Instant      updatedAt
) {
    public static ProjectResponse from(Project p) {
        return new ProjectResponse(
                p.getId(),
                p.getName(),
                p.getStage(),
                p.getStageRun(),
                p.getCostCredits(),
                p.getBlockedSummary(),
                p.getCreatedAt(),
                p.getUpdatedAt()
        );
    }
}
