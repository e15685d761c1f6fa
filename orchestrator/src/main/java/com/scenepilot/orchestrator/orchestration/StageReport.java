package com.scenepilot.orchestrator.orchestration;

import com.scenepilot.orchestrator.model.ProjectStage;
import com.scenepilot.orchestrator.model.TaskStatus;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Snapshot of the project's current stage run.
 *
 * @param taskCounts number of tasks per status, every status present
 * @param failures   one line per scene whose task failed or was cancelled
 */
public record StageReport(
        UUID                     projectId,
        ProjectStage             stage,
        int                      stageRun,
        Map<TaskStatus, Integer> taskCounts,
        boolean                  blocked,
        List<String>             failures,
        BigDecimal               costCredits
) {}
