package com.scenepilot.orchestrator.api.dto;

import com.scenepilot.orchestrator.model.ProjectStage;
import jakarta.validation.constraints.NotNull;

/** Request body for POST /projects/{id}/reset. */
public record ResetRequest(@NotNull ProjectStage toStage) {}
