package com.scenepilot.orchestrator.api.dto;

import com.scenepilot.orchestrator.model.ProjectStage;
import com.scenepilot.orchestrator.model.StageTransitionRecord;
import com.scenepilot.orchestrator.model.TransitionActor;

import java.time.Instant;

public record TransitionResponse(
        ProjectStage    from,
        ProjectStage    to,
        TransitionActor actor,
        String          reason,
        Instant         at
) {
    public static TransitionResponse from(StageTransitionRecord r) {
        return new TransitionResponse(r.getFromStage(), r.getToStage(), r.getActor(), r.getReason(), r.getCreatedAt());
    }
}
