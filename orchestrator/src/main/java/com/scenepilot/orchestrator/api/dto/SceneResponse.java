package com.scenepilot.orchestrator.api.dto;

import com.scenepilot.orchestrator.model.Scene;
import com.scenepilot.orchestrator.model.TaskKind;

import java.util.Set;
import java.util.UUID;

public record SceneResponse(
        UUID          id,
        int           position,
        String        sourceText,
        String        folderPath,
        String        imageRef,
        String        audioRef,
        String        videoRef,
        Set<TaskKind> degradedKinds
) {
    public static SceneResponse from(Scene s) {
        return new SceneResponse(
                s.getId(),
                s.getPosition(),
                s.getSourceText(),
                s.getFolderPath(),
                s.assetRef(TaskKind.IMAGE),
                s.assetRef(TaskKind.VOICE),
                s.assetRef(TaskKind.VIDEO),
                s.getDegradedKinds()
        );
    }
}
