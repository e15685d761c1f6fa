package com.scenepilot.orchestrator.adapter;

import com.scenepilot.orchestrator.model.TaskKind;

import java.util.UUID;

/**
 * Everything an adapter gets to know about the scene it is generating for.
 *
 * @param prerequisiteRef storage path of the asset named by the adapter's
 *                        prerequisite kind, or null when it declares none
 * @param attempt         1 for the first submit, 2 for the first retry, ...
 */
public record SceneContext(
        UUID     projectId,
        UUID     sceneId,
        UUID     taskId,
        TaskKind kind,
        int      position,
        String   sourceText,
        String   prerequisiteRef,
        int      attempt
) {}
