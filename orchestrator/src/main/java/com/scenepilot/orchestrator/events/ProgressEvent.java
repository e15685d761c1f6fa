package com.scenepilot.orchestrator.events;

import com.scenepilot.orchestrator.model.ProjectStage;
import com.scenepilot.orchestrator.model.Task;
import com.scenepilot.orchestrator.model.TransitionActor;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * An event emitted while a project is being produced.
 *
 * @param type      what happened
 * @param projectId project the event belongs to
 * @param taskId    task the event relates to (null for stage-level events)
 * @param payload   event-specific fields
 * @param timestamp when the event was emitted, read from the engine clock
 */
public record ProgressEvent(
        EventType           type,
        UUID                projectId,
        UUID                taskId,
        Map<String, Object> payload,
        Instant             timestamp
) {

    public static ProgressEvent taskProgress(Task task, Instant at) {
        return forTask(EventType.TASK_PROGRESS, task, Map.of(
                "status",  task.getStatus().name(),
                "percent", task.getProgressPercent()), at);
    }

    public static ProgressEvent taskRetryScheduled(Task task, Duration delay, Instant at) {
        return forTask(EventType.TASK_RETRY_SCHEDULED, task, Map.of(
                "attempt",      task.getAttemptCount(),
                "delayMillis",  delay.toMillis(),
                "errorClass",   String.valueOf(task.getLastErrorClass())), at);
    }

    public static ProgressEvent taskTerminal(Task task, Instant at) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", task.getStatus().name());
        payload.put("attempts", task.getAttemptCount());
        if (task.getLastErrorClass() != null) payload.put("errorClass", task.getLastErrorClass().name());
        if (task.getLastError() != null)      payload.put("error", task.getLastError());
        return forTask(EventType.TASK_TERMINAL, task, payload, at);
    }

    public static ProgressEvent stageTransition(UUID projectId, ProjectStage from, ProjectStage to,
                                                TransitionActor actor, Instant at) {
        return new ProgressEvent(EventType.STAGE_TRANSITION, projectId, null, Map.of(
                "from",  from.name(),
                "to",    to.name(),
                "actor", actor.name()), at);
    }

    public static ProgressEvent stageBlocked(UUID projectId, ProjectStage stage, String summary, Instant at) {
        return new ProgressEvent(EventType.STAGE_BLOCKED, projectId, null, Map.of(
                "stage",   stage.name(),
                "summary", summary), at);
    }

    private static ProgressEvent forTask(EventType type, Task task, Map<String, Object> extra, Instant at) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("kind",    task.getKind().name());
        payload.put("sceneId", task.getSceneId().toString());
        payload.putAll(extra);
        return new ProgressEvent(type, task.getProjectId(), task.getId(), Collections.unmodifiableMap(payload), at);
    }
}
