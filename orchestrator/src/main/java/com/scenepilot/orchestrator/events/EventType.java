package com.scenepilot.orchestrator.events;

/** Kinds of progress events. The wire name is used as the SSE event name. */
public enum EventType {
    TASK_PROGRESS("task.progress"),
    TASK_RETRY_SCHEDULED("task.retry_scheduled"),
    TASK_TERMINAL("task.terminal"),
    STAGE_TRANSITION("stage.transition"),
    STAGE_BLOCKED("stage.blocked");

    private final String wireName;

    EventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() { return wireName; }
}
