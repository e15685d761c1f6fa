package com.scenepilot.orchestrator.model;

import java.util.UUID;

/**
 * Thrown when a Task is asked to make a status change its state machine forbids,
 * most commonly leaving a terminal state.
 */
public class IllegalTaskTransitionException extends RuntimeException {

    private final UUID       taskId;
    private final TaskStatus from;
    private final TaskStatus to;

    public IllegalTaskTransitionException(UUID taskId, TaskStatus from, TaskStatus to) {
        super("Task " + taskId + " cannot move from " + from + " to " + to);
        this.taskId = taskId;
        this.from   = from;
        this.to     = to;
    }

    public UUID       getTaskId() { return taskId; }
    public TaskStatus getFrom()   { return from; }
    public TaskStatus getTo()     { return to; }
}
