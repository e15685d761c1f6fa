package com.scenepilot.orchestrator.error;

/**
 * An operation needs every task of the project to be terminal, and some are not.
 */
public class TasksInFlightException extends OrchestrationException {

    public TasksInFlightException(String message) {
        super(message);
    }

    @Override
    public String code() { return "TasksInFlight"; }
}
