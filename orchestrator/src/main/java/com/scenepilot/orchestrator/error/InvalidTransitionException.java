package com.scenepilot.orchestrator.error;

/**
 * The requested stage change is not allowed from the project's current stage.
 */
public class InvalidTransitionException extends OrchestrationException {

    public InvalidTransitionException(String message) {
        super(message);
    }

    @Override
    public String code() { return "InvalidTransition"; }
}
