package com.scenepilot.orchestrator.error;

/**
 * Optimistic-lock collisions kept happening after the store's retry budget.
 * A single collision is always retried with the freshest read and never
 * reaches callers as this exception.
 */
public class StateConflictException extends OrchestrationException {

    public StateConflictException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() { return "StateConflict"; }
}
