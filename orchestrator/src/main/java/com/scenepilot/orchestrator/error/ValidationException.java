package com.scenepilot.orchestrator.error;

/**
 * Malformed request, rejected before anything is enqueued.
 */
public class ValidationException extends OrchestrationException {

    public ValidationException(String message) {
        super(message);
    }

    @Override
    public String code() { return "ValidationError"; }
}
