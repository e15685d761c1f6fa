package com.scenepilot.orchestrator.error;

/**
 * A project, scene or task id does not exist.
 */
public class NotFoundException extends OrchestrationException {

    public NotFoundException(String message) {
        super(message);
    }

    @Override
    public String code() { return "NotFound"; }
}
