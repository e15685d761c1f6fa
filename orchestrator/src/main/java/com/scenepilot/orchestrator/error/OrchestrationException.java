package com.scenepilot.orchestrator.error;

/**
 * Base of the orchestrator's error taxonomy.
 *
 * Unchecked so callers only catch it when they have a specific recovery
 * strategy. The {@link #code()} is the stable name returned to API clients.
 */
public abstract class OrchestrationException extends RuntimeException {

    protected OrchestrationException(String message) {
        super(message);
    }

    protected OrchestrationException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract String code();
}
