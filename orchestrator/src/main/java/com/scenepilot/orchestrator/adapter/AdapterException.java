package com.scenepilot.orchestrator.adapter;

/**
 * Thrown by a {@link GenerationAdapter} when a call fails. The adapter must
 * classify the failure; the executor never inspects the message.
 */
public class AdapterException extends RuntimeException {

    private final FailureClass failureClass;

    public AdapterException(FailureClass failureClass, String message) {
        super(message);
        this.failureClass = failureClass;
    }

    public AdapterException(FailureClass failureClass, String message, Throwable cause) {
        super(message, cause);
        this.failureClass = failureClass;
    }

    public FailureClass getFailureClass() { return failureClass; }

    public static AdapterException transientFailure(String message, Throwable cause) {
        return new AdapterException(FailureClass.TRANSIENT, message, cause);
    }

    public static AdapterException permanentFailure(String message) {
        return new AdapterException(FailureClass.PERMANENT, message);
    }
}
