package com.scenepilot.orchestrator.error;

/**
 * The asset tree could not be written. Raised by the AssetOrganizer; the
 * executor retries a bounded number of times before failing the task.
 */
public class StorageException extends OrchestrationException {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public String code() { return "StorageError"; }
}
