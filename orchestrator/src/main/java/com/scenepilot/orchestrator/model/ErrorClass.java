package com.scenepilot.orchestrator.model;

/**
 * Classification of the most recent failure recorded on a Task.
 */
public enum ErrorClass {
    TRANSIENT,              // adapter reported a retryable failure
    PERMANENT,              // adapter reported a non-retryable failure
    TIMEOUT,                // wall-clock budget for the kind exceeded
    STORAGE,                // output could not be written to the asset tree
    PREREQUISITE_MISSING,   // scene lacks the asset the adapter depends on
    CANCELLED               // stage cancelled by an operator
}
