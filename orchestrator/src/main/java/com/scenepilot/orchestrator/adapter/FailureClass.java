package com.scenepilot.orchestrator.adapter;

/**
 * How an adapter classifies a provider error. The executor's retry logic
 * relies only on this value, never on provider-specific details.
 */
public enum FailureClass {
    TRANSIENT,      // worth retrying with backoff; consumes an attempt
    PERMANENT,      // retrying cannot help; the task fails immediately
    RATE_LIMITED    // provider is throttling; retry later without consuming an attempt
}
