package com.scenepilot.orchestrator.adapter;

/** Answer to a cancellation request. */
public enum CancelResult {
    ACKNOWLEDGED,
    UNSUPPORTED     // provider keeps running; the executor discards its result
}
