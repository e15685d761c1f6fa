package com.scenepilot.orchestrator.adapter;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Outcome of one poll of a provider job.
 *
 * A fixed four-way variant: the {@link Outcome} tag says which of the other
 * fields are meaningful. Construct through the static factories only.
 */
public record PollResult(
        Outcome    outcome,
        int        percent,       // STILL_RUNNING
        String     outputRef,     // SUCCEEDED: URI of the produced file
        BigDecimal costCredits,   // SUCCEEDED: advisory cost reported by the provider
        String     reason         // FAILED_*: provider's explanation
) {

    public enum Outcome { STILL_RUNNING, SUCCEEDED, FAILED_TRANSIENT, FAILED_PERMANENT }

    public static PollResult stillRunning(int percent) {
        return new PollResult(Outcome.STILL_RUNNING, Math.max(0, Math.min(100, percent)), null, null, null);
    }

    public static PollResult succeeded(String outputRef, BigDecimal costCredits) {
        Objects.requireNonNull(outputRef, "outputRef");
        BigDecimal cost = costCredits == null ? BigDecimal.ZERO : costCredits;
        if (cost.signum() < 0) {
            throw new IllegalArgumentException("Provider reported a negative cost: " + cost);
        }
        return new PollResult(Outcome.SUCCEEDED, 100, outputRef, cost, null);
    }

    public static PollResult failedTransient(String reason) {
        return new PollResult(Outcome.FAILED_TRANSIENT, 0, null, null, reason);
    }

    public static PollResult failedPermanent(String reason) {
        return new PollResult(Outcome.FAILED_PERMANENT, 0, null, null, reason);
    }
}
