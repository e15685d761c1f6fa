package com.scenepilot.orchestrator.adapter;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Per-kind circuit breaker settings.
 *
 * <pre>
 * scenepilot:
 *   executor:
 *     breaker:
 *       failure-threshold: 5
 *       recovery-timeout: 60s
 *       half-open-max-calls: 1
 * </pre>
 *
 * A threshold of 0 turns the breaker off.
 */
@ConfigurationProperties(prefix = "scenepilot.executor.breaker")
public record BreakerProperties(
        @DefaultValue("5")   int      failureThreshold,
        @DefaultValue("60s") Duration recoveryTimeout,
        @DefaultValue("1")   int      halfOpenMaxCalls
) {

    public BreakerProperties {
        if (failureThreshold < 0) {
            throw new IllegalArgumentException("scenepilot.executor.breaker.failure-threshold must be >= 0");
        }
        if (recoveryTimeout == null || recoveryTimeout.isNegative()) {
            throw new IllegalArgumentException("scenepilot.executor.breaker.recovery-timeout must not be negative");
        }
        halfOpenMaxCalls = Math.max(1, halfOpenMaxCalls);
    }

    public static BreakerProperties defaults() {
        return new BreakerProperties(5, Duration.ofSeconds(60), 1);
    }

    public static BreakerProperties disabled() {
        return new BreakerProperties(0, Duration.ofSeconds(60), 1);
    }

    public boolean enabled() {
        return failureThreshold > 0;
    }
}
