package com.scenepilot.orchestrator.executor;

import com.scenepilot.orchestrator.model.TaskKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

/**
 * Retry, polling and rate-limit settings of the task executor.
 *
 * <pre>
 * scenepilot:
 *   executor:
 *     max-attempts: 3
 *     base-backoff: 1s
 *     kinds:
 *       video:
 *         concurrency: 2
 *         timeout: 15m
 * </pre>
 *
 * Kinds left out of {@code kinds} get {@link #DEFAULT_LIMITS}.
 */
@ConfigurationProperties(prefix = "scenepilot.executor")
public record ExecutorProperties(
        @DefaultValue("3")    int      maxAttempts,
        @DefaultValue("1s")   Duration baseBackoff,
        @DefaultValue("60s")  Duration maxBackoff,
        @DefaultValue("0.2")  double   jitter,
        @DefaultValue("2s")   Duration pollInterval,
        @DefaultValue("5s")   Duration rateLimitDelay,
        @DefaultValue("3")    int      storageAttempts,
        @DefaultValue("8")    int      workerThreads,
        Map<TaskKind, KindLimits> kinds
) {

    static final Map<TaskKind, KindLimits> DEFAULT_LIMITS = Map.of(
            TaskKind.IMAGE, new KindLimits(4, Duration.ofMinutes(5)),
            TaskKind.VOICE, new KindLimits(4, Duration.ofMinutes(5)),
            TaskKind.VIDEO, new KindLimits(2, Duration.ofMinutes(15)));

    public ExecutorProperties {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("scenepilot.executor.max-attempts must be >= 1");
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("scenepilot.executor.jitter must be within [0, 1]");
        }
        if (baseBackoff.isNegative() || maxBackoff.compareTo(baseBackoff) < 0) {
            throw new IllegalArgumentException("scenepilot.executor backoff must satisfy 0 <= base <= max");
        }
        storageAttempts = Math.max(1, storageAttempts);
        workerThreads   = Math.max(1, workerThreads);

        Map<TaskKind, KindLimits> merged = new EnumMap<>(TaskKind.class);
        for (TaskKind kind : TaskKind.values()) {
            KindLimits fallback   = DEFAULT_LIMITS.get(kind);
            KindLimits configured = kinds == null ? null : kinds.get(kind);
            merged.put(kind, configured == null ? fallback : configured.orElse(fallback));
        }
        kinds = Map.copyOf(merged);
    }

    /** Defaults for every setting; used by tests and local runs. */
    public static ExecutorProperties defaults() {
        return new ExecutorProperties(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.2,
                Duration.ofSeconds(2), Duration.ofSeconds(5), 3, 8, null);
    }

    public KindLimits limits(TaskKind kind) {
        return kinds.get(kind);
    }

    /**
     * @param concurrency maximum tasks of the kind submitted to the provider at once
     * @param timeout     wall-clock budget of one attempt, measured from submit
     */
    public record KindLimits(Integer concurrency, Duration timeout) {

        public KindLimits {
            if (concurrency != null && concurrency < 1) {
                throw new IllegalArgumentException("Kind concurrency must be >= 1, got " + concurrency);
            }
        }

        KindLimits orElse(KindLimits fallback) {
            return new KindLimits(
                    concurrency != null ? concurrency : fallback.concurrency(),
                    timeout != null ? timeout : fallback.timeout());
        }
    }
}
