package com.scenepilot.orchestrator.executor;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential backoff with jitter.
 *
 * The delay before retry {@code n} (n = failures so far, starting at 1) is
 * {@code base * 2^(n-1)}, plus up to {@code jitter * delay} of random spread,
 * and never more than {@code max}. With a 1 s base and no jitter that is
 * 1 s, 2 s, 4 s, ...
 */
public class RetryPolicy {

    private final Duration       base;
    private final Duration       max;
    private final double         jitter;
    private final DoubleSupplier random;

    public RetryPolicy(Duration base, Duration max, double jitter) {
        this(base, max, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    RetryPolicy(Duration base, Duration max, double jitter, DoubleSupplier random) {
        this.base   = base;
        this.max    = max;
        this.jitter = jitter;
        this.random = random;
    }

    public static RetryPolicy from(ExecutorProperties props) {
        return new RetryPolicy(props.baseBackoff(), props.maxBackoff(), props.jitter());
    }

    public Duration delayFor(int failures) {
        if (failures < 1) {
            throw new IllegalArgumentException("failures must be >= 1, got " + failures);
        }
        long baseMillis = base.toMillis();
        long maxMillis  = max.toMillis();
        // 2^62 overflows long arithmetic below; anything that large is capped anyway
        int shift = Math.min(failures - 1, 62);
        long delay = baseMillis > (maxMillis >> shift) ? maxMillis : baseMillis << shift;
        if (jitter > 0) {
            delay += (long) (delay * jitter * random.getAsDouble());
        }
        return Duration.ofMillis(Math.min(delay, maxMillis));
    }
}
