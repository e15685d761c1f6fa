package com.scenepilot.orchestrator.adapter;

import com.scenepilot.orchestrator.model.TaskKind;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

/**
 * One circuit breaker per task kind, guarding new submits to a provider.
 *
 * <pre>
 * CLOSED    --threshold consecutive failures-->  OPEN
 * OPEN      --recovery timeout elapsed-------->  HALF_OPEN
 * HALF_OPEN --trial call succeeds------------->  CLOSED
 * HALF_OPEN --trial call fails---------------->  OPEN
 * </pre>
 *
 * Failures are transient submit or poll errors, unclassified adapter errors
 * and transient job failures reported by a poll. Rate-limit and permanent
 * rejections say nothing about provider health and leave the breaker alone.
 *
 * Only submits are gated: polls of jobs already with the provider go on, and
 * their outcomes feed the breaker like any other call. While OPEN, successes
 * are ignored and the recovery timer is not extended by further failures.
 */
@Component
public class ProviderCircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ProviderCircuitBreaker.class);

    public enum State { CLOSED, HALF_OPEN, OPEN }

    private final BreakerProperties props;
    private final Clock             clock;
    private final MeterRegistry     meters;

    private final Map<TaskKind, KindBreaker> breakers = new EnumMap<>(TaskKind.class);

    public ProviderCircuitBreaker(BreakerProperties props, Clock clock, MeterRegistry meters) {
        this.props  = props;
        this.clock  = clock;
        this.meters = meters;
        for (TaskKind kind : TaskKind.values()) {
            breakers.put(kind, new KindBreaker());
            Gauge.builder("scenepilot.adapter.breaker.state", this, b -> b.state(kind).ordinal())
                    .description("0 closed, 1 half-open, 2 open")
                    .tag("kind", kind.name().toLowerCase())
                    .register(meters);
        }
    }

    /**
     * Ask to submit a new task of the kind. In HALF_OPEN this hands out one
     * of the trial calls, so a caller that gets {@code true} but then does not
     * call the provider should hand it back with {@link #recordNeutral}.
     */
    public synchronized boolean tryAcquirePermission(TaskKind kind) {
        if (!props.enabled()) {
            return true;
        }
        KindBreaker b = breakers.get(kind);
        Instant now = clock.instant();
        switch (b.state) {
            case CLOSED:
                return true;
            case OPEN:
                if (elapsed(b.since, now)) {
                    moveTo(kind, b, State.HALF_OPEN, now);
                } else {
                    return false;
                }
                // fall through to hand out the first trial call
            case HALF_OPEN:
                if (b.trialCalls >= props.halfOpenMaxCalls()) {
                    // Trial calls that never reported back do not hold the breaker forever.
                    if (!elapsed(b.since, now)) {
                        return false;
                    }
                    b.since = now;
                    b.trialCalls = 0;
                }
                b.trialCalls++;
                return true;
            default:
                throw new IllegalStateException("Unknown breaker state " + b.state);
        }
    }

    public synchronized void recordSuccess(TaskKind kind) {
        if (!props.enabled()) return;
        KindBreaker b = breakers.get(kind);
        b.consecutiveFailures = 0;
        if (b.state == State.HALF_OPEN) {
            moveTo(kind, b, State.CLOSED, clock.instant());
        }
    }

    public synchronized void recordFailure(TaskKind kind) {
        if (!props.enabled()) return;
        KindBreaker b = breakers.get(kind);
        b.consecutiveFailures++;
        if (b.state == State.HALF_OPEN
                || (b.state == State.CLOSED && b.consecutiveFailures >= props.failureThreshold())) {
            moveTo(kind, b, State.OPEN, clock.instant());
        }
    }

    /** A call that neither proves nor disproves provider health; returns a trial call if one was taken. */
    public synchronized void recordNeutral(TaskKind kind) {
        if (!props.enabled()) return;
        KindBreaker b = breakers.get(kind);
        if (b.state == State.HALF_OPEN && b.trialCalls > 0) {
            b.trialCalls--;
        }
    }

    public synchronized State state(TaskKind kind) {
        return breakers.get(kind).state;
    }

    public synchronized int consecutiveFailures(TaskKind kind) {
        return breakers.get(kind).consecutiveFailures;
    }

    private boolean elapsed(Instant since, Instant now) {
        return Duration.between(since, now).compareTo(props.recoveryTimeout()) >= 0;
    }

    private void moveTo(TaskKind kind, KindBreaker b, State to, Instant now) {
        State from = b.state;
        b.state = to;
        b.since = now;
        b.trialCalls = 0;
        if (to == State.CLOSED) {
            b.consecutiveFailures = 0;
        }
        if (to == State.OPEN) {
            log.warn("{} provider breaker {} -> OPEN after {} consecutive failure(s); new submits paused for {}",
                    kind, from, b.consecutiveFailures, props.recoveryTimeout());
        } else {
            log.info("{} provider breaker {} -> {}", kind, from, to);
        }
        meters.counter("scenepilot.adapter.breaker.transitions",
                "kind", kind.name().toLowerCase(), "state", to.name().toLowerCase()).increment();
    }

    private static final class KindBreaker {
        State   state = State.CLOSED;
        Instant since = Instant.EPOCH;
        int     consecutiveFailures;
        int     trialCalls;
    }
}
