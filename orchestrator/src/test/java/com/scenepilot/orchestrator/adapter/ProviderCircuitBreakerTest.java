package com.scenepilot.orchestrator.adapter;

import com.scenepilot.orchestrator.adapter.ProviderCircuitBreaker.State;
import com.scenepilot.orchestrator.model.TaskKind;
import com.scenepilot.orchestrator.testing.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderCircuitBreakerTest {

    MutableClock        clock  = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    SimpleMeterRegistry meters = new SimpleMeterRegistry();

    private ProviderCircuitBreaker breaker(int threshold, int halfOpenCalls) {
        return new ProviderCircuitBreaker(
                new BreakerProperties(threshold, Duration.ofSeconds(30), halfOpenCalls), clock, meters);
    }

    private ProviderCircuitBreaker opened(int halfOpenCalls) {
        ProviderCircuitBreaker b = breaker(2, halfOpenCalls);
        b.recordFailure(TaskKind.VIDEO);
        b.recordFailure(TaskKind.VIDEO);
        return b;
    }

    @Test
    void consecutiveFailures_atThreshold_openTheBreaker() {
        ProviderCircuitBreaker b = breaker(3, 1);

        b.recordFailure(TaskKind.VIDEO);
        b.recordFailure(TaskKind.VIDEO);
        assertThat(b.state(TaskKind.VIDEO)).isEqualTo(State.CLOSED);
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();

        b.recordFailure(TaskKind.VIDEO);

        assertThat(b.state(TaskKind.VIDEO)).isEqualTo(State.OPEN);
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isFalse();
    }

    @Test
    void success_resetsConsecutiveCount() {
        ProviderCircuitBreaker b = breaker(2, 1);

        b.recordFailure(TaskKind.IMAGE);
        b.recordSuccess(TaskKind.IMAGE);
        b.recordFailure(TaskKind.IMAGE);

        assertThat(b.state(TaskKind.IMAGE)).isEqualTo(State.CLOSED);
        assertThat(b.consecutiveFailures(TaskKind.IMAGE)).isEqualTo(1);
    }

    @Test
    void kinds_areIndependent() {
        ProviderCircuitBreaker b = opened(1);

        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isFalse();
        assertThat(b.tryAcquirePermission(TaskKind.IMAGE)).isTrue();
        assertThat(b.tryAcquirePermission(TaskKind.VOICE)).isTrue();
    }

    @Test
    void open_failuresDoNotExtendRecoveryTimer() {
        ProviderCircuitBreaker b = opened(1);

        clock.advance(Duration.ofSeconds(20));
        b.recordFailure(TaskKind.VIDEO);   // a poll of an older job
        clock.advance(Duration.ofSeconds(10));

        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();
        assertThat(b.state(TaskKind.VIDEO)).isEqualTo(State.HALF_OPEN);
    }

    @Test
    void halfOpen_handsOutOnlyTheConfiguredTrialCalls() {
        ProviderCircuitBreaker b = opened(2);
        clock.advance(Duration.ofSeconds(30));

        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isFalse();
    }

    @Test
    void halfOpen_trialSuccess_closes() {
        ProviderCircuitBreaker b = opened(1);
        clock.advance(Duration.ofSeconds(30));
        b.tryAcquirePermission(TaskKind.VIDEO);

        b.recordSuccess(TaskKind.VIDEO);

        assertThat(b.state(TaskKind.VIDEO)).isEqualTo(State.CLOSED);
        assertThat(b.consecutiveFailures(TaskKind.VIDEO)).isZero();
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();
    }

    @Test
    void halfOpen_trialFailure_reopensForAnotherTimeout() {
        ProviderCircuitBreaker b = opened(1);
        clock.advance(Duration.ofSeconds(30));
        b.tryAcquirePermission(TaskKind.VIDEO);

        b.recordFailure(TaskKind.VIDEO);

        assertThat(b.state(TaskKind.VIDEO)).isEqualTo(State.OPEN);
        clock.advance(Duration.ofSeconds(29));
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isFalse();
        clock.advance(Duration.ofSeconds(1));
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();
    }

    @Test
    void halfOpen_neutralOutcome_returnsTheTrialCall() {
        ProviderCircuitBreaker b = opened(1);
        clock.advance(Duration.ofSeconds(30));
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();

        b.recordNeutral(TaskKind.VIDEO);

        assertThat(b.state(TaskKind.VIDEO)).isEqualTo(State.HALF_OPEN);
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();
    }

    @Test
    void halfOpen_trialThatNeverReports_isReissuedAfterTimeout() {
        ProviderCircuitBreaker b = opened(1);
        clock.advance(Duration.ofSeconds(30));
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();
        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isFalse();

        clock.advance(Duration.ofSeconds(30));

        assertThat(b.tryAcquirePermission(TaskKind.VIDEO)).isTrue();
    }

    @Test
    void zeroThreshold_disablesTheBreaker() {
        ProviderCircuitBreaker b = breaker(0, 1);

        for (int i = 0; i < 10; i++) {
            b.recordFailure(TaskKind.IMAGE);
        }

        assertThat(b.state(TaskKind.IMAGE)).isEqualTo(State.CLOSED);
        assertThat(b.tryAcquirePermission(TaskKind.IMAGE)).isTrue();
    }

    @Test
    void transitions_areCountedAndStateIsGauged() {
        ProviderCircuitBreaker b = opened(1);

        assertThat(meters.get("scenepilot.adapter.breaker.state").tag("kind", "video").gauge().value())
                .isEqualTo(2.0);
        assertThat(meters.get("scenepilot.adapter.breaker.state").tag("kind", "image").gauge().value())
                .isEqualTo(0.0);

        clock.advance(Duration.ofSeconds(30));
        b.tryAcquirePermission(TaskKind.VIDEO);
        assertThat(meters.get("scenepilot.adapter.breaker.state").tag("kind", "video").gauge().value())
                .isEqualTo(1.0);
        b.recordSuccess(TaskKind.VIDEO);

        assertThat(meters.get("scenepilot.adapter.breaker.transitions")
                .tags("kind", "video", "state", "open").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("scenepilot.adapter.breaker.transitions")
                .tags("kind", "video", "state", "half_open").counter().count()).isEqualTo(1.0);
        assertThat(meters.get("scenepilot.adapter.breaker.transitions")
                .tags("kind", "video", "state", "closed").counter().count()).isEqualTo(1.0);
    }
}
