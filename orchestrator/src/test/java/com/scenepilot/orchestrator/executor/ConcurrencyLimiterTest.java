package com.scenepilot.orchestrator.executor;

import com.scenepilot.orchestrator.model.TaskKind;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class ConcurrencyLimiterTest {

    SimpleMeterRegistry meters;
    ConcurrencyLimiter  limiter;

    @BeforeEach
    void setUp() {
        meters = new SimpleMeterRegistry();
        ExecutorProperties props = new ExecutorProperties(3, Duration.ofSeconds(1), Duration.ofSeconds(60), 0.0,
                Duration.ofSeconds(2), Duration.ofSeconds(5), 3, 8,
                Map.of(TaskKind.VIDEO, new ExecutorProperties.KindLimits(2, null)));
        limiter = new ConcurrencyLimiter(props, meters);
    }

    @Test
    void tryAcquire_upToLimit_thenRefuses() {
        assertThat(limiter.tryAcquire(UUID.randomUUID(), TaskKind.VIDEO)).isTrue();
        assertThat(limiter.tryAcquire(UUID.randomUUID(), TaskKind.VIDEO)).isTrue();
        assertThat(limiter.tryAcquire(UUID.randomUUID(), TaskKind.VIDEO)).isFalse();

        // other kinds have their own pool
        assertThat(limiter.tryAcquire(UUID.randomUUID(), TaskKind.IMAGE)).isTrue();
        assertThat(limiter.inUse(TaskKind.VIDEO)).isEqualTo(2);
    }

    @Test
    void tryAcquire_sameTaskTwice_holdsOneSlot() {
        UUID task = UUID.randomUUID();

        limiter.tryAcquire(task, TaskKind.VIDEO);
        limiter.tryAcquire(task, TaskKind.VIDEO);

        assertThat(limiter.inUse(TaskKind.VIDEO)).isEqualTo(1);
        assertThat(limiter.holds(task)).isTrue();
    }

    @Test
    void release_isIdempotentAndFreesSlot() {
        UUID a = UUID.randomUUID();
        UUID b = UUID.randomUUID();
        limiter.tryAcquire(a, TaskKind.VIDEO);
        limiter.tryAcquire(b, TaskKind.VIDEO);

        limiter.release(a);
        limiter.release(a);
        limiter.release(UUID.randomUUID());

        assertThat(limiter.inUse(TaskKind.VIDEO)).isEqualTo(1);
        assertThat(limiter.tryAcquire(UUID.randomUUID(), TaskKind.VIDEO)).isTrue();
    }

    @Test
    void reserve_ignoresLimit() {
        limiter.tryAcquire(UUID.randomUUID(), TaskKind.VIDEO);
        limiter.tryAcquire(UUID.randomUUID(), TaskKind.VIDEO);

        limiter.reserve(UUID.randomUUID(), TaskKind.VIDEO);

        assertThat(limiter.inUse(TaskKind.VIDEO)).isEqualTo(3);
        assertThat(limiter.tryAcquire(UUID.randomUUID(), TaskKind.VIDEO)).isFalse();
    }

    @Test
    void limit_unconfiguredKind_usesDefault() {
        assertThat(limiter.limit(TaskKind.IMAGE)).isEqualTo(4);
        assertThat(limiter.limit(TaskKind.VIDEO)).isEqualTo(2);
    }

    @Test
    void gauge_reportsSlotsInUse() {
        limiter.tryAcquire(UUID.randomUUID(), TaskKind.IMAGE);

        assertThat(meters.get("scenepilot.executor.slots.in_use").tag("kind", "image").gauge().value())
                .isEqualTo(1.0);
    }

    @Test
    void tryAcquire_concurrentCallers_neverExceedLimit() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger granted = new AtomicInteger();
        List<Runnable> jobs = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            jobs.add(() -> {
                try {
                    start.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return;
                }
                if (limiter.tryAcquire(UUID.randomUUID(), TaskKind.VIDEO)) {
                    granted.incrementAndGet();
                }
            });
        }
        jobs.forEach(pool::execute);
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(granted.get()).isEqualTo(2);
        assertThat(limiter.inUse(TaskKind.VIDEO)).isEqualTo(2);
    }
}
