package com.scenepilot.orchestrator.cost;

import com.scenepilot.orchestrator.error.ValidationException;
import com.scenepilot.orchestrator.model.Project;
import com.scenepilot.orchestrator.model.TaskKind;
import com.scenepilot.orchestrator.store.InMemoryStateStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CostTrackerTest {

    InMemoryStateStore  store  = new InMemoryStateStore();
    SimpleMeterRegistry meters = new SimpleMeterRegistry();
    CostTracker         tracker;
    UUID                projectId;

    @BeforeEach
    void setUp() {
        tracker = new CostTracker(store, meters);
        projectId = store.createProject(new Project("demo"), List.of()).getId();
    }

    @Test
    void recordCost_accumulatesAndCountsPerKind() {
        tracker.recordCost(projectId, new BigDecimal("1.25"), TaskKind.IMAGE);
        BigDecimal total = tracker.recordCost(projectId, new BigDecimal("2.5"), TaskKind.VIDEO);

        assertThat(total).isEqualByComparingTo("3.75");
        assertThat(store.getProject(projectId).getCostCredits()).isEqualByComparingTo("3.75");
        assertThat(meters.counter("scenepilot.cost.credits", "kind", "video").count()).isEqualTo(2.5);
    }

    @Test
    void recordCost_zero_leavesTotalUnchanged() {
        tracker.recordCost(projectId, BigDecimal.ONE, TaskKind.VOICE);
        Long version = store.getProject(projectId).getVersion();

        BigDecimal total = tracker.recordCost(projectId, BigDecimal.ZERO, TaskKind.VOICE);

        assertThat(total).isEqualByComparingTo("1");
        assertThat(store.getProject(projectId).getVersion()).isEqualTo(version);
    }

    @Test
    void recordCost_negativeOrNull_rejected() {
        assertThatThrownBy(() -> tracker.recordCost(projectId, new BigDecimal("-0.01"), TaskKind.IMAGE))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> tracker.recordCost(projectId, null, TaskKind.IMAGE))
                .isInstanceOf(ValidationException.class);
        assertThat(store.getProject(projectId).getCostCredits()).isEqualByComparingTo("0");
    }

    @Test
    void recordCost_concurrentAdds_noneLost() throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int i = 0; i < 200; i++) {
            pool.execute(() -> tracker.recordCost(projectId, new BigDecimal("0.5"), TaskKind.IMAGE));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(store.getProject(projectId).getCostCredits()).isEqualByComparingTo("100");
    }
}
