package com.scenepilot.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TaskTest {

    private static final Instant NOW = Instant.parse("2026-01-01T00:00:00Z");

    private Task newTask() {
        return new Task(UUID.randomUUID(), UUID.randomUUID(), TaskKind.IMAGE, 1, NOW);
    }

    // ------------------------------------------------------------------
    // Happy path
    // ------------------------------------------------------------------

    @Test
    void newTask_isQueuedAndDue() {
        Task task = newTask();

        assertThat(task.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(task.getAttemptCount()).isZero();
        assertThat(task.isDue(NOW)).isTrue();
    }

    @Test
    void submitRunSucceed_recordsProgressAndCost() {
        Task task = newTask();

        task.markSubmitted("job-7", NOW);
        task.markRunning(40);
        task.markRunning(140);
        task.markSucceeded(new BigDecimal("1.25"), NOW.plusSeconds(30));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.SUCCEEDED);
        assertThat(task.getExternalRef()).isEqualTo("job-7");
        assertThat(task.getProgressPercent()).isEqualTo(100);
        assertThat(task.getCostCredits()).isEqualByComparingTo("1.25");
        assertThat(task.getCompletedAt()).isEqualTo(NOW.plusSeconds(30));
    }

    @Test
    void markSubmitted_blankExternalRef_rejected() {
        Task task = newTask();

        assertThatThrownBy(() -> task.markSubmitted(" ", NOW)).isInstanceOf(IllegalArgumentException.class);
        assertThat(task.getStatus()).isEqualTo(TaskStatus.QUEUED);
    }

    // ------------------------------------------------------------------
    // Retries
    // ------------------------------------------------------------------

    @Test
    void recordTransientFailure_belowBudget_requeuesWithBackoff() {
        Task task = newTask();
        task.markSubmitted("job-1", NOW);

        boolean requeued = task.recordTransientFailure(ErrorClass.TRANSIENT, "503", 3,
                failures -> NOW.plusSeconds(failures), NOW);

        assertThat(requeued).isTrue();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(task.getAttemptCount()).isEqualTo(1);
        assertThat(task.getExternalRef()).isNull();
        assertThat(task.getNextAttemptAt()).isEqualTo(NOW.plusSeconds(1));
        assertThat(task.isDue(NOW)).isFalse();
        assertThat(task.isDue(NOW.plusSeconds(1))).isTrue();
    }

    @Test
    void recordTransientFailure_budgetSpent_fails() {
        Task task = newTask();
        for (int i = 0; i < 2; i++) {
            task.markSubmitted("job-" + i, NOW);
            task.recordTransientFailure(ErrorClass.TRANSIENT, "503", 3, f -> NOW, NOW);
        }
        task.markSubmitted("job-2", NOW);

        boolean requeued = task.recordTransientFailure(ErrorClass.TIMEOUT, "too slow", 3, f -> NOW, NOW);

        assertThat(requeued).isFalse();
        assertThat(task.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(task.getAttemptCount()).isEqualTo(3);
        assertThat(task.getLastErrorClass()).isEqualTo(ErrorClass.TIMEOUT);
    }

    @Test
    void deferSubmit_keepsAttemptCount() {
        Task task = newTask();

        task.deferSubmit(NOW.plusSeconds(5));

        assertThat(task.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(task.getAttemptCount()).isZero();
        assertThat(task.isDue(NOW)).isFalse();
    }

    // ------------------------------------------------------------------
    // Terminal states
    // ------------------------------------------------------------------

    @Test
    void terminalTask_rejectsEveryFurtherChange() {
        Task task = newTask();
        task.markCancelled(NOW);

        assertThat(task.getLastErrorClass()).isEqualTo(ErrorClass.CANCELLED);
        assertThatThrownBy(() -> task.markSubmitted("job-1", NOW))
                .isInstanceOf(IllegalTaskTransitionException.class);
        assertThatThrownBy(() -> task.markSucceeded(BigDecimal.ONE, NOW))
                .isInstanceOf(IllegalTaskTransitionException.class);
        assertThatThrownBy(() -> task.recordTransientFailure(ErrorClass.TRANSIENT, "x", 3, f -> NOW, NOW))
                .isInstanceOf(IllegalTaskTransitionException.class)
                .satisfies(e -> assertThat(((IllegalTaskTransitionException) e).getFrom())
                        .isEqualTo(TaskStatus.CANCELLED));
        assertThat(task.getStatus()).isEqualTo(TaskStatus.CANCELLED);
    }

    @Test
    void queuedTask_cannotSucceedWithoutSubmit() {
        Task task = newTask();

        assertThatThrownBy(() -> task.markSucceeded(BigDecimal.ONE, NOW))
                .isInstanceOf(IllegalTaskTransitionException.class);
    }

    @Test
    void copy_isDetached() {
        Task task = newTask();
        Task copy = task.copy();

        copy.markSubmitted("job-1", NOW);

        assertThat(task.getStatus()).isEqualTo(TaskStatus.QUEUED);
        assertThat(copy.getId()).isEqualTo(task.getId());
    }
}
