package com.scenepilot.orchestrator.store;

import com.scenepilot.orchestrator.error.NotFoundException;
import com.scenepilot.orchestrator.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryStateStoreTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    InMemoryStateStore store = new InMemoryStateStore();
    Project project;
    Scene   first;
    Scene   second;

    @BeforeEach
    void setUp() {
        Project p = new Project("demo");
        first  = new Scene(p.getId(), 1, "one", "projects/" + p.getId() + "/scene-1");
        second = new Scene(p.getId(), 2, "two", "projects/" + p.getId() + "/scene-2");
        project = store.createProject(p, List.of(second, first));
    }

    @Test
    void reads_returnDetachedCopies() {
        Project copy = store.getProject(project.getId());
        copy.setBlockedSummary("changed outside the store");

        assertThat(store.getProject(project.getId()).isBlocked()).isFalse();
        assertThat(store.scenesOf(project.getId())).extracting(Scene::getPosition).containsExactly(1, 2);
    }

    @Test
    void updateProjectWithTasks_insertsTasksAndAuditInOneWrite() {
        Project updated = store.updateProjectWithTasks(project.getId(), p -> {
            p.transitionTo(ProjectStage.SCRIPT_ANALYZED, TransitionActor.SYSTEM, "analyzed");
            p.transitionTo(ProjectStage.STORYBOARD_IN_PROGRESS, TransitionActor.SYSTEM, "advance");
            return List.of(
                    new Task(p.getId(), first.getId(), TaskKind.IMAGE, p.getStageRun(), T0),
                    new Task(p.getId(), second.getId(), TaskKind.IMAGE, p.getStageRun(), T0.plusMillis(1)));
        });

        assertThat(updated.getStage()).isEqualTo(ProjectStage.STORYBOARD_IN_PROGRESS);
        assertThat(updated.getVersion()).isEqualTo(1L);
        assertThat(store.tasksOfStageRun(project.getId(), 1)).hasSize(2);
        assertThat(store.tasksInStatus(EnumSet.of(TaskStatus.QUEUED)))
                .extracting(Task::getSceneId)
                .containsExactly(first.getId(), second.getId());
        assertThat(store.transitionsOf(project.getId()))
                .extracting(StageTransitionRecord::getToStage)
                .containsExactly(ProjectStage.SCRIPT_ANALYZED, ProjectStage.STORYBOARD_IN_PROGRESS);
    }

    @Test
    void update_mutationThrows_leavesRecordUntouched() {
        assertThatThrownBy(() -> store.updateProject(project.getId(), p -> {
            p.setBlockedSummary("half-done");
            throw new IllegalStateException("abort");
        })).isInstanceOf(IllegalStateException.class);

        Project after = store.getProject(project.getId());
        assertThat(after.isBlocked()).isFalse();
        assertThat(after.getVersion()).isZero();
    }

    @Test
    void updateTask_unknownId_throwsNotFound() {
        assertThatThrownBy(() -> store.updateTask(UUID.randomUUID(), t -> {}))
                .isInstanceOf(NotFoundException.class)
                .hasMessageStartingWith("Task not found");
    }

    @Test
    void updateScene_concurrentWriters_noUpdateLost() throws Exception {
        // each writer appends its kind; a lost update would drop a flag
        ExecutorService pool = Executors.newFixedThreadPool(3);
        for (TaskKind kind : TaskKind.values()) {
            pool.execute(() -> {
                for (int i = 0; i < 100; i++) {
                    store.updateScene(first.getId(), s -> s.markDegraded(kind));
                }
            });
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        Scene after = store.getScene(first.getId());
        assertThat(after.getDegradedKinds()).containsExactlyInAnyOrder(TaskKind.values());
        assertThat(after.getVersion()).isEqualTo(300L);
    }

    @Test
    void updateTask_illegalTransition_propagates() {
        Task task = new Task(project.getId(), first.getId(), TaskKind.IMAGE, 1, T0);
        store.updateProjectWithTasks(project.getId(), p -> List.of(task));
        store.updateTask(task.getId(), t -> t.markCancelled(T0));

        assertThatThrownBy(() -> store.updateTask(task.getId(), t -> t.markSubmitted("job-1", T0)))
                .isInstanceOf(IllegalTaskTransitionException.class);
        assertThat(store.getTask(task.getId()).getStatus()).isEqualTo(TaskStatus.CANCELLED);
    }
}
