package com.scenepilot.orchestrator.store;

import com.scenepilot.orchestrator.error.NotFoundException;
import com.scenepilot.orchestrator.error.StateConflictException;
import com.scenepilot.orchestrator.model.*;
import com.scenepilot.orchestrator.repository.ProjectRepository;
import com.scenepilot.orchestrator.repository.SceneRepository;
import com.scenepilot.orchestrator.repository.StageTransitionRepository;
import com.scenepilot.orchestrator.repository.TaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Retry behaviour of the JPA store. Repositories and the transaction manager
 * are mocked; version conflicts are simulated by the flush throwing.
 */
@ExtendWith(MockitoExtension.class)
class JpaStateStoreTest {

    @Mock ProjectRepository          projectRepo;
    @Mock SceneRepository            sceneRepo;
    @Mock TaskRepository             taskRepo;
    @Mock StageTransitionRepository  transitionRepo;
    @Mock PlatformTransactionManager txManager;

    JpaStateStore store;
    Task          task;

    @BeforeEach
    void setUp() {
        lenient().when(txManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        store = new JpaStateStore(projectRepo, sceneRepo, taskRepo, transitionRepo, txManager);
        task = new Task(UUID.randomUUID(), UUID.randomUUID(), TaskKind.VOICE, 1, Instant.now());
    }

    // ------------------------------------------------------------------
    // Version conflicts
    // ------------------------------------------------------------------

    @Test
    void updateTask_conflictOnce_retriesWithFreshRead() {
        when(taskRepo.findById(task.getId())).thenAnswer(inv -> Optional.of(task.copy()));
        when(taskRepo.saveAndFlush(any(Task.class)))
                .thenThrow(new OptimisticLockingFailureException("stale"))
                .thenAnswer(inv -> inv.getArgument(0));

        Task saved = store.updateTask(task.getId(), t -> t.markSubmitted("job-1", Instant.now()));

        assertThat(saved.getExternalRef()).isEqualTo("job-1");
        verify(taskRepo, times(2)).findById(task.getId());
        verify(txManager).rollback(any());
        verify(txManager).commit(any());
    }

    @Test
    void updateTask_conflictsForever_givesUpWithStateConflict() {
        when(taskRepo.findById(task.getId())).thenAnswer(inv -> Optional.of(task.copy()));
        when(taskRepo.saveAndFlush(any(Task.class))).thenThrow(new OptimisticLockingFailureException("stale"));

        assertThatThrownBy(() -> store.updateTask(task.getId(), t -> t.markRunning(10)))
                .isInstanceOf(StateConflictException.class)
                .hasCauseInstanceOf(OptimisticLockingFailureException.class);
        verify(taskRepo, times(JpaStateStore.MAX_CONFLICT_RETRIES)).saveAndFlush(any(Task.class));
    }

    @Test
    void updateTask_mutationRejects_propagatesWithoutRetry() {
        task.markCancelled(Instant.now());
        when(taskRepo.findById(task.getId())).thenReturn(Optional.of(task));

        assertThatThrownBy(() -> store.updateTask(task.getId(), t -> t.markRunning(10)))
                .isInstanceOf(IllegalTaskTransitionException.class);
        verify(taskRepo, times(1)).findById(task.getId());
        verify(taskRepo, never()).saveAndFlush(any());
    }

    @Test
    void updateScene_unknownId_throwsNotFound() {
        UUID id = UUID.randomUUID();
        when(sceneRepo.findById(id)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> store.updateScene(id, s -> {}))
                .isInstanceOf(NotFoundException.class);
    }

    // ------------------------------------------------------------------
    // Project writes
    // ------------------------------------------------------------------

    @Test
    @SuppressWarnings("unchecked")
    void updateProjectWithTasks_savesAuditAndTasksAfterProject() {
        Project project = new Project("demo");
        when(projectRepo.findById(project.getId())).thenReturn(Optional.of(project));
        when(projectRepo.saveAndFlush(project)).thenReturn(project);

        store.updateProjectWithTasks(project.getId(), p -> {
            p.transitionTo(ProjectStage.SCRIPT_ANALYZED, TransitionActor.SYSTEM, "analyzed");
            return List.of(task);
        });

        ArgumentCaptor<List<StageTransitionRecord>> audit = ArgumentCaptor.forClass(List.class);
        verify(transitionRepo).saveAll(audit.capture());
        assertThat(audit.getValue()).singleElement()
                .satisfies(r -> assertThat(r.getToStage()).isEqualTo(ProjectStage.SCRIPT_ANALYZED));
        verify(taskRepo).saveAll(List.of(task));
        assertThat(project.drainPendingTransitions()).isEmpty();
    }

    @Test
    void updateProject_noTransition_skipsAuditWrite() {
        Project project = new Project("demo");
        when(projectRepo.findById(project.getId())).thenReturn(Optional.of(project));
        when(projectRepo.saveAndFlush(project)).thenReturn(project);

        store.updateProject(project.getId(), p -> p.setBlockedSummary("scene 1 image: FAILED"));

        verifyNoInteractions(transitionRepo);
        verify(taskRepo, never()).saveAll(any());
    }
}
