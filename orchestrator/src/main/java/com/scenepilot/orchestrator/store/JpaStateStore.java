package com.scenepilot.orchestrator.store;

import com.scenepilot.orchestrator.error.NotFoundException;
import com.scenepilot.orchestrator.error.StateConflictException;
import com.scenepilot.orchestrator.model.*;
import com.scenepilot.orchestrator.repository.ProjectRepository;
import com.scenepilot.orchestrator.repository.SceneRepository;
import com.scenepilot.orchestrator.repository.StageTransitionRepository;
import com.scenepilot.orchestrator.repository.TaskRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * PostgreSQL-backed StateStore built on Spring Data JPA.
 *
 * Each update runs in its own transaction: load, mutate, saveAndFlush. The
 * flush compares the entity's @Version column, so a concurrent writer makes it
 * fail with OptimisticLockingFailureException, the transaction rolls back and
 * the whole read-modify-write is repeated. Programmatic transactions are used
 * instead of @Transactional because the retry loop must sit outside the
 * transaction boundary.
 */
@Component
@ConditionalOnProperty(name = "scenepilot.store.type", havingValue = "jpa", matchIfMissing = true)
public class JpaStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(JpaStateStore.class);

    static final int MAX_CONFLICT_RETRIES = 20;

    private final ProjectRepository         projectRepo;
    private final SceneRepository           sceneRepo;
    private final TaskRepository            taskRepo;
    private final StageTransitionRepository transitionRepo;
    private final TransactionTemplate       tx;

    public JpaStateStore(ProjectRepository projectRepo,
                         SceneRepository sceneRepo,
                         TaskRepository taskRepo,
                         StageTransitionRepository transitionRepo,
                         PlatformTransactionManager transactionManager) {
        this.projectRepo    = projectRepo;
        this.sceneRepo      = sceneRepo;
        this.taskRepo       = taskRepo;
        this.transitionRepo = transitionRepo;
        this.tx             = new TransactionTemplate(transactionManager);
    }

    @Override
    public Project createProject(Project project, List<Scene> scenes) {
        return tx.execute(status -> {
            Project saved = projectRepo.save(project);
            sceneRepo.saveAll(scenes);
            return saved;
        });
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    public Optional<Project> findProject(UUID projectId) {
        return projectRepo.findById(projectId);
    }

    @Override
    public Optional<Scene> findScene(UUID sceneId) {
        return sceneRepo.findById(sceneId);
    }

    @Override
    public Optional<Task> findTask(UUID taskId) {
        return taskRepo.findById(taskId);
    }

    @Override
    public List<Scene> scenesOf(UUID projectId) {
        return sceneRepo.findByProjectIdOrderByPositionAsc(projectId);
    }

    @Override
    public List<Task> tasksOf(UUID projectId) {
        return taskRepo.findByProjectIdOrderByQueuedAtAsc(projectId);
    }

    @Override
    public List<Task> tasksOfStageRun(UUID projectId, int stageRun) {
        return taskRepo.findByProjectIdAndStageRunOrderByQueuedAtAsc(projectId, stageRun);
    }

    @Override
    public List<Task> tasksInStatus(Collection<TaskStatus> statuses) {
        return taskRepo.findByStatusInOrderByQueuedAtAsc(statuses);
    }

    @Override
    public List<StageTransitionRecord> transitionsOf(UUID projectId) {
        return transitionRepo.findByProjectIdOrderByCreatedAtAsc(projectId);
    }

    // ------------------------------------------------------------------
    // Optimistic updates
    // ------------------------------------------------------------------

    @Override
    public Project updateProject(UUID projectId, Consumer<Project> mutation) {
        return updateProjectWithTasks(projectId, project -> {
            mutation.accept(project);
            return List.of();
        });
    }

    @Override
    public Project updateProjectWithTasks(UUID projectId, Function<Project, List<Task>> mutation) {
        return withConflictRetry("project " + projectId, () -> {
            Project project = projectRepo.findById(projectId)
                    .orElseThrow(() -> new NotFoundException("Project not found: " + projectId));
            List<Task> newTasks = mutation.apply(project);
            List<StageTransitionRecord> transitions = project.drainPendingTransitions();
            Project saved = projectRepo.saveAndFlush(project);
            if (!transitions.isEmpty()) transitionRepo.saveAll(transitions);
            if (!newTasks.isEmpty())    taskRepo.saveAll(newTasks);
            return saved;
        });
    }

    @Override
    public Scene updateScene(UUID sceneId, Consumer<Scene> mutation) {
        return withConflictRetry("scene " + sceneId, () -> {
            Scene scene = sceneRepo.findById(sceneId)
                    .orElseThrow(() -> new NotFoundException("Scene not found: " + sceneId));
            mutation.accept(scene);
            return sceneRepo.saveAndFlush(scene);
        });
    }

    @Override
    public Task updateTask(UUID taskId, Consumer<Task> mutation) {
        return withConflictRetry("task " + taskId, () -> {
            Task task = taskRepo.findById(taskId)
                    .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
            mutation.accept(task);
            return taskRepo.saveAndFlush(task);
        });
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Run one read-modify-write transaction, repeating it on version conflicts.
     * Exceptions thrown by the mutation itself roll back and propagate as-is.
     */
    private <T> T withConflictRetry(String what, Supplier<T> work) {
        OptimisticLockingFailureException last = null;
        for (int attempt = 1; attempt <= MAX_CONFLICT_RETRIES; attempt++) {
            try {
                return tx.execute(status -> work.get());
            } catch (OptimisticLockingFailureException e) {
                last = e;
                log.debug("Version conflict on {} (attempt {}/{}), retrying with a fresh read",
                        what, attempt, MAX_CONFLICT_RETRIES);
            }
        }
        throw new StateConflictException(
                "Gave up updating " + what + " after " + MAX_CONFLICT_RETRIES + " version conflicts", last);
    }
}
