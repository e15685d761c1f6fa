package com.scenepilot.orchestrator.store;

import com.scenepilot.orchestrator.error.NotFoundException;
import com.scenepilot.orchestrator.error.StateConflictException;
import com.scenepilot.orchestrator.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Process-local StateStore for development runs and tests.
 *
 * Records are kept as private copies and handed out as copies. An update
 * copies the current record, mutates the copy and swaps it in with
 * {@link ConcurrentHashMap#replace(Object, Object, Object)}, which only
 * succeeds if the stored instance is still the one that was read. That gives
 * the same optimistic semantics as the version column in the JPA store.
 *
 * Nothing survives a restart.
 */
@Component
@ConditionalOnProperty(name = "scenepilot.store.type", havingValue = "memory")
public class InMemoryStateStore implements StateStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStateStore.class);

    private static final int MAX_CONFLICT_RETRIES = 1000;

    private final Map<UUID, Project> projects = new ConcurrentHashMap<>();
    private final Map<UUID, Scene>   scenes   = new ConcurrentHashMap<>();
    private final Map<UUID, Task>    tasks    = new ConcurrentHashMap<>();
    private final List<StageTransitionRecord> transitions = new CopyOnWriteArrayList<>();

    // Guards task inserts against task-list reads, so a project entering a
    // generation stage is never observed without its tasks.
    private final Object taskSetLock = new Object();

    @Override
    public Project createProject(Project project, List<Scene> newScenes) {
        Project stored = project.copy();
        stored.setVersion(0L);
        if (projects.putIfAbsent(stored.getId(), stored) != null) {
            throw new IllegalStateException("Project already exists: " + project.getId());
        }
        for (Scene scene : newScenes) {
            Scene s = scene.copy();
            s.setVersion(0L);
            scenes.put(s.getId(), s);
        }
        log.debug("Created project {} with {} scenes", project.getId(), newScenes.size());
        return stored.copy();
    }

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    @Override
    public Optional<Project> findProject(UUID projectId) {
        return Optional.ofNullable(projects.get(projectId)).map(Project::copy);
    }

    @Override
    public Optional<Scene> findScene(UUID sceneId) {
        return Optional.ofNullable(scenes.get(sceneId)).map(Scene::copy);
    }

    @Override
    public Optional<Task> findTask(UUID taskId) {
        return Optional.ofNullable(tasks.get(taskId)).map(Task::copy);
    }

    @Override
    public List<Scene> scenesOf(UUID projectId) {
        return scenes.values().stream()
                .filter(s -> s.getProjectId().equals(projectId))
                .sorted(Comparator.comparingInt(Scene::getPosition))
                .map(Scene::copy)
                .toList();
    }

    @Override
    public List<Task> tasksOf(UUID projectId) {
        synchronized (taskSetLock) {
            return sortedCopies(t -> t.getProjectId().equals(projectId));
        }
    }

    @Override
    public List<Task> tasksOfStageRun(UUID projectId, int stageRun) {
        synchronized (taskSetLock) {
            return sortedCopies(t -> t.getProjectId().equals(projectId) && t.getStageRun() == stageRun);
        }
    }

    @Override
    public List<Task> tasksInStatus(Collection<TaskStatus> statuses) {
        return sortedCopies(t -> statuses.contains(t.getStatus()));
    }

    @Override
    public List<StageTransitionRecord> transitionsOf(UUID projectId) {
        return transitions.stream()
                .filter(r -> r.getProjectId().equals(projectId))
                .toList();
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
        synchronized (taskSetLock) {
            List<List<Task>> created = new ArrayList<>(1);
            List<List<StageTransitionRecord>> audit = new ArrayList<>(1);
            Project saved = compareAndSet(projects, projectId, "project", current -> {
                Project next = current.copy();
                created.clear();
                created.add(mutation.apply(next));
                audit.clear();
                audit.add(next.drainPendingTransitions());
                next.setVersion(current.getVersion() + 1);
                return next;
            });
            transitions.addAll(audit.get(0));
            for (Task task : created.get(0)) {
                Task t = task.copy();
                t.setVersion(0L);
                tasks.put(t.getId(), t);
            }
            return saved.copy();
        }
    }

    @Override
    public Scene updateScene(UUID sceneId, Consumer<Scene> mutation) {
        return compareAndSet(scenes, sceneId, "scene", current -> {
            Scene next = current.copy();
            mutation.accept(next);
            next.setVersion(current.getVersion() + 1);
            return next;
        }).copy();
    }

    @Override
    public Task updateTask(UUID taskId, Consumer<Task> mutation) {
        return compareAndSet(tasks, taskId, "task", current -> {
            Task next = current.copy();
            mutation.accept(next);
            next.setVersion(current.getVersion() + 1);
            return next;
        }).copy();
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static <T> T compareAndSet(Map<UUID, T> map, UUID id, String what, UnaryOperator<T> update) {
        for (int attempt = 1; attempt <= MAX_CONFLICT_RETRIES; attempt++) {
            T current = map.get(id);
            if (current == null) {
                throw new NotFoundException(Character.toUpperCase(what.charAt(0)) + what.substring(1)
                        + " not found: " + id);
            }
            T next = update.apply(current);
            if (map.replace(id, current, next)) {
                return next;
            }
            log.debug("Version conflict on {} {} (attempt {}), retrying with a fresh read", what, id, attempt);
        }
        throw new StateConflictException("Gave up updating " + what + " " + id, null);
    }

    private List<Task> sortedCopies(Predicate<Task> filter) {
        return tasks.values().stream()
                .filter(filter)
                .sorted(Comparator.comparing(Task::getQueuedAt).thenComparing(t -> t.getId().toString()))
                .map(Task::copy)
                .toList();
    }
}
