package com.scenepilot.orchestrator.store;

import com.scenepilot.orchestrator.error.NotFoundException;
import com.scenepilot.orchestrator.model.*;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Persistence contract for projects, scenes, tasks and the stage audit trail.
 *
 * Every update is an optimistic read-modify-write: the mutation is applied to
 * the freshest copy of the record and written only if nobody else wrote it in
 * between. On a version conflict the mutation runs again against a new read,
 * so mutations must be safe to repeat. A mutation aborts the write by throwing.
 *
 * Entities returned by the store are snapshots; changing them has no effect
 * until they are passed through one of the update methods.
 */
public interface StateStore {

    // ------------------------------------------------------------------
    // Creation
    // ------------------------------------------------------------------

    /** Persist a new project together with its scenes. */
    Project createProject(Project project, List<Scene> scenes);

    // ------------------------------------------------------------------
    // Reads
    // ------------------------------------------------------------------

    Optional<Project> findProject(UUID projectId);

    Optional<Scene> findScene(UUID sceneId);

    Optional<Task> findTask(UUID taskId);

    /** Scenes of a project ordered by position. */
    List<Scene> scenesOf(UUID projectId);

    List<Task> tasksOf(UUID projectId);

    List<Task> tasksOfStageRun(UUID projectId, int stageRun);

    /** Tasks in any of the given statuses, oldest queued first. */
    List<Task> tasksInStatus(Collection<TaskStatus> statuses);

    List<StageTransitionRecord> transitionsOf(UUID projectId);

    default Project getProject(UUID projectId) {
        return findProject(projectId)
                .orElseThrow(() -> new NotFoundException("Project not found: " + projectId));
    }

    default Scene getScene(UUID sceneId) {
        return findScene(sceneId)
                .orElseThrow(() -> new NotFoundException("Scene not found: " + sceneId));
    }

    default Task getTask(UUID taskId) {
        return findTask(taskId)
                .orElseThrow(() -> new NotFoundException("Task not found: " + taskId));
    }

    // ------------------------------------------------------------------
    // Optimistic updates
    // ------------------------------------------------------------------

    /**
     * Apply a mutation to a project. Stage transitions queued on the project
     * by {@link Project#transitionTo} are appended to the audit trail in the
     * same write.
     */
    Project updateProject(UUID projectId, Consumer<Project> mutation);

    /**
     * Apply a mutation to a project and insert the tasks it returns, as one
     * write. Used when entering a generation stage so a project is never seen
     * in an in-progress stage without its tasks.
     */
    Project updateProjectWithTasks(UUID projectId, Function<Project, List<Task>> mutation);

    Scene updateScene(UUID sceneId, Consumer<Scene> mutation);

    Task updateTask(UUID taskId, Consumer<Task> mutation);
}
