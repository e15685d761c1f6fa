package com.scenepilot.orchestrator.repository;

import com.scenepilot.orchestrator.model.Task;
import com.scenepilot.orchestrator.model.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

/**
 * CRUD + executor queries for the tasks table.
 */
public interface TaskRepository extends JpaRepository<Task, UUID> {

    /** Work lists for the dispatcher and the poller, oldest first. */
    List<Task> findByStatusInOrderByQueuedAtAsc(Collection<TaskStatus> statuses);

    List<Task> findByProjectIdOrderByQueuedAtAsc(UUID projectId);

    /** All tasks created by one advance() into a generation stage. */
    List<Task> findByProjectIdAndStageRunOrderByQueuedAtAsc(UUID projectId, int stageRun);
}
