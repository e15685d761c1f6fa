package com.scenepilot.orchestrator.orchestration;

import com.scenepilot.orchestrator.adapter.AdapterRegistry;
import com.scenepilot.orchestrator.adapter.GenerationAdapter;
import com.scenepilot.orchestrator.assets.AssetOrganizer;
import com.scenepilot.orchestrator.assets.ExportAssembler;
import com.scenepilot.orchestrator.error.InvalidTransitionException;
import com.scenepilot.orchestrator.error.TasksInFlightException;
import com.scenepilot.orchestrator.error.ValidationException;
import com.scenepilot.orchestrator.events.EventType;
import com.scenepilot.orchestrator.events.ProgressEvent;
import com.scenepilot.orchestrator.events.ProgressEventBus;
import com.scenepilot.orchestrator.model.*;
import com.scenepilot.orchestrator.store.StateStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Moves projects through the production stages.
 *
 * A generation stage starts with one task per scene and completes when every
 * one of them has succeeded. If any ends otherwise, the project stays in the
 * in-progress stage with a failure summary until {@link #forceAdvance} marks
 * the affected scenes degraded, or {@link #reset} rolls the project back.
 *
 * The orchestrator learns about task completion only from TASK_TERMINAL
 * events; it never changes task state itself. Every stage change is a
 * read-modify-write of the project record guarded by the stage (and stage
 * run) it was decided on, so two concurrent evaluations cannot both apply.
 */
@Service
public class StageOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(StageOrchestrator.class);

    private final StateStore       store;
    private final AdapterRegistry  adapters;
    private final ProgressEventBus bus;
    private final AssetOrganizer   assets;
    private final ExportAssembler  assembler;
    private final Executor         workers;
    private final Clock            clock;

    private ProgressEventBus.Subscription subscription;

    public StageOrchestrator(StateStore store,
                             AdapterRegistry adapters,
                             ProgressEventBus bus,
                             AssetOrganizer assets,
                             ExportAssembler assembler,
                             @Qualifier("taskWorkers") Executor workers,
                             Clock clock) {
        this.store     = store;
        this.adapters  = adapters;
        this.bus       = bus;
        this.assets    = assets;
        this.assembler = assembler;
        this.workers   = workers;
        this.clock     = clock;
    }

    @PostConstruct
    public void subscribe() {
        subscription = bus.subscribeAll(event -> {
            if (event.type() == EventType.TASK_TERMINAL) {
                onTaskTerminal(event.taskId());
            }
        });
    }

    @PreDestroy
    public void unsubscribe() {
        if (subscription != null) subscription.unsubscribe();
    }

    // ------------------------------------------------------------------
    // advance
    // ------------------------------------------------------------------

    /**
     * Start the next stage.
     *
     * @throws InvalidTransitionException if the project is in progress, failed or exported
     * @throws ValidationException        if the stage cannot run (no scenes, no adapter)
     */
    public Project advance(UUID projectId) {
        Project project = store.getProject(projectId);
        ProjectStage from = project.getStage();
        ProjectStage to = from.advanceTarget().orElseThrow(() -> new InvalidTransitionException(
                "Cannot advance project " + projectId + " from " + from
                        + (from.isInProgress() ? " while the stage is in progress" : "")));

        if (to == ProjectStage.SCRIPT_ANALYZED) {
            return analyzeScript(projectId);
        }
        if (to == ProjectStage.ASSEMBLING) {
            return startAssembly(projectId);
        }
        return startGenerationStage(projectId, from, to);
    }

    private Project analyzeScript(UUID projectId) {
        List<Scene> scenes = store.scenesOf(projectId);
        if (scenes.isEmpty() || scenes.stream().anyMatch(s -> s.getSourceText() == null || s.getSourceText().isBlank())) {
            throw new ValidationException("Project " + projectId + " needs at least one scene and no blank scenes");
        }
        return move(projectId, ProjectStage.DRAFT, ProjectStage.SCRIPT_ANALYZED, TransitionActor.SYSTEM,
                scenes.size() + " scene(s) analyzed");
    }

    private Project startGenerationStage(UUID projectId, ProjectStage from, ProjectStage to) {
        TaskKind kind = to.taskKind().orElseThrow();
        GenerationAdapter adapter = adapters.get(kind);
        Optional<TaskKind> prerequisite = adapter.prerequisite();
        List<Scene> scenes = store.scenesOf(projectId);
        if (scenes.isEmpty()) {
            throw new ValidationException("Project " + projectId + " has no scenes");
        }

        List<Task> created = new ArrayList<>();
        Project updated = store.updateProjectWithTasks(projectId, p -> {
            requireStage(p, from);
            p.transitionTo(to, TransitionActor.SYSTEM, "advance");
            Instant now = clock.instant();
            created.clear();
            for (Scene scene : scenes) {
                Task task = new Task(projectId, scene.getId(), kind, p.getStageRun(), now);
                if (prerequisite.isPresent() && !scene.hasAsset(prerequisite.get())) {
                    task.markFailed(ErrorClass.PREREQUISITE_MISSING,
                            "Scene has no " + prerequisite.get().manifestKey() + " asset", now);
                }
                created.add(task);
            }
            return List.copyOf(created);
        });

        log.info("Project {} {} -> {} (run {}): {} {} task(s) queued",
                projectId, from, to, updated.getStageRun(), created.size(), kind);
        bus.publish(ProgressEvent.stageTransition(projectId, from, to, TransitionActor.SYSTEM, clock.instant()));

        // Tasks created failed never pass through the executor.
        for (Task task : created) {
            if (task.isTerminal()) {
                log.warn("Task {} for scene {} failed up front: {}", task.getId(), task.getSceneId(), task.getLastError());
                bus.publish(ProgressEvent.taskTerminal(task, clock.instant()));
            }
        }
        return updated;
    }

    private Project startAssembly(UUID projectId) {
        Project updated = move(projectId, ProjectStage.VIDEO_READY, ProjectStage.ASSEMBLING,
                TransitionActor.SYSTEM, "advance");
        workers.execute(() -> assemble(projectId));
        return updated;
    }

    void assemble(UUID projectId) {
        MDC.put("projectId", projectId.toString());
        try {
            Project project = store.getProject(projectId);
            if (project.getStage() != ProjectStage.ASSEMBLING) {
                log.info("Project {} left ASSEMBLING before export started; skipping", projectId);
                return;
            }
            String exportPath = assembler.assemble(project, store.scenesOf(projectId));
            finishAssembly(projectId, ProjectStage.EXPORTED, "export written to " + exportPath);
        } catch (RuntimeException e) {
            log.error("Assembly of project {} failed: {}", projectId, e.getMessage(), e);
            finishAssembly(projectId, ProjectStage.FAILED, "assembly failed: " + e.getMessage());
        } finally {
            MDC.remove("projectId");
        }
    }

    private void finishAssembly(UUID projectId, ProjectStage to, String reason) {
        try {
            move(projectId, ProjectStage.ASSEMBLING, to, TransitionActor.SYSTEM, reason);
        } catch (InvalidTransitionException e) {
            log.warn("Dropping assembly result for project {}: {}", projectId, e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Task completion
    // ------------------------------------------------------------------

    /**
     * Re-evaluate the stage a terminal task belongs to. Completes the stage
     * when all its tasks succeeded; surfaces a failure summary when all are
     * terminal but some did not.
     */
    public void onTaskTerminal(UUID taskId) {
        Optional<Task> task = store.findTask(taskId);
        if (task.isEmpty()) {
            log.warn("Terminal event for unknown task {}", taskId);
            return;
        }
        evaluateStage(task.get().getProjectId(), task.get().getStageRun());
    }

    void evaluateStage(UUID projectId, int stageRun) {
        Project project = store.getProject(projectId);
        ProjectStage stage = project.getStage();
        if (stage.taskKind().isEmpty() || project.getStageRun() != stageRun) {
            return;
        }
        List<Task> tasks = store.tasksOfStageRun(projectId, stageRun);
        if (tasks.isEmpty() || tasks.stream().anyMatch(t -> !t.isTerminal())) {
            return;
        }

        if (tasks.stream().allMatch(t -> t.getStatus() == TaskStatus.SUCCEEDED)) {
            ProjectStage ready = stage.completedStage();
            try {
                store.updateProject(projectId, p -> {
                    requireRun(p, stage, stageRun);
                    p.transitionTo(ready, TransitionActor.SYSTEM, "all " + tasks.size() + " task(s) succeeded");
                });
            } catch (InvalidTransitionException e) {
                log.debug("Stage of project {} already moved on: {}", projectId, e.getMessage());
                return;
            }
            log.info("Project {} {} -> {}", projectId, stage, ready);
            bus.publish(ProgressEvent.stageTransition(projectId, stage, ready, TransitionActor.SYSTEM, clock.instant()));
            return;
        }

        String summary = String.join("; ", failureLines(tasks, sceneNumbers(projectId)));
        if (summary.equals(project.getBlockedSummary())) {
            return;
        }
        try {
            store.updateProject(projectId, p -> {
                requireRun(p, stage, stageRun);
                p.setBlockedSummary(summary);
            });
        } catch (InvalidTransitionException e) {
            log.debug("Stage of project {} already moved on: {}", projectId, e.getMessage());
            return;
        }
        log.warn("Project {} blocked in {}: {}", projectId, stage, summary);
        bus.publish(ProgressEvent.stageBlocked(projectId, stage, summary, clock.instant()));
    }

    // ------------------------------------------------------------------
    // Overrides
    // ------------------------------------------------------------------

    /**
     * Complete a blocked generation stage anyway. Scenes whose task did not
     * succeed are marked degraded for the stage's kind, in the store and in
     * their manifests.
     *
     * @throws InvalidTransitionException if no generation stage is in progress
     * @throws TasksInFlightException     if a task of the stage is still running
     */
    public Project forceAdvance(UUID projectId) {
        Project project = store.getProject(projectId);
        ProjectStage stage = project.getStage();
        TaskKind kind = stage.taskKind().orElseThrow(() -> new InvalidTransitionException(
                "forceAdvance needs a generation stage in progress; project " + projectId + " is " + stage));
        int run = project.getStageRun();

        List<Task> tasks = store.tasksOfStageRun(projectId, run);
        long open = tasks.stream().filter(t -> !t.isTerminal()).count();
        if (open > 0) {
            throw new TasksInFlightException(open + " task(s) of " + stage + " are still running");
        }

        Set<UUID> succeeded = tasks.stream()
                .filter(t -> t.getStatus() == TaskStatus.SUCCEEDED)
                .map(Task::getSceneId)
                .collect(Collectors.toSet());
        List<Integer> degraded = new ArrayList<>();
        for (Scene scene : store.scenesOf(projectId)) {
            if (succeeded.contains(scene.getId())) {
                continue;
            }
            Scene updated = store.updateScene(scene.getId(), s -> s.markDegraded(kind));
            assets.recordDegraded(updated);
            degraded.add(scene.getPosition());
        }

        ProjectStage ready = stage.completedStage();
        String reason = degraded.isEmpty()
                ? "forced"
                : "forced; scene(s) " + degraded + " degraded for " + kind.manifestKey();
        Project updated = store.updateProject(projectId, p -> {
            requireRun(p, stage, run);
            p.transitionTo(ready, TransitionActor.OVERRIDE, reason);
        });
        log.warn("Project {} forced {} -> {}; degraded scenes {}", projectId, stage, ready, degraded);
        bus.publish(ProgressEvent.stageTransition(projectId, stage, ready, TransitionActor.OVERRIDE, clock.instant()));
        return updated;
    }

    /**
     * Roll the project back to an earlier stable stage so later stages can
     * run again. Degraded flags of the stages that will re-run are cleared;
     * assets already produced are kept.
     *
     * @throws ValidationException        if {@code toStage} is not a stable stage
     * @throws InvalidTransitionException if {@code toStage} lies ahead of the project
     * @throws TasksInFlightException     if any task of the project is not terminal
     */
    public Project reset(UUID projectId, ProjectStage toStage) {
        if (toStage == null || !toStage.isStable()) {
            throw new ValidationException("Reset target must be a stable stage, got " + toStage);
        }
        Project project = store.getProject(projectId);
        long open = store.tasksOf(projectId).stream().filter(t -> !t.isTerminal()).count();
        if (open > 0) {
            throw new TasksInFlightException(open + " task(s) of project " + projectId + " are not terminal");
        }
        ProjectStage from = project.getStage();
        if (from != ProjectStage.FAILED && toStage.ordinal() > from.ordinal()) {
            throw new InvalidTransitionException("Cannot reset project " + projectId + " forward from " + from + " to " + toStage);
        }

        Set<TaskKind> rerun = EnumSet.noneOf(TaskKind.class);
        for (TaskKind kind : TaskKind.values()) {
            if (ProjectStage.producing(kind).ordinal() > toStage.ordinal()) {
                rerun.add(kind);
            }
        }
        for (Scene scene : store.scenesOf(projectId)) {
            if (scene.getDegradedKinds().stream().anyMatch(rerun::contains)) {
                Scene updated = store.updateScene(scene.getId(), s -> s.clearDegraded(rerun));
                assets.recordDegraded(updated);
            }
        }

        Project updated = move(projectId, from, toStage, TransitionActor.OVERRIDE, "reset from " + from);
        log.info("Project {} reset {} -> {}", projectId, from, toStage);
        return updated;
    }

    // ------------------------------------------------------------------
    // Reporting
    // ------------------------------------------------------------------

    public StageReport stageReport(UUID projectId) {
        Project project = store.getProject(projectId);
        List<Task> tasks = store.tasksOfStageRun(projectId, project.getStageRun());
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        tasks.forEach(t -> counts.merge(t.getStatus(), 1, Integer::sum));
        List<String> failures = project.getStage().taskKind().isPresent()
                ? failureLines(tasks, sceneNumbers(projectId))
                : List.of();
        return new StageReport(projectId, project.getStage(), project.getStageRun(),
                counts, project.isBlocked(), failures, project.getCostCredits());
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private Project move(UUID projectId, ProjectStage expected, ProjectStage to,
                         TransitionActor actor, String reason) {
        Project updated = store.updateProject(projectId, p -> {
            requireStage(p, expected);
            p.transitionTo(to, actor, reason);
        });
        log.info("Project {} {} -> {} ({}: {})", projectId, expected, to, actor, reason);
        bus.publish(ProgressEvent.stageTransition(projectId, expected, to, actor, clock.instant()));
        return updated;
    }

    private static void requireStage(Project p, ProjectStage expected) {
        if (p.getStage() != expected) {
            throw new InvalidTransitionException(
                    "Project " + p.getId() + " moved from " + expected + " to " + p.getStage() + " concurrently");
        }
    }

    private static void requireRun(Project p, ProjectStage expected, int run) {
        requireStage(p, expected);
        if (p.getStageRun() != run) {
            throw new InvalidTransitionException("Project " + p.getId() + " started stage run "
                    + p.getStageRun() + " while run " + run + " was evaluated");
        }
    }

    private Map<UUID, Integer> sceneNumbers(UUID projectId) {
        return store.scenesOf(projectId).stream()
                .collect(Collectors.toMap(Scene::getId, Scene::getPosition));
    }

    private static List<String> failureLines(List<Task> tasks, Map<UUID, Integer> positions) {
        Function<Task, Integer> position = t -> positions.getOrDefault(t.getSceneId(), 0);
        return tasks.stream()
                .filter(t -> t.getStatus() == TaskStatus.FAILED || t.getStatus() == TaskStatus.CANCELLED)
                .sorted((a, b) -> Integer.compare(position.apply(a), position.apply(b)))
                .map(t -> "scene " + position.apply(t) + " " + t.getKind().manifestKey() + ": "
                        + t.getStatus() + (t.getLastErrorClass() == null ? "" : " " + t.getLastErrorClass())
                        + (t.getLastError() == null ? "" : " (" + t.getLastError() + ")"))
                .toList();
    }
}
