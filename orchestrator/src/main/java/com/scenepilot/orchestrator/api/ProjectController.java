package com.scenepilot.orchestrator.api;

import com.scenepilot.orchestrator.api.dto.CreateProjectRequest;
import com.scenepilot.orchestrator.api.dto.ProjectResponse;
import com.scenepilot.orchestrator.api.dto.ResetRequest;
import com.scenepilot.orchestrator.api.dto.SceneResponse;
import com.scenepilot.orchestrator.api.dto.TaskResponse;
import com.scenepilot.orchestrator.api.dto.TransitionResponse;
import com.scenepilot.orchestrator.executor.TaskExecutor;
import com.scenepilot.orchestrator.model.Project;
import com.scenepilot.orchestrator.orchestration.ScriptIngestionService;
import com.scenepilot.orchestrator.orchestration.StageOrchestrator;
import com.scenepilot.orchestrator.orchestration.StageReport;
import com.scenepilot.orchestrator.store.StateStore;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * REST API for projects and their stages.
 *
 * POST /projects                      create a project from a script
 * GET  /projects/{id}                 current stage and cost
 * GET  /projects/{id}/scenes|tasks|transitions|stage
 * POST /projects/{id}/advance         start the next stage
 * POST /projects/{id}/force-advance   complete a blocked stage, degrading failed scenes
 * POST /projects/{id}/reset           roll back to an earlier stable stage
 * POST /projects/{id}/cancel          cancel the tasks of the current stage
 * GET  /projects/{id}/events          SSE progress stream
 * GET  /tasks/{id}/events             SSE progress stream of one task
 */
@RestController
public class ProjectController {

    private final ScriptIngestionService ingestion;
    private final StageOrchestrator      orchestrator;
    private final TaskExecutor           executor;
    private final StateStore             store;
    private final ProgressStreamService  streams;

    public ProjectController(ScriptIngestionService ingestion,
                             StageOrchestrator orchestrator,
                             TaskExecutor executor,
                             StateStore store,
                             ProgressStreamService streams) {
        this.ingestion    = ingestion;
        this.orchestrator = orchestrator;
        this.executor     = executor;
        this.store        = store;
        this.streams      = streams;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/projects \
     *     -H "Content-Type: application/json" \
     *     -d '{"name":"demo","script":"A lighthouse at dusk.\n\nWaves crash below."}'
     */
    @PostMapping("/projects")
    public ResponseEntity<ProjectResponse> create(@Valid @RequestBody CreateProjectRequest req) {
        Project project = ingestion.ingest(req.name(), req.script(), req.scenes());
        return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(project));
    }

    @GetMapping("/projects/{id}")
    public ProjectResponse get(@PathVariable UUID id) {
        return ProjectResponse.from(store.getProject(id));
    }

    @GetMapping("/projects/{id}/scenes")
    public List<SceneResponse> scenes(@PathVariable UUID id) {
        store.getProject(id);
        return store.scenesOf(id).stream().map(SceneResponse::from).toList();
    }

    @GetMapping("/projects/{id}/tasks")
    public List<TaskResponse> tasks(@PathVariable UUID id) {
        store.getProject(id);
        return store.tasksOf(id).stream().map(TaskResponse::from).toList();
    }

    @GetMapping("/projects/{id}/transitions")
    public List<TransitionResponse> transitions(@PathVariable UUID id) {
        store.getProject(id);
        return store.transitionsOf(id).stream().map(TransitionResponse::from).toList();
    }

    @GetMapping("/projects/{id}/stage")
    public StageReport stage(@PathVariable UUID id) {
        return orchestrator.stageReport(id);
    }

    @PostMapping("/projects/{id}/advance")
    public ProjectResponse advance(@PathVariable UUID id) {
        return ProjectResponse.from(orchestrator.advance(id));
    }

    @PostMapping("/projects/{id}/force-advance")
    public ProjectResponse forceAdvance(@PathVariable UUID id) {
        return ProjectResponse.from(orchestrator.forceAdvance(id));
    }

    @PostMapping("/projects/{id}/reset")
    public ProjectResponse reset(@PathVariable UUID id, @Valid @RequestBody ResetRequest req) {
        return ProjectResponse.from(orchestrator.reset(id, req.toStage()));
    }

    @PostMapping("/projects/{id}/cancel")
    public Map<String, Object> cancel(@PathVariable UUID id) {
        int cancelled = executor.cancelStage(id);
        return Map.of("projectId", id, "cancelled", cancelled);
    }

    @GetMapping(path = "/projects/{id}/events", produces = "text/event-stream")
    public SseEmitter projectEvents(@PathVariable UUID id) {
        store.getProject(id);
        return streams.createEmitter(id);
    }

    @GetMapping(path = "/tasks/{id}/events", produces = "text/event-stream")
    public SseEmitter taskEvents(@PathVariable UUID id) {
        store.getTask(id);
        return streams.createEmitter(id);
    }
}
