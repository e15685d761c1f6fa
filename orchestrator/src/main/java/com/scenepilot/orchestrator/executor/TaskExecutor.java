package com.scenepilot.orchestrator.executor;

import com.scenepilot.orchestrator.adapter.AdapterException;
import com.scenepilot.orchestrator.adapter.AdapterRegistry;
import com.scenepilot.orchestrator.adapter.CancelResult;
import com.scenepilot.orchestrator.adapter.FailureClass;
import com.scenepilot.orchestrator.adapter.GenerationAdapter;
import com.scenepilot.orchestrator.adapter.PollResult;
import com.scenepilot.orchestrator.adapter.SceneContext;
import com.scenepilot.orchestrator.assets.AssetOrganizer;
import com.scenepilot.orchestrator.assets.StoredAsset;
import com.scenepilot.orchestrator.cost.CostTracker;
import com.scenepilot.orchestrator.error.StorageException;
import com.scenepilot.orchestrator.events.ProgressEvent;
import com.scenepilot.orchestrator.events.ProgressEventBus;
import com.scenepilot.orchestrator.model.ErrorClass;
import com.scenepilot.orchestrator.model.IllegalTaskTransitionException;
import com.scenepilot.orchestrator.model.Project;
import com.scenepilot.orchestrator.model.Scene;
import com.scenepilot.orchestrator.model.Task;
import com.scenepilot.orchestrator.model.TaskStatus;
import com.scenepilot.orchestrator.store.StateStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.BiFunction;

/**
 * Drives tasks through {@code Queued -> Submitted -> Running -> terminal}
 * against the generation adapters.
 *
 * Work is pulled from the State Store on every {@link #tick()}: due queued
 * tasks are submitted when their kind has a free slot, and submitted or
 * running tasks are polled once per poll interval. Every adapter call runs on
 * the worker pool, never on the scheduler thread, and at most one worker
 * handles a given task at a time.
 *
 * The executor owns no task state of its own beyond poll timing; whatever it
 * learns is written to the store and then published on the event bus. Task
 * status changes and their events are serialized per task so subscribers see
 * them in the order they were persisted.
 */
@Service
public class TaskExecutor {

    private static final Logger log = LoggerFactory.getLogger(TaskExecutor.class);

    private static final Set<TaskStatus> QUEUED = EnumSet.of(TaskStatus.QUEUED);

    private final StateStore         store;
    private final AdapterRegistry    adapters;
    private final ConcurrencyLimiter limiter;
    private final AssetOrganizer     assets;
    private final CostTracker        costs;
    private final ProgressEventBus   bus;
    private final ExecutorProperties props;
    private final RetryPolicy        retryPolicy;
    private final Executor           workers;
    private final Clock              clock;
    private final MeterRegistry      meters;

    // Tasks a worker is currently handling.
    private final Set<UUID> inFlight = ConcurrentHashMap.newKeySet();
    private final ConcurrentHashMap<UUID, Instant> nextPollAt = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<UUID, Object>  taskLocks  = new ConcurrentHashMap<>();
    private final AtomicBoolean recovered = new AtomicBoolean();

    public TaskExecutor(StateStore store,
                        AdapterRegistry adapters,
                        ConcurrencyLimiter limiter,
                        AssetOrganizer assets,
                        CostTracker costs,
                        ProgressEventBus bus,
                        ExecutorProperties props,
                        @Qualifier("taskWorkers") Executor workers,
                        Clock clock,
                        MeterRegistry meters) {
        this.store       = store;
        this.adapters    = adapters;
        this.limiter     = limiter;
        this.assets      = assets;
        this.costs       = costs;
        this.bus         = bus;
        this.props       = props;
        this.retryPolicy = RetryPolicy.from(props);
        this.workers     = workers;
        this.clock       = clock;
        this.meters      = meters;
    }

    // ------------------------------------------------------------------
    // Scheduling
    // ------------------------------------------------------------------

    /** One scheduling round. The first round also recovers tasks left in flight by a previous run. */
    public void tick() {
        if (recovered.compareAndSet(false, true)) {
            recoverInFlightTasks();
        }
        dispatchQueued();
        pollActive();
    }

    /**
     * Restart recovery. Tasks that were with a provider keep their slot and
     * are polled again by their persisted external id; they are never
     * submitted a second time.
     */
    public int recoverInFlightTasks() {
        List<Task> active = store.tasksInStatus(TaskStatus.ACTIVE);
        for (Task task : active) {
            limiter.reserve(task.getId(), task.getKind());
            nextPollAt.remove(task.getId());
        }
        if (!active.isEmpty()) {
            log.info("Recovered {} in-flight task(s); polling resumes by external id", active.size());
        }
        return active.size();
    }

    /**
     * Hand every due queued task whose kind has a free slot to a worker.
     * Kinds whose provider breaker is open keep their tasks queued.
     */
    public void dispatchQueued() {
        Instant now = clock.instant();
        for (Task task : store.tasksInStatus(QUEUED)) {
            if (!task.isDue(now) || inFlight.contains(task.getId())) {
                continue;
            }
            if (!limiter.tryAcquire(task.getId(), task.getKind())) {
                log.trace("No free {} slot for task {}", task.getKind(), task.getId());
                continue;
            }
            if (!adapters.permitSubmit(task.getKind())) {
                limiter.release(task.getId());
                log.trace("{} provider breaker is open; task {} stays queued", task.getKind(), task.getId());
                continue;
            }
            runOnWorker(task, () -> submitTask(task.getId()));
        }
    }

    /** Hand every submitted or running task that is due for a poll to a worker. */
    public void pollActive() {
        Instant now = clock.instant();
        for (Task task : store.tasksInStatus(TaskStatus.ACTIVE)) {
            Instant due = nextPollAt.get(task.getId());
            if (due != null && now.isBefore(due)) {
                continue;
            }
            runOnWorker(task, () -> pollTask(task.getId()));
        }
    }

    private void runOnWorker(Task task, Runnable work) {
        if (!inFlight.add(task.getId())) {
            return;
        }
        Runnable wrapped = () -> {
            MDC.put("projectId", task.getProjectId().toString());
            MDC.put("taskId",    task.getId().toString());
            MDC.put("kind",      task.getKind().name());
            MDC.put("attempt",   String.valueOf(task.getAttemptCount() + 1));
            try {
                work.run();
            } catch (RuntimeException e) {
                // The task row is untouched, so the next tick picks it up again.
                log.error("Unhandled error while handling task {}: {}", task.getId(), e.getMessage(), e);
            } finally {
                inFlight.remove(task.getId());
                MDC.clear();
            }
        };
        try {
            workers.execute(wrapped);
        } catch (RejectedExecutionException e) {
            inFlight.remove(task.getId());
            log.warn("Worker pool rejected task {}; will try again next tick", task.getId());
        }
    }

    // ------------------------------------------------------------------
    // Submit
    // ------------------------------------------------------------------

    /**
     * Submit a queued task to its adapter. The caller must already hold a
     * concurrency slot for it.
     */
    public void submitTask(UUID taskId) {
        Task task = store.getTask(taskId);
        if (task.getStatus() != TaskStatus.QUEUED) {
            if (task.isTerminal()) limiter.release(taskId);
            adapters.returnPermit(task.getKind());
            return;
        }
        Optional<GenerationAdapter> adapter = adapters.find(task.getKind());
        if (adapter.isEmpty()) {
            adapters.returnPermit(task.getKind());
            fail(taskId, ErrorClass.PERMANENT, "No adapter registered for " + task.getKind());
            return;
        }
        Scene scene = store.getScene(task.getSceneId());
        String prerequisiteRef = adapter.get().prerequisite().map(scene::assetRef).orElse(null);
        SceneContext context = new SceneContext(
                task.getProjectId(), scene.getId(), taskId, task.getKind(),
                scene.getPosition(), scene.getSourceText(), prerequisiteRef,
                task.getAttemptCount() + 1);

        String externalId;
        try {
            externalId = adapters.submit(task.getKind(), context);
        } catch (AdapterException e) {
            onSubmitFailure(task, e);
            return;
        }

        Instant now = clock.instant();
        try {
            transition(taskId, t -> t.markSubmitted(externalId, now), ProgressEvent::taskProgress);
            nextPollAt.put(taskId, now.plus(props.pollInterval()));
            log.info("Task {} ({}, scene {}) submitted as {}", taskId, task.getKind(), scene.getPosition(), externalId);
        } catch (IllegalTaskTransitionException e) {
            log.warn("Task {} was cancelled while being submitted; cancelling provider job {}", taskId, externalId);
            bestEffortCancel(task, externalId);
        }
    }

    private void onSubmitFailure(Task task, AdapterException e) {
        UUID taskId = task.getId();
        switch (e.getFailureClass()) {
            case RATE_LIMITED -> {
                Instant retryAt = clock.instant().plus(props.rateLimitDelay());
                discardIfTerminal(taskId, () -> {
                    store.updateTask(taskId, t -> t.deferSubmit(retryAt));
                    limiter.release(taskId);
                    countRetry(task, "rate_limited");
                    log.warn("Provider rate-limited task {}; staying queued until {}", taskId, retryAt);
                });
            }
            case TRANSIENT -> retryOrFail(taskId, ErrorClass.TRANSIENT, "Submit failed: " + e.getMessage());
            case PERMANENT -> fail(taskId, ErrorClass.PERMANENT, "Submit rejected: " + e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Poll
    // ------------------------------------------------------------------

    public void pollTask(UUID taskId) {
        Task task = store.getTask(taskId);
        if (!TaskStatus.ACTIVE.contains(task.getStatus())) {
            return;
        }
        Instant now = clock.instant();
        nextPollAt.put(taskId, now.plus(props.pollInterval()));

        Duration budget = props.limits(task.getKind()).timeout();
        if (task.getSubmittedAt() != null && Duration.between(task.getSubmittedAt(), now).compareTo(budget) > 0) {
            log.warn("Task {} exceeded its {} budget of {}", taskId, task.getKind(), budget);
            bestEffortCancel(task, task.getExternalRef());
            retryOrFail(taskId, ErrorClass.TIMEOUT, "Timed out after " + budget);
            return;
        }

        PollResult result;
        try {
            result = adapters.poll(task.getKind(), task.getExternalRef());
        } catch (AdapterException e) {
            if (e.getFailureClass() == FailureClass.PERMANENT) {
                fail(taskId, ErrorClass.PERMANENT, "Poll rejected: " + e.getMessage());
            } else {
                // The job itself may be fine; the timeout bounds how long we keep asking.
                log.warn("Poll of task {} failed ({}): {}; polling again later",
                        taskId, e.getFailureClass(), e.getMessage());
            }
            return;
        }

        switch (result.outcome()) {
            case STILL_RUNNING    -> discardIfTerminal(taskId, () ->
                    transition(taskId, t -> t.markRunning(result.percent()), ProgressEvent::taskProgress));
            case SUCCEEDED        -> onSucceeded(task, result);
            case FAILED_TRANSIENT -> retryOrFail(taskId, ErrorClass.TRANSIENT, result.reason());
            case FAILED_PERMANENT -> fail(taskId, ErrorClass.PERMANENT, result.reason());
        }
    }

    /**
     * Persist the output, attach it to the scene, then mark the task
     * succeeded. Runs under the task's lock, which {@link #cancelStage} also
     * takes, so a task cancelled before this point leaves no file, manifest
     * entry or scene reference behind, and a task seen SUCCEEDED always has
     * its asset on the scene.
     *
     * If the output cannot be stored the task fails with
     * {@link ErrorClass#STORAGE}; the provider still billed for it, so the
     * cost is recorded either way.
     */
    private void onSucceeded(Task task, PollResult result) {
        UUID taskId = task.getId();
        synchronized (lockFor(taskId)) {
            Task current = store.getTask(taskId);
            if (current.isTerminal()) {
                limiter.release(taskId);
                nextPollAt.remove(taskId);
                log.warn("Discarding result {} of task {}: already {}",
                        result.outputRef(), taskId, current.getStatus());
                return;
            }
            Scene scene = store.getScene(task.getSceneId());

            StoredAsset stored;
            try {
                stored = storeWithRetry(scene, task, result.outputRef());
            } catch (StorageException e) {
                costs.recordCost(task.getProjectId(), result.costCredits(), task.getKind());
                fail(taskId, ErrorClass.STORAGE, e.getMessage());
                return;
            }

            store.updateScene(scene.getId(), s -> s.attachAsset(task.getKind(), stored.path()));
            costs.recordCost(task.getProjectId(), result.costCredits(), task.getKind());
            Instant now = clock.instant();
            transition(taskId, t -> t.markSucceeded(result.costCredits(), now), ProgressEvent::taskTerminal);
        }
    }

    private StoredAsset storeWithRetry(Scene scene, Task task, String outputRef) {
        StorageException last = null;
        for (int attempt = 1; attempt <= props.storageAttempts(); attempt++) {
            try {
                return assets.store(scene, task.getKind(), outputRef, task.getId());
            } catch (StorageException e) {
                last = e;
                log.warn("Storing output of task {} failed (attempt {}/{}): {}",
                        task.getId(), attempt, props.storageAttempts(), e.getMessage());
            }
        }
        throw last;
    }

    // ------------------------------------------------------------------
    // Failures
    // ------------------------------------------------------------------

    /**
     * Count a retryable failure. The task goes back to the queue with a
     * backoff delay, or fails once the attempt budget is spent.
     */
    private void retryOrFail(UUID taskId, ErrorClass errorClass, String reason) {
        Instant now = clock.instant();
        discardIfTerminal(taskId, () -> transition(taskId,
                t -> t.recordTransientFailure(errorClass, reason, props.maxAttempts(),
                        failures -> now.plus(retryPolicy.delayFor(failures)), now),
                (updated, at) -> {
                    if (updated.isTerminal()) {
                        return ProgressEvent.taskTerminal(updated, at);
                    }
                    Duration delay = Duration.between(now, updated.getNextAttemptAt());
                    countRetry(updated, errorClass.name().toLowerCase());
                    log.warn("Task {} failed ({}: {}); retry {}/{} in {} ms",
                            taskId, errorClass, reason, updated.getAttemptCount() + 1,
                            props.maxAttempts(), delay.toMillis());
                    return ProgressEvent.taskRetryScheduled(updated, delay, at);
                }));
    }

    private void fail(UUID taskId, ErrorClass errorClass, String reason) {
        Instant now = clock.instant();
        discardIfTerminal(taskId, () ->
                transition(taskId, t -> t.markFailed(errorClass, reason, now), ProgressEvent::taskTerminal));
    }

    // ------------------------------------------------------------------
    // Cancellation
    // ------------------------------------------------------------------

    /**
     * Cancel every non-terminal task of the project's current stage run.
     * Provider jobs are cancelled best-effort on the worker pool; results that
     * arrive later are discarded.
     *
     * @return number of tasks cancelled
     */
    public int cancelStage(UUID projectId) {
        Project project = store.getProject(projectId);
        int cancelled = 0;
        for (Task task : store.tasksOfStageRun(projectId, project.getStageRun())) {
            if (task.isTerminal()) {
                continue;
            }
            Instant now = clock.instant();
            try {
                Task updated = transition(task.getId(), t -> t.markCancelled(now), ProgressEvent::taskTerminal);
                cancelled++;
                if (updated.getExternalRef() != null) {
                    workers.execute(() -> bestEffortCancel(updated, updated.getExternalRef()));
                }
            } catch (IllegalTaskTransitionException e) {
                log.debug("Task {} finished before it could be cancelled", task.getId());
            }
        }
        log.info("Cancelled {} task(s) of project {} stage {} (run {})",
                cancelled, projectId, project.getStage(), project.getStageRun());
        return cancelled;
    }

    private void bestEffortCancel(Task task, String externalId) {
        if (externalId == null) return;
        try {
            CancelResult result = adapters.cancel(task.getKind(), externalId);
            if (result == CancelResult.UNSUPPORTED) {
                log.warn("Provider cannot cancel job {} of task {}; its result will be discarded",
                        externalId, task.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Cancelling provider job {} of task {} failed: {}", externalId, task.getId(), e.getMessage());
        }
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    /**
     * Persist a task mutation and publish the event built from the result,
     * both under the task's lock. Reaching a terminal status frees the slot.
     */
    private Task transition(UUID taskId, Consumer<Task> mutation, BiFunction<Task, Instant, ProgressEvent> event) {
        synchronized (lockFor(taskId)) {
            Task updated = store.updateTask(taskId, mutation);
            if (updated.isTerminal() || updated.getStatus() == TaskStatus.QUEUED) {
                limiter.release(taskId);
                nextPollAt.remove(taskId);
            }
            ProgressEvent e = event.apply(updated, clock.instant());
            if (updated.isTerminal()) {
                taskLocks.remove(taskId);
                logTerminal(updated);
                meters.counter("scenepilot.task.terminal",
                        "kind", updated.getKind().name().toLowerCase(),
                        "status", updated.getStatus().name().toLowerCase()).increment();
            }
            bus.publish(e);
            return updated;
        }
    }

    private Object lockFor(UUID taskId) {
        return taskLocks.computeIfAbsent(taskId, k -> new Object());
    }

    /** Run a task update, dropping it if the task reached a terminal status in the meantime. */
    private void discardIfTerminal(UUID taskId, Runnable update) {
        try {
            update.run();
        } catch (IllegalTaskTransitionException e) {
            limiter.release(taskId);
            nextPollAt.remove(taskId);
            log.warn("Discarding late result for task {}: already {}", taskId, e.getFrom());
        }
    }

    private void logTerminal(Task task) {
        switch (task.getStatus()) {
            case SUCCEEDED -> log.info("Task {} ({}) succeeded after {} failed attempt(s), cost {}",
                    task.getId(), task.getKind(), task.getAttemptCount(), task.getCostCredits());
            case FAILED    -> log.error("Task {} ({}) failed permanently after {} attempt(s): {} {}",
                    task.getId(), task.getKind(), task.getAttemptCount(),
                    task.getLastErrorClass(), task.getLastError());
            default        -> log.info("Task {} ({}) {}", task.getId(), task.getKind(), task.getStatus());
        }
    }

    private void countRetry(Task task, String reason) {
        meters.counter("scenepilot.task.retries",
                "kind", task.getKind().name().toLowerCase(), "reason", reason).increment();
    }
}
