package com.scenepilot.orchestrator.adapter;

import com.scenepilot.orchestrator.model.TaskKind;

import java.util.Optional;

/**
 * Narrow contract to one external generation provider (image, voice or video).
 *
 * Calls may block on the network; the executor only invokes them from its
 * worker pool. Every failure must surface as an {@link AdapterException} with a
 * {@link FailureClass}, or as a failed {@link PollResult}.
 */
public interface GenerationAdapter {

    /** The kind of task this adapter executes. One adapter per kind. */
    TaskKind kind();

    /**
     * Kind of asset the scene must already have before this adapter can run,
     * e.g. a video provider that animates the storyboard image. Opaque to the
     * orchestrator beyond the presence check.
     */
    default Optional<TaskKind> prerequisite() {
        return Optional.empty();
    }

    /**
     * Start a provider job.
     *
     * @return the provider's job id, used for every later poll and cancel
     * @throws AdapterException classified failure
     */
    String submit(SceneContext context);

    /** Ask the provider how the job is doing. */
    PollResult poll(String externalId);

    /** Best-effort cancellation of a provider job. */
    CancelResult cancel(String externalId);
}
