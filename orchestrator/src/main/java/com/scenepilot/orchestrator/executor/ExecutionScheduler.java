package com.scenepilot.orchestrator.executor;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Background loop that drives the task executor.
 *
 * The State Store is the queue: each tick reads queued and in-flight tasks and
 * hands the due ones to the worker pool, so a restarted process simply picks
 * up where the store says things are. fixedDelay waits for the previous tick
 * to finish before counting down to the next.
 */
@Component
@EnableScheduling
@ConditionalOnProperty(name = "scenepilot.executor.scheduling-enabled", havingValue = "true", matchIfMissing = true)
public class ExecutionScheduler {

    private final TaskExecutor executor;

    public ExecutionScheduler(TaskExecutor executor) {
        this.executor = executor;
    }

    @Scheduled(fixedDelayString = "${scenepilot.executor.tick-interval:1000}")
    public void tick() {
        executor.tick();
    }
}
