package com.scenepilot.orchestrator.executor;

import com.scenepilot.orchestrator.model.TaskKind;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Per-kind counting limit on tasks that are with a provider.
 *
 * Slots are held by task id, so acquiring twice for the same task or
 * releasing a task that holds nothing is harmless. A slot is taken before
 * submit and given back when the task reaches a terminal status or goes back
 * to the queue for a retry.
 */
@Component
public class ConcurrencyLimiter {

    private final ExecutorProperties props;

    private final Map<UUID, TaskKind> holders = new HashMap<>();
    private final Map<TaskKind, Integer> inUse = new EnumMap<>(TaskKind.class);

    public ConcurrencyLimiter(ExecutorProperties props, MeterRegistry meters) {
        this.props = props;
        for (TaskKind kind : TaskKind.values()) {
            inUse.put(kind, 0);
            Gauge.builder("scenepilot.executor.slots.in_use", this, l -> l.inUse(kind))
                    .tag("kind", kind.name().toLowerCase())
                    .register(meters);
        }
    }

    /** @return true if the task now holds a slot of its kind */
    public synchronized boolean tryAcquire(UUID taskId, TaskKind kind) {
        if (holders.containsKey(taskId)) {
            return true;
        }
        if (inUse.get(kind) >= limit(kind)) {
            return false;
        }
        take(taskId, kind);
        return true;
    }

    /**
     * Take a slot regardless of the limit. Used on startup for tasks that were
     * already with the provider before the restart.
     */
    public synchronized void reserve(UUID taskId, TaskKind kind) {
        if (!holders.containsKey(taskId)) {
            take(taskId, kind);
        }
    }

    public synchronized void release(UUID taskId) {
        TaskKind kind = holders.remove(taskId);
        if (kind != null) {
            inUse.merge(kind, -1, Integer::sum);
        }
    }

    public synchronized int inUse(TaskKind kind) {
        return inUse.get(kind);
    }

    public synchronized boolean holds(UUID taskId) {
        return holders.containsKey(taskId);
    }

    public int limit(TaskKind kind) {
        return props.limits(kind).concurrency();
    }

    private void take(UUID taskId, TaskKind kind) {
        holders.put(taskId, kind);
        inUse.merge(kind, 1, Integer::sum);
    }
}
