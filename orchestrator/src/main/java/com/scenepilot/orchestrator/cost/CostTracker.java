package com.scenepilot.orchestrator.cost;

import com.scenepilot.orchestrator.error.ValidationException;
import com.scenepilot.orchestrator.model.TaskKind;
import com.scenepilot.orchestrator.store.StateStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Accumulates provider-reported credits on the project. The running total
 * only ever grows; concurrent additions are serialized by the store's
 * optimistic update so none is lost.
 */
@Service
public class CostTracker {

    private static final Logger log = LoggerFactory.getLogger(CostTracker.class);

    private final StateStore    store;
    private final MeterRegistry meters;

    public CostTracker(StateStore store, MeterRegistry meters) {
        this.store  = store;
        this.meters = meters;
    }

    /**
     * Add credits spent on behalf of a project.
     *
     * @return the project's new total
     * @throws ValidationException if {@code credits} is null or negative
     */
    public BigDecimal recordCost(UUID projectId, BigDecimal credits, TaskKind kind) {
        if (credits == null || credits.signum() < 0) {
            throw new ValidationException("Cost increment must be a non-negative amount, got " + credits);
        }
        if (credits.signum() == 0) {
            return store.getProject(projectId).getCostCredits();
        }
        BigDecimal total = store.updateProject(projectId, p -> p.addCost(credits)).getCostCredits();
        Counter.builder("scenepilot.cost.credits")
                .tag("kind", kind.name().toLowerCase())
                .register(meters)
                .increment(credits.doubleValue());
        log.debug("Project {} cost +{} ({}) -> {}", projectId, credits, kind, total);
        return total;
    }
}
