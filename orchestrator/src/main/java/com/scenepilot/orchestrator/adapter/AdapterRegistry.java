package com.scenepilot.orchestrator.adapter;

import com.scenepilot.orchestrator.error.ValidationException;
import com.scenepilot.orchestrator.model.TaskKind;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * In-process registry of generation adapters, one per task kind.
 *
 * <p>All {@link GenerationAdapter} beans are collected at startup. Besides lookup, the registry is the single place that
 * calls adapters, so every submit / poll / cancel is timed and counted:
 * <pre>
 *   scenepilot.adapter.calls{kind, op="submit|poll|cancel", outcome="ok|transient|permanent|rate_limited|error"}
 * </pre>
 * Submit and poll outcomes also feed the per-kind {@link ProviderCircuitBreaker}.
 */
@Component
public class AdapterRegistry {

    private static final Logger log = LoggerFactory.getLogger(AdapterRegistry.class);

    private final Map<TaskKind, GenerationAdapter> adapters = new EnumMap<>(TaskKind.class);
    private final ProviderCircuitBreaker breaker;
    private final MeterRegistry meterRegistry;

    /**
     * Spring passes every adapter bean here. Having none at all is allowed:
     * advancing into a stage without an adapter is then a validation error.
     */
    @Autowired
    public AdapterRegistry(ObjectProvider<GenerationAdapter> adapterBeans,
                           ProviderCircuitBreaker breaker,
                           MeterRegistry meterRegistry) {
        this(adapterBeans.orderedStream().toList(), breaker, meterRegistry);
    }

    public AdapterRegistry(List<GenerationAdapter> allAdapters,
                           ProviderCircuitBreaker breaker,
                           MeterRegistry meterRegistry) {
        this.breaker       = breaker;
        this.meterRegistry = meterRegistry;
        for (GenerationAdapter adapter : allAdapters) {
            GenerationAdapter previous = adapters.putIfAbsent(adapter.kind(), adapter);
            if (previous != null) {
                throw new IllegalStateException("Two adapters registered for " + adapter.kind() + ": "
                        + previous.getClass().getSimpleName() + " and " + adapter.getClass().getSimpleName());
            }
            log.info("Registered {} adapter {} (prerequisite={})",
                    adapter.kind(), adapter.getClass().getSimpleName(),
                    adapter.prerequisite().map(Enum::name).orElse("none"));
        }
    }

    // ------------------------------------------------------------------
    // Lookup
    // ------------------------------------------------------------------

    public Optional<GenerationAdapter> find(TaskKind kind) {
        return Optional.ofNullable(adapters.get(kind));
    }

    /** @throws ValidationException if no adapter handles the kind */
    public GenerationAdapter get(TaskKind kind) {
        return find(kind).orElseThrow(() ->
                new ValidationException("No generation adapter registered for " + kind));
    }

    public Set<TaskKind> kinds() {
        return adapters.keySet();
    }

    // ------------------------------------------------------------------
    // Circuit breaker
    // ------------------------------------------------------------------

    /** Whether a new task of the kind may be submitted now. See {@link ProviderCircuitBreaker}. */
    public boolean permitSubmit(TaskKind kind) {
        return breaker.tryAcquirePermission(kind);
    }

    /** Hand back a submit permission that was not used for a provider call. */
    public void returnPermit(TaskKind kind) {
        breaker.recordNeutral(kind);
    }

    // ------------------------------------------------------------------
    // Instrumented calls
    // ------------------------------------------------------------------

    public String submit(TaskKind kind, SceneContext context) {
        GenerationAdapter adapter = get(kind);
        return instrumented(kind, "submit", () -> adapter.submit(context), id -> true);
    }

    public PollResult poll(TaskKind kind, String externalId) {
        GenerationAdapter adapter = get(kind);
        return instrumented(kind, "poll", () -> adapter.poll(externalId),
                result -> result.outcome() != PollResult.Outcome.FAILED_TRANSIENT);
    }

    public CancelResult cancel(TaskKind kind, String externalId) {
        GenerationAdapter adapter = get(kind);
        return instrumented(kind, "cancel", () -> adapter.cancel(externalId), null);
    }

    /**
     * @param healthy says whether a returned value counts as a provider success
     *                for the breaker; null keeps the call out of the breaker
     */
    private <T> T instrumented(TaskKind kind, String op, AdapterCall<T> call, Predicate<T> healthy) {
        Timer.Sample sample = Timer.start(meterRegistry);
        String outcome = "ok";
        try {
            T result = call.run();
            if (healthy != null) {
                if (healthy.test(result)) breaker.recordSuccess(kind);
                else                      breaker.recordFailure(kind);
            }
            return result;
        } catch (AdapterException e) {
            outcome = e.getFailureClass().name().toLowerCase();
            if (healthy != null) {
                if (e.getFailureClass() == FailureClass.TRANSIENT) breaker.recordFailure(kind);
                else                                               breaker.recordNeutral(kind);
            }
            throw e;
        } catch (RuntimeException e) {
            // Unclassified adapter bug: treat as transient so the retry budget bounds it.
            outcome = "error";
            if (healthy != null) breaker.recordFailure(kind);
            throw AdapterException.transientFailure(
                    "Unexpected error in " + kind + " adapter " + op + ": " + e.getMessage(), e);
        } finally {
            sample.stop(meterRegistry.timer("scenepilot.adapter.calls",
                    "kind", kind.name().toLowerCase(), "op", op, "outcome", outcome));
        }
    }

    @FunctionalInterface
    private interface AdapterCall<T> {
        T run();
    }
}
