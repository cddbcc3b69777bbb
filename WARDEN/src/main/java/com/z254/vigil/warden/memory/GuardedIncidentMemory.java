package com.z254.vigil.warden.memory;

import com.z254.vigil.warden.domain.model.ActionEffectiveness;
import com.z254.vigil.warden.domain.model.IncidentNode;
import com.z254.vigil.warden.domain.model.SimilarIncident;
import com.z254.vigil.warden.domain.model.TelemetryEvent;
import com.z254.vigil.warden.observability.WardenMetrics;
import com.z254.vigil.warden.observability.WardenStructuredLogger;
import com.z254.vigil.warden.observability.WardenStructuredLogger.MemoryEventType;
import com.z254.vigil.warden.resilience.CircuitOpenException;
import com.z254.vigil.warden.resilience.ResourceCircuitBreaker;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Circuit-breaker guarded access to the {@link IncidentOutcomeMemory}.
 * <p>
 * Failures never escape: an open breaker or a failing query yields
 * {@link MemoryResponse#unavailable(String)}, which callers treat as "no historical context".
 */
public class GuardedIncidentMemory {

    private final IncidentOutcomeMemory delegate;
    private final ResourceCircuitBreaker circuitBreaker;
    private final WardenMetrics metrics;
    private final WardenStructuredLogger structuredLogger;

    public GuardedIncidentMemory(IncidentOutcomeMemory delegate,
                                 ResourceCircuitBreaker circuitBreaker,
                                 WardenMetrics metrics,
                                 WardenStructuredLogger structuredLogger) {
        this.delegate = delegate;
        this.circuitBreaker = circuitBreaker;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
    }

    public MemoryResponse<IncidentNode> recordIncident(TelemetryEvent event) {
        return guarded("recordIncident", event.incidentId(), () -> delegate.recordIncident(event));
    }

    public MemoryResponse<List<SimilarIncident>> recall(TelemetryEvent event, int k) {
        return guarded("recall", event.incidentId(), () -> delegate.recall(event, k));
    }

    public MemoryResponse<Optional<String>> storeOutcome(String incidentId, List<String> actions, boolean success,
                                                         double durationMinutes, String lessonsLearned) {
        return guarded("storeOutcome", incidentId,
                () -> delegate.storeOutcome(incidentId, actions, success, durationMinutes, lessonsLearned));
    }

    public MemoryResponse<List<ActionEffectiveness>> mostEffectiveActions(String component, int k) {
        return guarded("mostEffectiveActions", null, () -> delegate.mostEffectiveActions(component, k));
    }

    public MemoryResponse<Optional<IncidentNode>> findIncident(String incidentId) {
        return guarded("findIncident", incidentId, () -> delegate.findIncident(incidentId));
    }

    public MemoryStats stats() {
        return delegate.stats();
    }

    public ResourceCircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    private <T> MemoryResponse<T> guarded(String operation, String incidentId, Supplier<T> call) {
        try {
            return MemoryResponse.available(circuitBreaker.call(call));
        } catch (CircuitOpenException e) {
            metrics.recordMemoryUnavailable(operation);
            return MemoryResponse.unavailable("memory circuit open");
        } catch (RuntimeException e) {
            metrics.recordMemoryUnavailable(operation);
            structuredLogger.logMemoryEvent(incidentId, MemoryEventType.UNAVAILABLE,
                    "Memory operation failed",
                    Map.of("operation", operation,
                            "error", String.valueOf(e.getMessage()),
                            "breaker", circuitBreaker.getState().name()));
            return MemoryResponse.unavailable("memory query failed: " + e.getMessage());
        }
    }
}
