package com.z254.vigil.warden.outcome;

import com.z254.vigil.warden.domain.model.HealingIntent;
import com.z254.vigil.warden.memory.GuardedIncidentMemory;
import com.z254.vigil.warden.memory.MemoryResponse;
import com.z254.vigil.warden.observability.WardenMetrics;
import com.z254.vigil.warden.observability.WardenStructuredLogger;
import com.z254.vigil.warden.observability.WardenStructuredLogger.MemoryEventType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closes the learning loop by writing remediation outcomes back into incident memory.
 * <p>
 * Writes triggered by the gateway are fire-and-forget on their own scheduler; a failed write is
 * logged and counted and never reaches the gateway's response path.
 */
@Slf4j
@Component
public class OutcomeRecorder {

    private final GuardedIncidentMemory memory;
    private final WardenMetrics metrics;
    private final WardenStructuredLogger structuredLogger;
    private final Scheduler scheduler;

    @Autowired
    public OutcomeRecorder(GuardedIncidentMemory memory, WardenMetrics metrics,
                           WardenStructuredLogger structuredLogger) {
        this(memory, metrics, structuredLogger, Schedulers.boundedElastic());
    }

    public OutcomeRecorder(GuardedIncidentMemory memory, WardenMetrics metrics,
                           WardenStructuredLogger structuredLogger, Scheduler scheduler) {
        this.memory = memory;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.scheduler = scheduler;
    }

    /**
     * Record the result of a gateway execution asynchronously.
     */
    public Disposable recordExecution(HealingIntent intent, boolean success, Duration duration, String detail) {
        double minutes = duration.toMillis() / 60_000.0;
        String lessons = success ? null : detail;
        return store(intent.getIncidentId(), List.of(intent.getToolName()), success, minutes, lessons)
                .subscribeOn(scheduler)
                .subscribe(
                        outcomeId -> log.debug("Recorded outcome {} for intent {}", outcomeId, intent.getIntentId()),
                        error -> log.error("Outcome recording failed for intent {}: {}",
                                intent.getIntentId(), error.getMessage()));
    }

    /**
     * Record a manual remediation reported by an operator, typically in advisory deployments.
     *
     * @return the outcome id; empty when memory is unavailable or the incident is unknown
     */
    public Mono<String> reportManualRemediation(String incidentId, List<String> actions, boolean success,
                                                double durationMinutes, String lessonsLearned) {
        if (incidentId == null || incidentId.isBlank()) {
            return Mono.error(new IllegalArgumentException("incidentId is required"));
        }
        if (actions == null || actions.isEmpty() || actions.stream().anyMatch(a -> a == null || a.isBlank())) {
            return Mono.error(new IllegalArgumentException("at least one action is required"));
        }
        if (!Double.isFinite(durationMinutes) || durationMinutes < 0) {
            return Mono.error(new IllegalArgumentException("durationMinutes must be a non-negative number"));
        }
        return store(incidentId, actions, success, durationMinutes, lessonsLearned)
                .subscribeOn(scheduler);
    }

    private Mono<String> store(String incidentId, List<String> actions, boolean success,
                               double durationMinutes, String lessons) {
        return Mono.fromCallable(() -> {
            MemoryResponse<Optional<String>> response =
                    memory.storeOutcome(incidentId, actions, success, durationMinutes, lessons);
            if (!response.isAvailable()) {
                dropped(incidentId, actions, response.reason());
                return Optional.<String>empty();
            }
            Optional<String> outcomeId = response.value();
            if (outcomeId.isEmpty()) {
                dropped(incidentId, actions, "incident not stored");
                return outcomeId;
            }
            metrics.recordOutcomeRecorded();
            structuredLogger.logMemoryEvent(incidentId, MemoryEventType.OUTCOME_STORED, "Outcome recorded",
                    Map.of("outcomeId", outcomeId.get(), "actions", actions, "success", success));
            return outcomeId;
        }).flatMap(outcomeId -> outcomeId.map(Mono::just).orElseGet(Mono::empty));
    }

    private void dropped(String incidentId, List<String> actions, String reason) {
        metrics.recordOutcomeFailed();
        structuredLogger.logMemoryEvent(incidentId, MemoryEventType.OUTCOME_FAILED, "Outcome not recorded",
                Map.of("actions", actions, "reason", reason));
    }
}
