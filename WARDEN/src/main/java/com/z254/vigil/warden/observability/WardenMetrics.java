package com.z254.vigil.warden.observability;

import com.z254.vigil.warden.domain.model.ClassificationLevel;
import com.z254.vigil.warden.domain.model.GatewayStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer instrumentation for the decision pipeline.
 */
@Component
public class WardenMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter eventsAccepted;
    private final Counter outcomesRecorded;
    private final Counter outcomesFailed;
    private final Counter policyErrors;
    private final Timer pipelineLatency;

    private final Map<String, Counter> taggedCounters = new ConcurrentHashMap<>();

    public WardenMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.eventsAccepted = Counter.builder("warden.events.accepted")
                .description("Telemetry records that passed validation")
                .register(meterRegistry);
        this.outcomesRecorded = Counter.builder("warden.outcomes.recorded")
                .description("Outcomes written back to memory")
                .register(meterRegistry);
        this.outcomesFailed = Counter.builder("warden.outcomes.failed")
                .description("Outcome writes that failed or were dropped")
                .register(meterRegistry);
        this.policyErrors = Counter.builder("warden.policies.errors")
                .description("Malformed policies skipped during evaluation")
                .register(meterRegistry);
        this.pipelineLatency = Timer.builder("warden.pipeline.latency")
                .description("End-to-end processing time per event")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry);
    }

    // ========== Pipeline ==========

    public void recordEventAccepted() {
        eventsAccepted.increment();
    }

    public void recordEventRejected(String field) {
        tagged("warden.events.rejected", "field", field).increment();
    }

    public void recordClassification(ClassificationLevel level) {
        tagged("warden.classifications", "level", level.name()).increment();
    }

    public void recordAnalysisDegraded(String branch) {
        tagged("warden.analysis.degraded", "branch", branch).increment();
    }

    public Timer.Sample startPipelineTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordPipelineLatency(Timer.Sample sample) {
        sample.stop(pipelineLatency);
    }

    // ========== Policy ==========

    public void recordPolicyFired(String policyName) {
        tagged("warden.policies.fired", "policy", policyName).increment();
    }

    public void recordPolicyError() {
        policyErrors.increment();
    }

    // ========== Memory ==========

    public void recordMemoryUnavailable(String operation) {
        tagged("warden.memory.unavailable", "operation", operation).increment();
    }

    public void recordOutcomeRecorded() {
        outcomesRecorded.increment();
    }

    public void recordOutcomeFailed() {
        outcomesFailed.increment();
    }

    // ========== Gateway ==========

    public void recordGatewayDecision(GatewayStatus status) {
        tagged("warden.gateway.decisions", "status", status.name()).increment();
    }

    public Timer.Sample startToolTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordToolExecution(Timer.Sample sample, String toolName, boolean success) {
        sample.stop(Timer.builder("warden.tool.execution")
                .tag("tool", toolName)
                .tag("success", String.valueOf(success))
                .register(meterRegistry));
    }

    private Counter tagged(String name, String tagKey, String tagValue) {
        return taggedCounters.computeIfAbsent(name + ":" + tagValue, key ->
                Counter.builder(name)
                        .tag(tagKey, tagValue)
                        .register(meterRegistry));
    }
}
