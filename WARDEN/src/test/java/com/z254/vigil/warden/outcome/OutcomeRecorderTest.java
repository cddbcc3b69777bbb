package com.z254.vigil.warden.outcome;

import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.domain.model.HealingIntent;
import com.z254.vigil.warden.domain.model.IncidentNode;
import com.z254.vigil.warden.domain.model.OutcomeNode;
import com.z254.vigil.warden.memory.GuardedIncidentMemory;
import com.z254.vigil.warden.memory.InMemoryIncidentGraph;
import com.z254.vigil.warden.memory.IncidentOutcomeMemory;
import com.z254.vigil.warden.memory.MetricEmbeddingProvider;
import com.z254.vigil.warden.observability.WardenMetrics;
import com.z254.vigil.warden.observability.WardenStructuredLogger;
import com.z254.vigil.warden.resilience.ResourceCircuitBreaker;
import com.z254.vigil.warden.support.MutableClock;
import com.z254.vigil.warden.support.TestEvents;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link OutcomeRecorder}.
 */
class OutcomeRecorderTest {

    private MutableClock clock;
    private WardenProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private InMemoryIncidentGraph graph;
    private OutcomeRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        properties = new WardenProperties();
        meterRegistry = new SimpleMeterRegistry();
        graph = new InMemoryIncidentGraph(new MetricEmbeddingProvider(), properties, clock);
        recorder = recorderFor(graph);
    }

    private OutcomeRecorder recorderFor(IncidentOutcomeMemory delegate) {
        WardenMetrics metrics = new WardenMetrics(meterRegistry);
        WardenStructuredLogger logger = new WardenStructuredLogger();
        GuardedIncidentMemory memory = new GuardedIncidentMemory(delegate,
                new ResourceCircuitBreaker("incident-memory", properties.getMemory().getCircuitBreaker(), clock),
                metrics, logger);
        return new OutcomeRecorder(memory, metrics, logger, Schedulers.immediate());
    }

    private IncidentNode storedIncident() {
        return graph.recordIncident(TestEvents.event(TestEvents.degradedApiService(), clock));
    }

    private double counter(String name) {
        return meterRegistry.get(name).counter().count();
    }

    @Nested
    @DisplayName("Gateway executions")
    class GatewayExecutions {

        @Test
        @DisplayName("should attach a successful execution to its incident")
        void recordsSuccess() {
            IncidentNode incident = storedIncident();
            HealingIntent intent = HealingIntent.builder()
                    .intentId("intent_a")
                    .toolName("scale_out")
                    .component("api-service")
                    .incidentId(incident.getIncidentId())
                    .build();

            recorder.recordExecution(intent, true, Duration.ofSeconds(90), "done");

            List<OutcomeNode> outcomes = graph.findIncident(incident.getIncidentId()).orElseThrow().getOutcomes();
            assertThat(outcomes).singleElement().satisfies(outcome -> {
                assertThat(outcome.getActions()).containsExactly("scale_out");
                assertThat(outcome.isSuccess()).isTrue();
                assertThat(outcome.getResolutionMinutes()).isEqualTo(1.5);
                assertThat(outcome.getLessonsLearned()).isNull();
            });
            assertThat(counter("warden.outcomes.recorded")).isEqualTo(1.0);
        }

        @Test
        @DisplayName("should keep the failure detail as the lesson learned")
        void recordsFailureDetail() {
            IncidentNode incident = storedIncident();
            HealingIntent intent = HealingIntent.builder()
                    .intentId("intent_a")
                    .toolName("restart_container")
                    .incidentId(incident.getIncidentId())
                    .build();

            recorder.recordExecution(intent, false, Duration.ZERO, "pod stuck terminating");

            assertThat(graph.findIncident(incident.getIncidentId()).orElseThrow().getOutcomes())
                    .singleElement()
                    .satisfies(outcome -> assertThat(outcome.getLessonsLearned()).isEqualTo("pod stuck terminating"));
        }

        @Test
        @DisplayName("should count a write for an evicted incident as dropped")
        void unknownIncident() {
            HealingIntent intent = HealingIntent.builder()
                    .intentId("intent_a")
                    .toolName("scale_out")
                    .incidentId("inc_gone")
                    .build();

            recorder.recordExecution(intent, true, Duration.ofSeconds(5), "done");

            assertThat(counter("warden.outcomes.failed")).isEqualTo(1.0);
            assertThat(graph.stats().getOutcomeCount()).isZero();
        }

        @Test
        @DisplayName("should absorb memory failures")
        void memoryFailure() {
            IncidentOutcomeMemory broken = mock(IncidentOutcomeMemory.class);
            when(broken.storeOutcome(anyString(), anyList(), anyBoolean(), anyDouble(), any()))
                    .thenThrow(new IllegalStateException("store offline"));
            OutcomeRecorder failing = recorderFor(broken);
            HealingIntent intent = HealingIntent.builder()
                    .intentId("intent_a")
                    .toolName("scale_out")
                    .incidentId("inc_1")
                    .build();

            failing.recordExecution(intent, true, Duration.ofSeconds(5), "done");

            assertThat(counter("warden.outcomes.failed")).isEqualTo(1.0);
            assertThat(meterRegistry.get("warden.memory.unavailable").tag("operation", "storeOutcome")
                    .counter().count()).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Manual remediation reports")
    class ManualReports {

        @Test
        @DisplayName("should return the outcome id and collapse repeats within the bucket")
        void storesOnce() {
            IncidentNode incident = storedIncident();
            List<String> actions = List.of("traffic_shift", "alert_team");

            String first = recorder.reportManualRemediation(incident.getIncidentId(), actions, true, 12.0,
                    "shifted to eu-west").block();
            String second = recorder.reportManualRemediation(incident.getIncidentId(), actions, true, 12.0,
                    "shifted to eu-west").block();

            assertThat(first).startsWith("out_").isEqualTo(second);
            assertThat(graph.stats().getOutcomeCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should complete empty for an unknown incident")
        void unknownIncident() {
            StepVerifier.create(recorder.reportManualRemediation("inc_missing", List.of("scale_out"), true, 1.0, null))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject malformed reports")
        void rejectsMalformed() {
            StepVerifier.create(recorder.reportManualRemediation(" ", List.of("scale_out"), true, 1.0, null))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            StepVerifier.create(recorder.reportManualRemediation("inc_1", List.of(), true, 1.0, null))
                    .expectError(IllegalArgumentException.class)
                    .verify();
            StepVerifier.create(recorder.reportManualRemediation("inc_1", List.of("scale_out"), true, -1.0, null))
                    .expectErrorMessage("durationMinutes must be a non-negative number")
                    .verify();
        }
    }
}
