package com.z254.vigil.warden.memory;

import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.domain.model.ActionEffectiveness;
import com.z254.vigil.warden.domain.model.IncidentNode;
import com.z254.vigil.warden.domain.model.SimilarIncident;
import com.z254.vigil.warden.domain.model.TelemetryEvent;
import com.z254.vigil.warden.support.MutableClock;
import com.z254.vigil.warden.support.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link InMemoryIncidentGraph}.
 */
class InMemoryIncidentGraphTest {

    private MutableClock clock;
    private WardenProperties properties;
    private InMemoryIncidentGraph graph;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        properties = new WardenProperties();
        graph = new InMemoryIncidentGraph(new MetricEmbeddingProvider(), properties, clock);
    }

    private TelemetryEvent degraded() {
        return TestEvents.event(TestEvents.degradedApiService(), clock);
    }

    private TelemetryEvent healthy(String component) {
        return TestEvents.event(TestEvents.healthy(component), clock);
    }

    @Nested
    @DisplayName("Incidents")
    class Incidents {

        @Test
        @DisplayName("should store an incident once per fingerprint")
        void idempotentByFingerprint() {
            IncidentNode first = graph.recordIncident(degraded());
            clock.advance(Duration.ofMinutes(1));
            IncidentNode second = graph.recordIncident(degraded());

            assertThat(second.getIncidentId()).isEqualTo(first.getIncidentId());
            assertThat(second.getSequence()).isEqualTo(first.getSequence());
            assertThat(second.getCreatedAt()).isEqualTo(first.getCreatedAt());
            assertThat(graph.stats().getIncidentCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("should evict the least recently accessed incident at capacity")
        void evictsLeastRecentlyAccessed() {
            properties.getMemory().setMaxIncidents(2);
            graph = new InMemoryIncidentGraph(new MetricEmbeddingProvider(), properties, clock);

            TelemetryEvent a = healthy("alpha");
            TelemetryEvent b = healthy("beta");
            graph.recordIncident(a);
            graph.recordIncident(b);
            // re-recording alpha counts as an access, leaving beta as eldest
            graph.recordIncident(a);
            graph.recordIncident(healthy("gamma"));

            assertThat(graph.findIncident(a.incidentId())).isPresent();
            assertThat(graph.findIncident(b.incidentId())).isEmpty();
            assertThat(graph.stats().getEvictions()).isEqualTo(1);
            assertThat(graph.stats().getIncidentCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should reject embeddings of the wrong dimension")
        void rejectsWrongDimension() {
            EmbeddingProvider broken = new EmbeddingProvider() {
                @Override
                public int dimension() {
                    return 9;
                }

                @Override
                public double[] embed(TelemetryEvent event) {
                    return new double[3];
                }
            };
            InMemoryIncidentGraph brokenGraph = new InMemoryIncidentGraph(broken, properties, clock);

            assertThatThrownBy(() -> brokenGraph.recordIncident(degraded()))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("expected 9");
        }
    }

    @Nested
    @DisplayName("Recall")
    class Recall {

        @Test
        @DisplayName("should return nearest incidents first")
        void nearestFirst() {
            graph.recordIncident(healthy("api-service"));
            TelemetryEvent degraded = degraded();
            graph.recordIncident(degraded);

            List<SimilarIncident> hits = graph.recall(degraded, 5);

            assertThat(hits).hasSize(2);
            assertThat(hits.get(0).getIncident().getIncidentId()).isEqualTo(degraded.incidentId());
            assertThat(hits.get(0).getDistance()).isZero();
            assertThat(hits.get(0).getSimilarity()).isEqualTo(1.0);
            assertThat(hits.get(1).getDistance()).isGreaterThan(0.0);
        }

        @Test
        @DisplayName("should break distance ties by recency")
        void tiesByRecency() {
            TelemetryEvent older = TestEvents.event(
                    TestEvents.with(TestEvents.degradedApiService(), "severity", "LOW"), clock);
            graph.recordIncident(older);
            clock.advance(Duration.ofMinutes(5));
            TelemetryEvent newer = TestEvents.event(
                    TestEvents.with(TestEvents.degradedApiService(), "severity", "HIGH"), clock);
            graph.recordIncident(newer);

            List<SimilarIncident> hits = graph.recall(older, 2);

            assertThat(hits).extracting(h -> h.getIncident().getIncidentId())
                    .containsExactly(newer.incidentId(), older.incidentId());
        }

        @Test
        @DisplayName("should honour k and the lookback window")
        void limitsAndLookback() {
            graph.recordIncident(healthy("alpha"));
            clock.advance(Duration.ofDays(8));
            graph.recordIncident(healthy("beta"));

            assertThat(graph.recall(degraded(), 5)).hasSize(1);
            assertThat(graph.recall(degraded(), 0)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Outcomes")
    class Outcomes {

        @Test
        @DisplayName("should deduplicate outcomes within the idempotency bucket")
        void deduplicatesWithinBucket() {
            TelemetryEvent event = degraded();
            graph.recordIncident(event);

            Optional<String> first = graph.storeOutcome(event.incidentId(), List.of("scale_out"), true, 3.0, null);
            Optional<String> second = graph.storeOutcome(event.incidentId(), List.of("scale_out"), true, 3.0, null);

            assertThat(first).isPresent();
            assertThat(first.get()).startsWith("out_");
            assertThat(second).isEqualTo(first);
            assertThat(graph.stats().getOutcomeCount()).isEqualTo(1);
            assertThat(graph.findIncident(event.incidentId()).orElseThrow().getOutcomes()).hasSize(1);
        }

        @Test
        @DisplayName("should record a repeat attempt in a later bucket separately")
        void laterBucketIsNewOutcome() {
            TelemetryEvent event = degraded();
            graph.recordIncident(event);

            Optional<String> first = graph.storeOutcome(event.incidentId(), List.of("scale_out"), false, 3.0, "no effect");
            clock.advance(Duration.ofMinutes(2));
            Optional<String> second = graph.storeOutcome(event.incidentId(), List.of("scale_out"), true, 1.0, null);

            assertThat(second).isPresent().isNotEqualTo(first);
            assertThat(graph.stats().getOutcomeCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("should drop outcomes for unknown incidents")
        void dropsUnknownIncident() {
            assertThat(graph.storeOutcome("inc_missing", List.of("scale_out"), true, 1.0, null)).isEmpty();
            assertThat(graph.stats().getOutcomeCount()).isZero();
        }

        @Test
        @DisplayName("should forget outcomes together with their evicted incident")
        void evictionRemovesOutcomes() {
            properties.getMemory().setMaxIncidents(1);
            graph = new InMemoryIncidentGraph(new MetricEmbeddingProvider(), properties, clock);
            TelemetryEvent first = healthy("alpha");
            graph.recordIncident(first);
            graph.storeOutcome(first.incidentId(), List.of("restart_container"), true, 2.0, null);

            graph.recordIncident(healthy("beta"));

            assertThat(graph.stats().getOutcomeCount()).isZero();
            assertThat(graph.storeOutcome(first.incidentId(), List.of("restart_container"), true, 2.0, null))
                    .isEmpty();
        }

        @Test
        @DisplayName("should rank actions by success rate for a component")
        void ranksEffectiveActions() {
            TelemetryEvent event = degraded();
            graph.recordIncident(event);
            graph.storeOutcome(event.incidentId(), List.of("scale_out"), true, 2.0, null);
            clock.advance(Duration.ofMinutes(2));
            graph.storeOutcome(event.incidentId(), List.of("restart_container"), false, 5.0, "crash loop");
            clock.advance(Duration.ofMinutes(2));
            graph.storeOutcome(event.incidentId(), List.of("restart_container", "scale_out"), true, 4.0, null);
            TelemetryEvent other = healthy("billing");
            graph.recordIncident(other);
            graph.storeOutcome(other.incidentId(), List.of("rollback"), true, 1.0, null);

            List<ActionEffectiveness> ranked = graph.mostEffectiveActions("api-service", 5);

            assertThat(ranked).extracting(ActionEffectiveness::getAction)
                    .containsExactly("scale_out", "restart_container");
            assertThat(ranked.get(0).getAttempts()).isEqualTo(2);
            assertThat(ranked.get(0).getSuccessRate()).isEqualTo(1.0);
            assertThat(ranked.get(1).getSuccessRate()).isEqualTo(0.5);
        }
    }
}
