package com.z254.vigil.warden.classification;

import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.domain.model.AnomalyClassification;
import com.z254.vigil.warden.domain.model.ClassificationLevel;
import com.z254.vigil.warden.domain.model.TelemetryEvent;
import com.z254.vigil.warden.domain.model.TelemetryMetric;
import com.z254.vigil.warden.support.MutableClock;
import com.z254.vigil.warden.support.TestEvents;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyClassifier}.
 */
class AnomalyClassifierTest {

    private MutableClock clock;
    private AnomalyClassifier classifier;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2026-03-02T10:00:00Z");
        classifier = new AnomalyClassifier(new WardenProperties());
    }

    private TelemetryEvent event(Map<String, Object> raw) {
        return TestEvents.event(raw, clock);
    }

    @Nested
    @DisplayName("Static thresholds")
    class StaticThresholds {

        @Test
        @DisplayName("should classify the degraded api-service record as CRITICAL")
        void degradedRecordIsCritical() {
            AnomalyClassification classification = classifier.classify(event(TestEvents.degradedApiService()));

            assertThat(classification.getLevel()).isEqualTo(ClassificationLevel.CRITICAL);
            assertThat(classification.getScore()).isCloseTo(0.722, within(1e-9));
            assertThat(classification.isStaticOnly()).isTrue();
            assertThat(classification.getMetricScores())
                    .containsEntry(TelemetryMetric.LATENCY_P99, 1.0)
                    .containsEntry(TelemetryMetric.THROUGHPUT, 0.0)
                    .containsEntry(TelemetryMetric.MEMORY_UTIL, 1.0);
            assertThat(classification.getMetricScores().get(TelemetryMetric.ERROR_RATE)).isCloseTo(0.76, within(1e-9));
            assertThat(classification.getMetricScores().get(TelemetryMetric.CPU_UTIL)).isCloseTo(0.85, within(1e-9));
        }

        @Test
        @DisplayName("should classify a healthy record as NORMAL")
        void healthyRecordIsNormal() {
            AnomalyClassification classification = classifier.classify(event(TestEvents.healthy("checkout")));

            assertThat(classification.getLevel()).isEqualTo(ClassificationLevel.NORMAL);
            assertThat(classification.getScore()).isZero();
            assertThat(classification.isAnomalous()).isFalse();
        }

        @Test
        @DisplayName("should average only over reported metrics")
        void ignoresAbsentMetrics() {
            Map<String, Object> raw = TestEvents.degradedApiService();
            raw.remove("cpu_util");
            raw.remove("memory_util");

            AnomalyClassification classification = classifier.classify(event(raw));

            // (1.0 + 0.76 + 0.0) / 3
            assertThat(classification.getScore()).isCloseTo(1.76 / 3, within(1e-9));
            assertThat(classification.getMetricScores()).doesNotContainKey(TelemetryMetric.CPU_UTIL);
        }

        @Test
        @DisplayName("should score the warning-to-critical band linearly from 0.5")
        void bandScoring() {
            assertThat(classifier.staticScore(TelemetryMetric.LATENCY_P99, 149)).isZero();
            assertThat(classifier.staticScore(TelemetryMetric.LATENCY_P99, 150)).isEqualTo(0.5);
            assertThat(classifier.staticScore(TelemetryMetric.LATENCY_P99, 225)).isEqualTo(0.75);
            assertThat(classifier.staticScore(TelemetryMetric.LATENCY_P99, 300)).isEqualTo(1.0);
            assertThat(classifier.staticScore(TelemetryMetric.THROUGHPUT, 0)).isZero();
        }

        @Test
        @DisplayName("should map scores to buckets at the documented boundaries")
        void bucketBoundaries() {
            assertThat(ClassificationLevel.fromScore(0.29)).isEqualTo(ClassificationLevel.NORMAL);
            assertThat(ClassificationLevel.fromScore(0.3)).isEqualTo(ClassificationLevel.DEGRADING);
            assertThat(ClassificationLevel.fromScore(0.6)).isEqualTo(ClassificationLevel.CRITICAL);
            assertThat(ClassificationLevel.fromScore(0.85)).isEqualTo(ClassificationLevel.SYSTEMIC);
        }
    }

    @Nested
    @DisplayName("Dynamic baseline")
    class DynamicBaseline {

        @Test
        @DisplayName("should stay static-only during warm-up")
        void staticDuringWarmup() {
            for (int i = 0; i < 4; i++) {
                classifier.classify(event(TestEvents.healthy("checkout")));
            }
            AnomalyClassification fifth = classifier.classify(event(TestEvents.healthy("checkout")));

            assertThat(fifth.isStaticOnly()).isTrue();
            assertThat(classifier.baselineFor("checkout")).isPresent();
            assertThat(classifier.baselineFor("checkout").get().get(TelemetryMetric.LATENCY_P99).samples())
                    .isEqualTo(5);
        }

        @Test
        @DisplayName("should flag a throughput collapse that static thresholds ignore")
        void detectsThroughputDrop() {
            for (int i = 0; i < 10; i++) {
                classifier.classify(event(TestEvents.healthy("checkout")));
            }

            AnomalyClassification collapsed = classifier.classify(
                    event(TestEvents.with(TestEvents.healthy("checkout"), "throughput", 100)));

            assertThat(collapsed.isStaticOnly()).isFalse();
            assertThat(collapsed.getMetricScores().get(TelemetryMetric.THROUGHPUT)).isEqualTo(1.0);
            // one saturated metric out of five
            assertThat(collapsed.getScore()).isCloseTo(0.2, within(1e-9));
        }

        @Test
        @DisplayName("should not flag a throughput increase")
        void ignoresThroughputIncrease() {
            for (int i = 0; i < 10; i++) {
                classifier.classify(event(TestEvents.healthy("checkout")));
            }

            AnomalyClassification surge = classifier.classify(
                    event(TestEvents.with(TestEvents.healthy("checkout"), "throughput", 5000)));

            assertThat(surge.getMetricScores().get(TelemetryMetric.THROUGHPUT)).isZero();
        }

        @Test
        @DisplayName("should fall back to static thresholds and reset a corrupted baseline")
        void corruptedBaselineFallsBack() {
            classifier.installBaseline("api-service", ComponentBaseline.of(Map.of(
                    TelemetryMetric.LATENCY_P99, new ComponentBaseline.MetricStats(50, Double.NaN, 4.0))));

            AnomalyClassification classification = classifier.classify(event(TestEvents.degradedApiService()));

            assertThat(classification.isStaticOnly()).isTrue();
            assertThat(classification.getLevel()).isEqualTo(ClassificationLevel.CRITICAL);
            ComponentBaseline reset = classifier.baselineFor("api-service").orElseThrow();
            assertThat(reset.get(TelemetryMetric.LATENCY_P99).samples()).isEqualTo(1);
            assertThat(reset.get(TelemetryMetric.LATENCY_P99).mean()).isEqualTo(320.0);
        }

        @Test
        @DisplayName("should reject a baseline with negative variance")
        void negativeVarianceIsCorruption() {
            ComponentBaseline corrupted = ComponentBaseline.of(Map.of(
                    TelemetryMetric.ERROR_RATE, new ComponentBaseline.MetricStats(10, 0.01, -1.0)));

            assertThatThrownBy(corrupted::verify)
                    .isInstanceOf(ClassificationException.class)
                    .hasMessageContaining("error_rate");
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("should count every sample when one component is classified concurrently")
        void serializesUpdatesPerComponent() throws Exception {
            int threads = 8;
            int perThread = 50;
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                TelemetryEvent event = event(TestEvents.healthy("checkout"));
                List<Callable<Void>> tasks = new ArrayList<>();
                for (int t = 0; t < threads; t++) {
                    tasks.add(() -> {
                        for (int i = 0; i < perThread; i++) {
                            classifier.classify(event);
                        }
                        return null;
                    });
                }
                for (Future<Void> future : executor.invokeAll(tasks)) {
                    future.get();
                }
            } finally {
                executor.shutdown();
                assertThat(executor.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
            }

            ComponentBaseline baseline = classifier.baselineFor("checkout").orElseThrow();
            assertThat(baseline.get(TelemetryMetric.LATENCY_P99).samples()).isEqualTo(threads * perThread);
            assertThat(baseline.get(TelemetryMetric.LATENCY_P99).mean()).isCloseTo(80.0, within(1e-9));
        }
    }
}
