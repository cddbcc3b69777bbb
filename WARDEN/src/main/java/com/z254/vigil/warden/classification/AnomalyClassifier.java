package com.z254.vigil.warden.classification;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.domain.model.AnomalyClassification;
import com.z254.vigil.warden.domain.model.ClassificationLevel;
import com.z254.vigil.warden.domain.model.TelemetryEvent;
import com.z254.vigil.warden.domain.model.TelemetryMetric;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Scores events against static thresholds and adaptive per-component baselines.
 * <p>
 * Each metric gets a deviation score in [0,1]: the larger of its static threshold score and its
 * dynamic z-score against the component baseline. Scores are combined by weighted mean over the
 * metrics present in the event. Baselines are updated through {@code compute} on a bounded
 * Caffeine map, which serializes writers per component while unrelated components proceed in
 * parallel.
 */
@Slf4j
@Component
public class AnomalyClassifier {

    private static final double RELATIVE_SPREAD_FLOOR = 0.05;
    private static final double ABSOLUTE_SPREAD_FLOOR = 1e-9;

    private final WardenProperties.Classification config;
    private final Cache<String, ComponentBaseline> baselines;

    public AnomalyClassifier(WardenProperties properties) {
        this.config = properties.getClassification();
        this.baselines = Caffeine.newBuilder()
                .maximumSize(config.getMaxTrackedComponents())
                .executor(Runnable::run)
                .build();
    }

    /**
     * Classify the event and fold it into its component's baseline.
     */
    public AnomalyClassification classify(TelemetryEvent event) {
        AtomicReference<AnomalyClassification> result = new AtomicReference<>();

        baselines.asMap().compute(event.getComponent(), (component, existing) -> {
            ComponentBaseline baseline = existing != null ? existing : ComponentBaseline.empty();
            AnomalyClassification classification;
            try {
                baseline.verify();
                classification = score(event, baseline, false);
            } catch (ClassificationException e) {
                log.warn("Falling back to static thresholds for component {}: {}", component, e.getMessage());
                baseline = ComponentBaseline.empty();
                classification = score(event, baseline, true);
            }
            result.set(classification);
            return baseline.update(event, config.getEwmaAlpha());
        });

        AnomalyClassification classification = result.get();
        log.debug("Classified component={} score={} level={}",
                event.getComponent(), classification.getScore(), classification.getLevel());
        return classification;
    }

    public Optional<ComponentBaseline> baselineFor(String component) {
        return Optional.ofNullable(baselines.getIfPresent(component));
    }

    public long trackedComponents() {
        return baselines.estimatedSize();
    }

    /**
     * Test hook for installing a specific baseline state.
     */
    void installBaseline(String component, ComponentBaseline baseline) {
        baselines.put(component, baseline);
    }

    private AnomalyClassification score(TelemetryEvent event, ComponentBaseline baseline, boolean forceStatic) {
        Map<TelemetryMetric, Double> metricScores = new EnumMap<>(TelemetryMetric.class);
        double weighted = 0.0;
        double totalWeight = 0.0;
        boolean staticOnly = true;

        for (TelemetryMetric metric : TelemetryMetric.values()) {
            Double value = metric.valueOf(event);
            if (value == null) {
                continue;
            }
            double metricScore = staticScore(metric, value);
            ComponentBaseline.MetricStats stats = baseline.get(metric);
            if (!forceStatic && stats.samples() >= config.getWarmupSamples()) {
                staticOnly = false;
                metricScore = Math.max(metricScore, dynamicScore(metric, value, stats));
            }
            if (!Double.isFinite(metricScore) || metricScore < 0 || metricScore > 1) {
                throw new ClassificationException("Score out of range for " + metric.key() + ": " + metricScore);
            }
            double weight = weightOf(metric);
            metricScores.put(metric, metricScore);
            weighted += weight * metricScore;
            totalWeight += weight;
        }

        double score = totalWeight > 0 ? clamp(weighted / totalWeight) : 0.0;
        return AnomalyClassification.builder()
                .component(event.getComponent())
                .score(score)
                .level(ClassificationLevel.fromScore(score))
                .metricScores(Collections.unmodifiableMap(metricScores))
                .staticOnly(staticOnly)
                .build();
    }

    /**
     * Zero below the warning threshold, 0.5 to 1.0 between warning and critical, saturated above.
     */
    double staticScore(TelemetryMetric metric, double value) {
        WardenProperties.Classification.Thresholds t = config.getThresholds();
        return switch (metric) {
            case LATENCY_P99 -> band(value, t.getLatencyWarningMs(), t.getLatencyCriticalMs());
            case ERROR_RATE -> band(value, t.getErrorRateWarning(), t.getErrorRateCritical());
            case CPU_UTIL -> band(value, t.getCpuWarning(), t.getCpuCritical());
            case MEMORY_UTIL -> band(value, t.getMemoryWarning(), t.getMemoryCritical());
            case THROUGHPUT -> 0.0;
        };
    }

    private double dynamicScore(TelemetryMetric metric, double value, ComponentBaseline.MetricStats stats) {
        double spread = Math.max(stats.standardDeviation(),
                Math.max(RELATIVE_SPREAD_FLOOR * Math.abs(stats.mean()), ABSOLUTE_SPREAD_FLOOR));
        double deviation = metric.isLowerWorse() ? stats.mean() - value : value - stats.mean();
        double z = deviation / spread;
        if (z <= config.getDeviationOnset()) {
            return 0.0;
        }
        double range = config.getDeviationSaturation() - config.getDeviationOnset();
        return range <= 0 ? 1.0 : clamp((z - config.getDeviationOnset()) / range);
    }

    private double weightOf(TelemetryMetric metric) {
        Double weight = config.getWeights().get(metric.key());
        return weight != null && weight >= 0 ? weight : 1.0;
    }

    private static double band(double value, double warning, double critical) {
        if (value < warning) {
            return 0.0;
        }
        if (value >= critical) {
            return 1.0;
        }
        return 0.5 + 0.5 * (value - warning) / (critical - warning);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
