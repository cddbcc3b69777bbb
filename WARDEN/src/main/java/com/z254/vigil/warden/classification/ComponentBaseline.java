package com.z254.vigil.warden.classification;

import com.z254.vigil.warden.domain.model.TelemetryEvent;
import com.z254.vigil.warden.domain.model.TelemetryMetric;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable exponentially weighted statistics for one component.
 * Updates return a new instance so a baseline is swapped in whole or not at all.
 */
public final class ComponentBaseline {

    private static final ComponentBaseline EMPTY = new ComponentBaseline(new EnumMap<>(TelemetryMetric.class));

    private final Map<TelemetryMetric, MetricStats> stats;

    private ComponentBaseline(Map<TelemetryMetric, MetricStats> stats) {
        this.stats = Collections.unmodifiableMap(stats);
    }

    public static ComponentBaseline empty() {
        return EMPTY;
    }

    static ComponentBaseline of(Map<TelemetryMetric, MetricStats> stats) {
        EnumMap<TelemetryMetric, MetricStats> copy = new EnumMap<>(TelemetryMetric.class);
        copy.putAll(stats);
        return new ComponentBaseline(copy);
    }

    public MetricStats get(TelemetryMetric metric) {
        return stats.getOrDefault(metric, MetricStats.EMPTY);
    }

    /**
     * @throws ClassificationException when any statistic is non-finite or the variance is negative
     */
    void verify() {
        stats.forEach((metric, s) -> {
            if (!Double.isFinite(s.mean()) || !Double.isFinite(s.variance()) || s.variance() < 0) {
                throw new ClassificationException("Corrupted baseline for " + metric.key()
                        + ": mean=" + s.mean() + ", variance=" + s.variance());
            }
        });
    }

    ComponentBaseline update(TelemetryEvent event, double alpha) {
        EnumMap<TelemetryMetric, MetricStats> next = new EnumMap<>(TelemetryMetric.class);
        next.putAll(stats);
        for (TelemetryMetric metric : TelemetryMetric.values()) {
            Double value = metric.valueOf(event);
            if (value != null) {
                next.put(metric, get(metric).observe(value, alpha));
            }
        }
        return new ComponentBaseline(next);
    }

    /**
     * Exponentially weighted mean and variance of one metric.
     */
    public record MetricStats(long samples, double mean, double variance) {

        static final MetricStats EMPTY = new MetricStats(0, 0.0, 0.0);

        MetricStats observe(double value, double alpha) {
            if (samples == 0) {
                return new MetricStats(1, value, 0.0);
            }
            double diff = value - mean;
            double increment = alpha * diff;
            double nextVariance = (1 - alpha) * (variance + diff * increment);
            return new MetricStats(samples + 1, mean + increment, nextVariance);
        }

        public double standardDeviation() {
            return Math.sqrt(variance);
        }
    }
}
