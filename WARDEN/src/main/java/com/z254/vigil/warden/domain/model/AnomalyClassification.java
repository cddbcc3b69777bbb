package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Result of scoring one event against static thresholds and the component baseline.
 */
@Value
@Builder(toBuilder = true)
public class AnomalyClassification {

    String component;

    /** Aggregated anomaly score in [0,1] */
    double score;

    ClassificationLevel level;

    /** Per-metric deviation scores that contributed to {@link #score} */
    Map<TelemetryMetric, Double> metricScores;

    /** True when the dynamic baseline was ignored (warm-up or corrupted state) */
    boolean staticOnly;

    public boolean isAnomalous() {
        return level != ClassificationLevel.NORMAL;
    }
}
