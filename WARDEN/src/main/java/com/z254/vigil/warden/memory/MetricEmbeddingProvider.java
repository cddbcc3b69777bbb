package com.z254.vigil.warden.memory;

import com.z254.vigil.warden.domain.model.TelemetryEvent;

/**
 * Deterministic embedding built from normalized metrics plus a hashed component bucket.
 * Events of the same component land closer together than equal metrics on different components.
 */
public class MetricEmbeddingProvider implements EmbeddingProvider {

    private static final int METRIC_DIMENSIONS = 5;
    private static final int COMPONENT_BUCKETS = 4;
    private static final double COMPONENT_WEIGHT = 0.5;
    private static final double LATENCY_SCALE = Math.log1p(10_000);
    private static final double THROUGHPUT_SCALE = Math.log1p(1_000_000);

    @Override
    public int dimension() {
        return METRIC_DIMENSIONS + COMPONENT_BUCKETS;
    }

    @Override
    public double[] embed(TelemetryEvent event) {
        double[] vector = new double[dimension()];
        vector[0] = Math.min(1.0, Math.log1p(event.getLatencyP99()) / LATENCY_SCALE);
        vector[1] = event.getErrorRate();
        vector[2] = Math.min(1.0, Math.log1p(event.getThroughput()) / THROUGHPUT_SCALE);
        vector[3] = event.getCpuUtil() != null ? event.getCpuUtil() : 0.0;
        vector[4] = event.getMemoryUtil() != null ? event.getMemoryUtil() : 0.0;
        int bucket = Math.floorMod(event.getComponent().hashCode(), COMPONENT_BUCKETS);
        vector[METRIC_DIMENSIONS + bucket] = COMPONENT_WEIGHT;
        return vector;
    }
}
