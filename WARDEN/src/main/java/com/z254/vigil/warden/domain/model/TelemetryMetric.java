package com.z254.vigil.warden.domain.model;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.Function;

/**
 * Numeric metrics carried by a {@link TelemetryEvent}, keyed by their wire names.
 */
public enum TelemetryMetric {

    LATENCY_P99("latency_p99", TelemetryEvent::getLatencyP99, false),
    ERROR_RATE("error_rate", TelemetryEvent::getErrorRate, false),
    THROUGHPUT("throughput", TelemetryEvent::getThroughput, true),
    CPU_UTIL("cpu_util", TelemetryEvent::getCpuUtil, false),
    MEMORY_UTIL("memory_util", TelemetryEvent::getMemoryUtil, false);

    private final String key;
    private final Function<TelemetryEvent, Double> accessor;
    private final boolean lowerIsWorse;

    TelemetryMetric(String key, Function<TelemetryEvent, Double> accessor, boolean lowerIsWorse) {
        this.key = key;
        this.accessor = accessor;
        this.lowerIsWorse = lowerIsWorse;
    }

    public String key() {
        return key;
    }

    /**
     * @return the metric value, or {@code null} when the optional metric was not reported
     */
    public Double valueOf(TelemetryEvent event) {
        return accessor.apply(event);
    }

    public boolean isLowerWorse() {
        return lowerIsWorse;
    }

    public static Optional<TelemetryMetric> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String normalized = key.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(m -> m.key.equals(normalized) || m.name().equalsIgnoreCase(normalized))
                .findFirst();
    }
}
