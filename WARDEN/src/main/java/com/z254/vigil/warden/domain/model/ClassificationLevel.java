package com.z254.vigil.warden.domain.model;

/**
 * Anomaly classification buckets ordered by increasing severity.
 */
public enum ClassificationLevel {
    NORMAL(0.0),
    DEGRADING(0.3),
    CRITICAL(0.6),
    SYSTEMIC(0.85);

    private final double lowerBound;

    ClassificationLevel(double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public double lowerBound() {
        return lowerBound;
    }

    public static ClassificationLevel fromScore(double score) {
        if (score >= SYSTEMIC.lowerBound) {
            return SYSTEMIC;
        }
        if (score >= CRITICAL.lowerBound) {
            return CRITICAL;
        }
        if (score >= DEGRADING.lowerBound) {
            return DEGRADING;
        }
        return NORMAL;
    }

    public boolean isAtLeast(ClassificationLevel other) {
        return compareTo(other) >= 0;
    }
}
