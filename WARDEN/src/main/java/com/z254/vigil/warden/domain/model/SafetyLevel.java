package com.z254.vigil.warden.domain.model;

/**
 * Inherent risk of executing a remediation tool.
 */
public enum SafetyLevel {
    LOW(0.2),
    MEDIUM(0.5),
    HIGH(0.8);

    private final double riskWeight;

    SafetyLevel(double riskWeight) {
        this.riskWeight = riskWeight;
    }

    public double riskWeight() {
        return riskWeight;
    }
}
