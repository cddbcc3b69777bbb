package com.z254.vigil.warden.domain.model;

/**
 * Reporter-declared severity of a telemetry event.
 */
public enum EventSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
