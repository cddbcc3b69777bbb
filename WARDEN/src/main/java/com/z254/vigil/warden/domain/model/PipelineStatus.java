package com.z254.vigil.warden.domain.model;

/**
 * Overall outcome of processing one telemetry record.
 */
public enum PipelineStatus {
    /** Record failed validation and was dropped */
    REJECTED,
    /** Event classified NORMAL, no policies evaluated */
    NORMAL,
    /** Event classified as an anomaly and routed through policies and the gateway */
    ANOMALY
}
