package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Canonical, validated telemetry event.
 * <p>
 * Instances are only produced by the event validator. The fingerprint covers every canonical
 * field except {@link #receivedAt}, so identical reports map to the same incident.
 */
@Value
@Builder
public class TelemetryEvent {

    /** Service component token, lowercase alphanumerics and hyphens */
    String component;

    /** 99th percentile latency in milliseconds */
    double latencyP99;

    /** Error rate fraction in [0,1] */
    double errorRate;

    /** Requests per second */
    double throughput;

    /** CPU utilization fraction, optional */
    Double cpuUtil;

    /** Memory utilization fraction, optional */
    Double memoryUtil;

    EventSeverity severity;

    /** Hex SHA-256 over the canonical encoding */
    String fingerprint;

    Instant receivedAt;

    /**
     * Deterministic incident identifier derived from the fingerprint.
     */
    public String incidentId() {
        return "inc_" + fingerprint.substring(0, 16);
    }
}
