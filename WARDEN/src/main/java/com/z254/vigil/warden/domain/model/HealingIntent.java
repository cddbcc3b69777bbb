package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * Immutable, declarative proposal for a remediation action. Never an execution by itself.
 */
@Value
@Builder
public class HealingIntent {

    public static final int MAX_JUSTIFICATION_LENGTH = 1000;

    /** {@code intent_} followed by 16 hex chars of SHA-256(fingerprint:tool) */
    String intentId;

    String toolName;

    String component;

    String incidentId;

    String fingerprint;

    String policyName;

    /** Unmodifiable; keeps insertion order */
    @Singular
    Map<String, Object> parameters;

    String justification;

    /** Confidence in [0,1] */
    double confidence;

    RiskProfile riskProfile;

    Instant createdAt;
}
