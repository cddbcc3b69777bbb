package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Result object returned for every ingested telemetry record.
 */
@Value
@Builder
public class PipelineResult {

    PipelineStatus status;

    String incidentId;

    AnomalyClassification classification;

    @Builder.Default
    List<HealingIntent> healingIntents = List.of();

    @Builder.Default
    List<GatewayResponse> gatewayResponses = List.of();

    BusinessImpact businessImpact;

    RecallContext recallContext;

    /** Offending field when {@link #status} is REJECTED */
    String rejectedField;

    String rejectionReason;
}
