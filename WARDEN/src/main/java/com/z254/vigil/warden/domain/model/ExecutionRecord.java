package com.z254.vigil.warden.domain.model;

import com.z254.vigil.warden.config.WardenProperties.ExecutionMode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only audit entry for one safety gateway decision.
 */
@Value
@Builder
public class ExecutionRecord {

    /** Monotonic per gateway instance */
    long sequence;

    String intentId;

    String toolName;

    String component;

    String justification;

    ExecutionMode mode;

    boolean validationPassed;

    String validationReason;

    GatewayStatus status;

    String approvalId;

    /** Sequence of the original record when this entry documents a duplicate submission */
    Long duplicateOf;

    String detail;

    Instant submittedAt;

    Instant decidedAt;
}
