package com.z254.vigil.warden.domain.model;

import com.z254.vigil.warden.config.WardenProperties.ExecutionMode;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Outcome of one gateway submission or approval resolution.
 */
@Value
@Builder(toBuilder = true)
public class GatewayResponse {

    String intentId;

    String toolName;

    String component;

    GatewayStatus status;

    ExecutionMode mode;

    /** Present while an approval is pending or after it was resolved */
    String approvalId;

    /** Human-readable denial or failure reason */
    String reason;

    /** Set on advisory responses whose validation passed */
    boolean wouldExecute;

    /** True when the intent id had already been submitted */
    boolean duplicate;

    /** Sequence of the audit record written for this decision */
    long auditSequence;

    /** Tool output for COMPLETED and FAILED executions */
    Map<String, Object> result;

    public boolean isDenied() {
        return status == GatewayStatus.DENIED;
    }
}
