package com.z254.vigil.warden.api.dto;

import com.z254.vigil.warden.gateway.PendingApproval;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.Map;

/**
 * Pending approval as exposed over REST.
 */
@Data
@Builder
public class PendingApprovalDto {
    private String approvalId;
    private String intentId;
    private String toolName;
    private String component;
    private String policyName;
    private String justification;
    private double confidence;
    private Map<String, Object> parameters;
    private Instant requestedAt;
    private Instant expiresAt;

    public static PendingApprovalDto from(PendingApproval approval) {
        return PendingApprovalDto.builder()
                .approvalId(approval.getApprovalId())
                .intentId(approval.getIntent().getIntentId())
                .toolName(approval.getIntent().getToolName())
                .component(approval.getIntent().getComponent())
                .policyName(approval.getIntent().getPolicyName())
                .justification(approval.getIntent().getJustification())
                .confidence(approval.getIntent().getConfidence())
                .parameters(approval.getIntent().getParameters())
                .requestedAt(approval.getRequestedAt())
                .expiresAt(approval.getExpiresAt())
                .build();
    }
}
