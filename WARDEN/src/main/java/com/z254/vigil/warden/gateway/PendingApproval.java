package com.z254.vigil.warden.gateway;

import com.z254.vigil.warden.domain.model.HealingIntent;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Approval-mode request waiting for a human decision.
 */
@Value
@Builder
public class PendingApproval {

    String approvalId;

    HealingIntent intent;

    /** Gateway-side state of the request, resumed on resolution */
    GatewayRequest request;

    Instant requestedAt;

    Instant expiresAt;

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }
}
