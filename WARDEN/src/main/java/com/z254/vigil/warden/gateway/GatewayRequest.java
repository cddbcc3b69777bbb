package com.z254.vigil.warden.gateway;

import com.z254.vigil.warden.config.WardenProperties.ExecutionMode;
import com.z254.vigil.warden.domain.model.GatewayStatus;
import com.z254.vigil.warden.domain.model.HealingIntent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State machine of one submitted action request. Illegal transitions throw.
 */
public class GatewayRequest {

    private final HealingIntent intent;
    private final ExecutionMode mode;
    private final Instant submittedAt;
    private final List<GatewayStatus> history = new ArrayList<>();
    private GatewayStatus status = GatewayStatus.RECEIVED;

    public GatewayRequest(HealingIntent intent, ExecutionMode mode, Instant submittedAt) {
        this.intent = intent;
        this.mode = mode;
        this.submittedAt = submittedAt;
        history.add(status);
    }

    public synchronized void transitionTo(GatewayStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal gateway transition " + status + " -> " + next
                    + " for intent " + intent.getIntentId());
        }
        status = next;
        history.add(next);
    }

    public synchronized GatewayStatus getStatus() {
        return status;
    }

    public synchronized List<GatewayStatus> getHistory() {
        return List.copyOf(history);
    }

    public HealingIntent getIntent() {
        return intent;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }
}
