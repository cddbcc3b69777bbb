package com.z254.vigil.warden.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a request inside the safety gateway.
 * <pre>
 * RECEIVED -> VALIDATING -> {DENIED | PENDING_APPROVAL | APPROVED}
 * PENDING_APPROVAL -> {APPROVED | DENIED}
 * APPROVED -> {ADVISORY_ONLY | EXECUTING}
 * EXECUTING -> {COMPLETED | FAILED}
 * </pre>
 */
public enum GatewayStatus {
    RECEIVED,
    VALIDATING,
    DENIED,
    PENDING_APPROVAL,
    APPROVED,
    ADVISORY_ONLY,
    EXECUTING,
    COMPLETED,
    FAILED;

    public Set<GatewayStatus> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(VALIDATING);
            case VALIDATING -> EnumSet.of(DENIED, PENDING_APPROVAL, APPROVED);
            case PENDING_APPROVAL -> EnumSet.of(APPROVED, DENIED);
            case APPROVED -> EnumSet.of(ADVISORY_ONLY, EXECUTING);
            case EXECUTING -> EnumSet.of(COMPLETED, FAILED);
            case DENIED, ADVISORY_ONLY, COMPLETED, FAILED -> EnumSet.noneOf(GatewayStatus.class);
        };
    }

    public boolean canTransitionTo(GatewayStatus next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
