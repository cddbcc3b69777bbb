package com.z254.vigil.warden.resilience;

/**
 * States of a {@link ResourceCircuitBreaker}.
 */
public enum BreakerState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
