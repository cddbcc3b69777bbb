package com.z254.vigil.warden.resilience;

import lombok.Getter;

/**
 * Thrown instead of invoking a protected resource while its breaker rejects calls.
 */
@Getter
public class CircuitOpenException extends RuntimeException {

    private final String resource;

    public CircuitOpenException(String resource) {
        super("Circuit open for " + resource);
        this.resource = resource;
    }
}
