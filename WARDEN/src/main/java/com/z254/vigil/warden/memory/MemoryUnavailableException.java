package com.z254.vigil.warden.memory;

/**
 * Memory could not answer: breaker open or query failure. Raised only where a caller
 * needs the value itself; the pipeline consumes {@link MemoryResponse} instead.
 */
public class MemoryUnavailableException extends RuntimeException {

    public MemoryUnavailableException(String reason) {
        super(reason);
    }
}
