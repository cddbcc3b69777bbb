package com.z254.vigil.warden.memory;

import java.util.function.Function;

/**
 * Result of a guarded memory call: either a value or an explicit "memory unavailable" marker.
 *
 * @param value  present when available
 * @param reason why memory was unavailable
 */
public record MemoryResponse<T>(T value, String reason) {

    public static <T> MemoryResponse<T> available(T value) {
        return new MemoryResponse<>(value, null);
    }

    public static <T> MemoryResponse<T> unavailable(String reason) {
        return new MemoryResponse<>(null, reason);
    }

    public boolean isAvailable() {
        return reason == null;
    }

    public T orElse(T fallback) {
        return isAvailable() ? value : fallback;
    }

    /**
     * @throws MemoryUnavailableException carrying {@link #reason()} when unavailable
     */
    public T orElseThrow() {
        if (!isAvailable()) {
            throw new MemoryUnavailableException(reason);
        }
        return value;
    }

    public <R> MemoryResponse<R> map(Function<T, R> mapper) {
        return isAvailable() ? available(mapper.apply(value)) : unavailable(reason);
    }
}
