package com.z254.vigil.warden.validation;

import lombok.Getter;

/**
 * Raised when a raw telemetry record fails normalization or range checks.
 */
@Getter
public class EventValidationException extends RuntimeException {

    private final String field;
    private final String reason;

    public EventValidationException(String field, String reason) {
        super(field + ": " + reason);
        this.field = field;
        this.reason = reason;
    }
}
