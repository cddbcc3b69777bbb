package com.z254.vigil.warden.api.dto;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Error body returned by the REST layer.
 */
@Data
@Builder
public class ErrorResponse {
    private int status;
    private String error;
    private String message;
    private Instant timestamp;
}
