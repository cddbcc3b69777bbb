package com.z254.vigil.warden.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Operator report of a remediation performed outside the gateway.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ManualOutcomeRequest {

    @NotBlank
    private String incidentId;

    @NotEmpty
    private List<@NotBlank String> actions;

    @NotNull
    private Boolean success;

    @PositiveOrZero
    private double durationMinutes;

    private String lessonsLearned;
}
