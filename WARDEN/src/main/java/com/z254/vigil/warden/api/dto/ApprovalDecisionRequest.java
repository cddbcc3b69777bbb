package com.z254.vigil.warden.api.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Body of approve and reject calls.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ApprovalDecisionRequest {

    @NotBlank
    private String approver;

    /** Optional, recorded on rejection */
    private String reason;
}
