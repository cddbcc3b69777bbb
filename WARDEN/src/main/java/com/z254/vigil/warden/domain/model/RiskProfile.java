package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Risk attributes of a proposed action, checked by the safety gateway.
 */
@Value
@Builder
public class RiskProfile {

    SafetyLevel safetyLevel;

    /** Number of components or instances the action would affect */
    int blastRadius;

    boolean safeForBusinessHours;

    /** Combined risk in [0,1] */
    double riskScore;
}
