package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Business impact estimate produced by an external estimator.
 */
@Value
@Builder
public class BusinessImpact {

    double estimatedRevenueLoss;

    long affectedUsers;

    String severity;
}
