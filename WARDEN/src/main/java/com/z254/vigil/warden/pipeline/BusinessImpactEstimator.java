package com.z254.vigil.warden.pipeline;

import com.z254.vigil.warden.domain.model.AnomalyClassification;
import com.z254.vigil.warden.domain.model.BusinessImpact;
import com.z254.vigil.warden.domain.model.TelemetryEvent;

/**
 * External collaborator that prices an anomaly. When no bean is present the pipeline leaves
 * {@code businessImpact} empty.
 */
@FunctionalInterface
public interface BusinessImpactEstimator {

    BusinessImpact estimate(TelemetryEvent event, AnomalyClassification classification);
}
