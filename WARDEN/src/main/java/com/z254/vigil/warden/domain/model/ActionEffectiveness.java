package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Historical success of one action on one component.
 */
@Value
@Builder
public class ActionEffectiveness {

    String action;

    int attempts;

    int successes;

    public double getSuccessRate() {
        return attempts == 0 ? 0.0 : (double) successes / attempts;
    }
}
