package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Deterministic rule mapping a classified event to candidate actions.
 * All conditions must hold for the policy to fire.
 */
@Value
@Builder
public class HealingPolicy {

    String name;

    List<PolicyCondition> conditions;

    /** Tool names in the order they are proposed */
    List<String> actions;

    /** Lower values evaluate first */
    int priority;

    Duration cooldown;

    int maxExecutionsPerHour;

    /** Lowest classification at which the policy is eligible */
    @Builder.Default
    ClassificationLevel minimumLevel = ClassificationLevel.DEGRADING;

    /** Stops evaluation of lower-priority policies once fired */
    boolean terminal;

    @Builder.Default
    boolean enabled = true;
}
