package com.z254.vigil.warden.policy;

import com.z254.vigil.warden.domain.model.HealingPolicy;
import com.z254.vigil.warden.domain.model.PolicyCondition;

import java.time.Duration;
import java.util.List;

import static com.z254.vigil.warden.domain.model.ComparisonOperator.GREATER_THAN;
import static com.z254.vigil.warden.domain.model.ComparisonOperator.LESS_THAN;
import static com.z254.vigil.warden.domain.model.TelemetryMetric.CPU_UTIL;
import static com.z254.vigil.warden.domain.model.TelemetryMetric.ERROR_RATE;
import static com.z254.vigil.warden.domain.model.TelemetryMetric.LATENCY_P99;
import static com.z254.vigil.warden.domain.model.TelemetryMetric.MEMORY_UTIL;

/**
 * Built-in policy catalog used when no policies are configured.
 */
public final class DefaultHealingPolicies {

    public static final String RESTART_CONTAINER = "restart_container";
    public static final String SCALE_OUT = "scale_out";
    public static final String TRAFFIC_SHIFT = "traffic_shift";
    public static final String CIRCUIT_BREAKER = "circuit_breaker";
    public static final String ROLLBACK = "rollback";
    public static final String ALERT_TEAM = "alert_team";

    private DefaultHealingPolicies() {
    }

    public static List<HealingPolicy> defaults(Duration cooldown, int maxExecutionsPerHour) {
        return List.of(
                HealingPolicy.builder()
                        .name("high_latency_restart")
                        .conditions(List.of(
                                PolicyCondition.of(LATENCY_P99, GREATER_THAN, 300),
                                PolicyCondition.of(ERROR_RATE, LESS_THAN, 0.1)))
                        .actions(List.of(RESTART_CONTAINER))
                        .priority(2)
                        .cooldown(cooldown)
                        .maxExecutionsPerHour(maxExecutionsPerHour)
                        .build(),
                HealingPolicy.builder()
                        .name("cascading_failure")
                        .conditions(List.of(PolicyCondition.of(ERROR_RATE, GREATER_THAN, 0.15)))
                        .actions(List.of(CIRCUIT_BREAKER, ALERT_TEAM))
                        .priority(1)
                        .cooldown(cooldown)
                        .maxExecutionsPerHour(maxExecutionsPerHour)
                        .build(),
                HealingPolicy.builder()
                        .name("resource_exhaustion")
                        .conditions(List.of(
                                PolicyCondition.of(CPU_UTIL, GREATER_THAN, 0.85),
                                PolicyCondition.of(MEMORY_UTIL, GREATER_THAN, 0.85)))
                        .actions(List.of(SCALE_OUT, ALERT_TEAM))
                        .priority(1)
                        .cooldown(cooldown)
                        .maxExecutionsPerHour(maxExecutionsPerHour)
                        .build(),
                HealingPolicy.builder()
                        .name("moderate_performance_issue")
                        .conditions(List.of(
                                PolicyCondition.of(LATENCY_P99, GREATER_THAN, 200),
                                PolicyCondition.of(ERROR_RATE, GREATER_THAN, 0.05)))
                        .actions(List.of(TRAFFIC_SHIFT))
                        .priority(3)
                        .cooldown(cooldown)
                        .maxExecutionsPerHour(maxExecutionsPerHour)
                        .build(),
                HealingPolicy.builder()
                        .name("critical_failure")
                        .conditions(List.of(
                                PolicyCondition.of(LATENCY_P99, GREATER_THAN, 500),
                                PolicyCondition.of(ERROR_RATE, GREATER_THAN, 0.1)))
                        .actions(List.of(RESTART_CONTAINER, ALERT_TEAM, TRAFFIC_SHIFT))
                        .priority(1)
                        .cooldown(cooldown)
                        .maxExecutionsPerHour(maxExecutionsPerHour)
                        .build());
    }
}
