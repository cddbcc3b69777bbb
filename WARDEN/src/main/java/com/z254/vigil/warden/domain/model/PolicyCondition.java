package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Single threshold test of a policy. Metric and operator are kept as configured and resolved
 * when the policy is evaluated, so one bad entry only disables its own policy.
 */
@Value
@Builder
public class PolicyCondition {

    String metric;

    String operator;

    Double threshold;

    public static PolicyCondition of(TelemetryMetric metric, ComparisonOperator operator, double threshold) {
        return new PolicyCondition(metric.key(), operator.symbol(), threshold);
    }

    @Override
    public String toString() {
        return metric + " " + operator + " " + threshold;
    }
}
