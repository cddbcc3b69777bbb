package com.z254.vigil.warden.policy;

import lombok.Getter;

/**
 * A single policy is malformed and was skipped.
 */
@Getter
public class PolicyEvaluationException extends RuntimeException {

    private final String policyName;

    public PolicyEvaluationException(String policyName, String message) {
        super("Policy '" + policyName + "': " + message);
        this.policyName = policyName;
    }
}
