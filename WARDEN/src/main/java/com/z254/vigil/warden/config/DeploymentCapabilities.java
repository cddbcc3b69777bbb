package com.z254.vigil.warden.config;

import lombok.Builder;
import lombok.Value;

/**
 * Immutable capability descriptor resolved once at startup and handed to the safety gateway.
 * All execution gating reads from this object only.
 */
@Value
@Builder
public class DeploymentCapabilities {

    /** Whether any request may reach EXECUTING */
    boolean executionPermitted;

    /** Where {@link #executionPermitted} came from */
    String source;

    public static DeploymentCapabilities advisoryOnly() {
        return DeploymentCapabilities.builder()
                .executionPermitted(false)
                .source("none")
                .build();
    }

    public static DeploymentCapabilities from(ExecutionEntitlement entitlement) {
        if (entitlement == null) {
            return advisoryOnly();
        }
        return DeploymentCapabilities.builder()
                .executionPermitted(entitlement.isExecutionPermitted())
                .source(entitlement.source())
                .build();
    }
}
