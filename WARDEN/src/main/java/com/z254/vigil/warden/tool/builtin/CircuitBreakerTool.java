package com.z254.vigil.warden.tool.builtin;

import com.z254.vigil.warden.client.RemediationConnector;
import com.z254.vigil.warden.domain.model.SafetyLevel;
import com.z254.vigil.warden.policy.DefaultHealingPolicies;
import com.z254.vigil.warden.tool.ToolMetadata;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

@Component
public class CircuitBreakerTool extends ConnectorBackedTool {

    public CircuitBreakerTool(RemediationConnector connector) {
        super(connector, ToolMetadata.builder()
                .name(DefaultHealingPolicies.CIRCUIT_BREAKER)
                .description("Opens the service-mesh circuit breaker in front of the target component.")
                .safetyLevel(SafetyLevel.MEDIUM)
                .timeout(Duration.ofSeconds(30))
                .requiredPermissions(Set.of("traffic:circuit-break"))
                .defaultBlastRadius(2)
                .safeForBusinessHours(false)
                .build());
    }
}
