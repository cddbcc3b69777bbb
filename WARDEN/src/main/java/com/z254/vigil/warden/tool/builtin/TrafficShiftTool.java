package com.z254.vigil.warden.tool.builtin;

import com.z254.vigil.warden.client.RemediationConnector;
import com.z254.vigil.warden.domain.model.SafetyLevel;
import com.z254.vigil.warden.policy.DefaultHealingPolicies;
import com.z254.vigil.warden.tool.ToolMetadata;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

@Component
public class TrafficShiftTool extends ConnectorBackedTool {

    public TrafficShiftTool(RemediationConnector connector) {
        super(connector, ToolMetadata.builder()
                .name(DefaultHealingPolicies.TRAFFIC_SHIFT)
                .description("Shifts traffic away from the target component to healthy replicas.")
                .safetyLevel(SafetyLevel.MEDIUM)
                .timeout(Duration.ofSeconds(60))
                .requiredPermissions(Set.of("traffic:shift"))
                .defaultBlastRadius(3)
                .safeForBusinessHours(false)
                .build());
    }
}
