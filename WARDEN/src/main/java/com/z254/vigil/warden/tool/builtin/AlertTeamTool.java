package com.z254.vigil.warden.tool.builtin;

import com.z254.vigil.warden.client.RemediationConnector;
import com.z254.vigil.warden.domain.model.SafetyLevel;
import com.z254.vigil.warden.policy.DefaultHealingPolicies;
import com.z254.vigil.warden.tool.ToolMetadata;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

/**
 * Pages the owning team. Safe at any hour.
 */
@Component
public class AlertTeamTool extends ConnectorBackedTool {

    public AlertTeamTool(RemediationConnector connector) {
        super(connector, ToolMetadata.builder()
                .name(DefaultHealingPolicies.ALERT_TEAM)
                .description("Pages the owning team of the target component.")
                .safetyLevel(SafetyLevel.LOW)
                .timeout(Duration.ofSeconds(10))
                .requiredPermissions(Set.of("alerting:page"))
                .defaultBlastRadius(0)
                .safeForBusinessHours(true)
                .build());
    }
}
