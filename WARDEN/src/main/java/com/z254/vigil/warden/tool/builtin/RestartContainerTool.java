package com.z254.vigil.warden.tool.builtin;

import com.z254.vigil.warden.client.RemediationConnector;
import com.z254.vigil.warden.domain.model.SafetyLevel;
import com.z254.vigil.warden.policy.DefaultHealingPolicies;
import com.z254.vigil.warden.tool.ToolMetadata;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;

/**
 * Restarts the containers of the target component.
 */
@Component
public class RestartContainerTool extends ConnectorBackedTool {

    public RestartContainerTool(RemediationConnector connector) {
        super(connector, ToolMetadata.builder()
                .name(DefaultHealingPolicies.RESTART_CONTAINER)
                .description("Restarts the containers of the target component.")
                .safetyLevel(SafetyLevel.MEDIUM)
                .timeout(Duration.ofSeconds(60))
                .requiredPermissions(Set.of("workload:restart"))
                .defaultBlastRadius(1)
                .safeForBusinessHours(false)
                .build());
    }
}
