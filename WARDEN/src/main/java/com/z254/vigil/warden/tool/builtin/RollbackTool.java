package com.z254.vigil.warden.tool.builtin;

import com.z254.vigil.warden.client.RemediationConnector;
import com.z254.vigil.warden.domain.model.SafetyLevel;
import com.z254.vigil.warden.policy.DefaultHealingPolicies;
import com.z254.vigil.warden.tool.ToolContext;
import com.z254.vigil.warden.tool.ToolMetadata;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Set;

/**
 * Rolls the target component back to a known-good revision. Refuses to run without one.
 */
@Component
public class RollbackTool extends ConnectorBackedTool {

    public static final String TARGET_REVISION = "target_revision";

    public RollbackTool(RemediationConnector connector) {
        super(connector, ToolMetadata.builder()
                .name(DefaultHealingPolicies.ROLLBACK)
                .description("Rolls the target component back to a known-good revision.")
                .safetyLevel(SafetyLevel.HIGH)
                .timeout(Duration.ofMinutes(5))
                .requiredPermissions(Set.of("deployment:rollback"))
                .defaultBlastRadius(4)
                .safeForBusinessHours(false)
                .build());
    }

    @Override
    public Mono<ValidationResult> validate(ToolContext context) {
        Object revision = context.parameter(TARGET_REVISION);
        if (revision == null || revision.toString().isBlank()) {
            return Mono.just(ValidationResult.failure("No backup exists: target_revision is required for rollback"));
        }
        return Mono.just(ValidationResult.success());
    }
}
