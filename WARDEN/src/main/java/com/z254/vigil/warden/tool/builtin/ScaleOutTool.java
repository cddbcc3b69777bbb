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
 * Adds replicas to the target component. The {@code instances} parameter is the number of
 * replicas to add and doubles as the action's blast radius.
 */
@Component
public class ScaleOutTool extends ConnectorBackedTool {

    public static final String INSTANCES = "instances";
    static final int MAX_INSTANCES = 10;

    public ScaleOutTool(RemediationConnector connector) {
        super(connector, ToolMetadata.builder()
                .name(DefaultHealingPolicies.SCALE_OUT)
                .description("Adds replicas to the target component.")
                .safetyLevel(SafetyLevel.LOW)
                .timeout(Duration.ofSeconds(120))
                .requiredPermissions(Set.of("workload:scale"))
                .defaultBlastRadius(2)
                .safeForBusinessHours(true)
                .build());
    }

    @Override
    public Mono<ValidationResult> validate(ToolContext context) {
        if (context.parameter(INSTANCES) == null) {
            return Mono.just(ValidationResult.success());
        }
        Integer instances = intParameter(context, INSTANCES);
        if (instances == null || instances < 1 || instances > MAX_INSTANCES) {
            return Mono.just(ValidationResult.failure(
                    "instances must be between 1 and " + MAX_INSTANCES + ", got " + context.parameter(INSTANCES)));
        }
        return Mono.just(ValidationResult.success());
    }
}
