package com.z254.vigil.warden.tool;

import com.z254.vigil.warden.domain.model.SafetyLevel;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.Set;

/**
 * Static description of a remediation tool.
 */
@Value
@Builder
public class ToolMetadata {

    String name;

    String description;

    SafetyLevel safetyLevel;

    Duration timeout;

    @Builder.Default
    Set<String> requiredPermissions = Set.of();

    /** Components or instances affected when no explicit instance count is given */
    int defaultBlastRadius;

    /** Whether the tool may run while a business-hours restriction is active */
    boolean safeForBusinessHours;
}
