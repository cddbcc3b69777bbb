package com.z254.vigil.warden.tool;

import reactor.core.publisher.Mono;

/**
 * Capability interface every pluggable remediation tool implements.
 * Tools are only ever invoked by the safety gateway.
 */
public interface RemediationTool {

    /**
     * Static descriptor: name, safety level, timeout and required permissions.
     */
    ToolMetadata getMetadata();

    /**
     * Tool-specific precondition checks run before any approval or execution.
     *
     * @param context the request context
     * @return validation result
     */
    default Mono<ValidationResult> validate(ToolContext context) {
        return Mono.just(ValidationResult.success());
    }

    /**
     * Perform the action. The gateway bounds this call by {@link ToolMetadata#getTimeout()}.
     *
     * @param context the request context
     * @return tool result
     */
    Mono<ToolResult> execute(ToolContext context);

    default String getName() {
        return getMetadata().getName();
    }

    /**
     * Precondition validation result.
     */
    record ValidationResult(
            boolean valid,
            String message
    ) {
        public static ValidationResult success() {
            return new ValidationResult(true, null);
        }

        public static ValidationResult failure(String message) {
            return new ValidationResult(false, message);
        }
    }
}
