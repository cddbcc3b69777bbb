package com.z254.vigil.warden.tool;

import com.z254.vigil.warden.config.WardenProperties.ExecutionMode;
import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Inputs handed to a tool for validation and execution.
 */
@Value
@Builder
public class ToolContext {

    String intentId;

    String component;

    @Builder.Default
    Map<String, Object> parameters = Map.of();

    ExecutionMode mode;

    /** Approver identity for approval-mode executions */
    String approvedBy;

    public Object parameter(String key) {
        return parameters.get(key);
    }
}
