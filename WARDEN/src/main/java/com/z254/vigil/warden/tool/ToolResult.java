package com.z254.vigil.warden.tool;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Result of a tool execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolResult {

    private String toolName;

    private boolean success;

    private String output;

    /** Error code for failed executions */
    private String errorCode;

    private String errorMessage;

    /** Identifier assigned by the execution collaborator */
    private String externalActionId;

    private Duration duration;

    private Map<String, Object> details;

    public static ToolResult success(String toolName, String output) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(true)
                .output(output)
                .build();
    }

    public static ToolResult failure(String toolName, String errorCode, String errorMessage) {
        return ToolResult.builder()
                .toolName(toolName)
                .success(false)
                .errorCode(errorCode)
                .errorMessage(errorMessage)
                .build();
    }

    /**
     * Flattened view used in gateway responses and audit details.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new HashMap<>();
        map.put("tool", toolName);
        map.put("success", success);
        if (output != null) map.put("output", output);
        if (errorCode != null) map.put("errorCode", errorCode);
        if (errorMessage != null) map.put("errorMessage", errorMessage);
        if (externalActionId != null) map.put("externalActionId", externalActionId);
        if (duration != null) map.put("durationMs", duration.toMillis());
        if (details != null) map.put("details", details);
        return map;
    }
}
