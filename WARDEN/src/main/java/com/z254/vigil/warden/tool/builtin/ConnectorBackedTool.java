package com.z254.vigil.warden.tool.builtin;

import com.z254.vigil.warden.client.RemediationConnector;
import com.z254.vigil.warden.client.RemediationConnector.ConnectorRequest;
import com.z254.vigil.warden.tool.RemediationTool;
import com.z254.vigil.warden.tool.ToolContext;
import com.z254.vigil.warden.tool.ToolMetadata;
import com.z254.vigil.warden.tool.ToolResult;
import reactor.core.publisher.Mono;

import java.util.HashMap;

/**
 * Base for built-in tools that hand the action to the {@link RemediationConnector}.
 */
public abstract class ConnectorBackedTool implements RemediationTool {

    private final RemediationConnector connector;
    private final ToolMetadata metadata;

    protected ConnectorBackedTool(RemediationConnector connector, ToolMetadata metadata) {
        this.connector = connector;
        this.metadata = metadata;
    }

    @Override
    public ToolMetadata getMetadata() {
        return metadata;
    }

    @Override
    public Mono<ToolResult> execute(ToolContext context) {
        ConnectorRequest request = ConnectorRequest.builder()
                .intentId(context.getIntentId())
                .action(metadata.getName())
                .targetComponent(context.getComponent())
                .parameters(new HashMap<>(context.getParameters()))
                .approvedBy(context.getApprovedBy())
                .timeoutMs(metadata.getTimeout().toMillis())
                .build();

        return connector.execute(request)
                .map(result -> ToolResult.builder()
                        .toolName(metadata.getName())
                        .success(result.isSuccess())
                        .output(result.getMessage())
                        .errorCode(result.isSuccess() ? null : "CONNECTOR_FAILURE")
                        .errorMessage(result.getErrorMessage())
                        .externalActionId(result.getActionId())
                        .details(result.getDetails())
                        .build());
    }

    protected static Integer intParameter(ToolContext context, String key) {
        Object value = context.parameter(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
