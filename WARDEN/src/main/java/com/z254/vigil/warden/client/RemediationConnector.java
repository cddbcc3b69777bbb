package com.z254.vigil.warden.client;

import lombok.Builder;
import lombok.Data;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * Remediation-execution collaborator that performs the actual healing action.
 */
public interface RemediationConnector {

    Mono<ConnectorResult> execute(ConnectorRequest request);

    @Data
    @Builder
    class ConnectorRequest {
        /** Intent id, reused as idempotency key by the collaborator */
        private String intentId;
        private String action;
        private String targetComponent;
        @Builder.Default
        private Map<String, Object> parameters = new HashMap<>();
        private String approvedBy;
        private long timeoutMs;
    }

    @Data
    @Builder
    class ConnectorResult {
        private boolean success;
        private String actionId;
        private String message;
        private String errorMessage;
        private Map<String, Object> details;
    }
}
