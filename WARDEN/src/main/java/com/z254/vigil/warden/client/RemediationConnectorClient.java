package com.z254.vigil.warden.client;

import com.z254.vigil.warden.config.WardenProperties;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * HTTP client for the remediation-execution service.
 * <p>
 * Only reached through the safety gateway, after validation and only when the deployment holds
 * execution capability. Every call is bounded by {@code warden.connector.timeout}.
 */
@Slf4j
@Component
public class RemediationConnectorClient implements RemediationConnector {

    private final WebClient webClient;
    private final Duration timeout;

    public RemediationConnectorClient(WebClient.Builder webClientBuilder, WardenProperties properties) {
        this.webClient = webClientBuilder
                .baseUrl(properties.getConnector().getUrl())
                .build();
        this.timeout = properties.getConnector().getTimeout();
    }

    @Override
    public Mono<ConnectorResult> execute(ConnectorRequest request) {
        log.info("Dispatching remediation: intentId={}, action={}, target={}",
                request.getIntentId(), request.getAction(), request.getTargetComponent());

        Map<String, Object> body = new HashMap<>();
        body.put("action", request.getAction());
        body.put("targetComponent", request.getTargetComponent());
        body.put("parameters", request.getParameters());
        body.put("idempotencyKey", request.getIntentId());
        body.put("approvedBy", request.getApprovedBy());
        body.put("timeoutMs", request.getTimeoutMs());

        return webClient.post()
                .uri("/api/v1/actions")
                .bodyValue(body)
                .retrieve()
                .bodyToMono(ActionResponse.class)
                .timeout(timeout)
                .map(this::toResult)
                .doOnSuccess(result ->
                        log.info("Remediation result: intentId={}, actionId={}, success={}",
                                request.getIntentId(), result.getActionId(), result.isSuccess()))
                .doOnError(error ->
                        log.error("Remediation dispatch failed: intentId={}, error={}",
                                request.getIntentId(), error.getMessage()));
    }

    private ConnectorResult toResult(ActionResponse response) {
        return ConnectorResult.builder()
                .success("COMPLETED".equals(response.getStatus()) || "SUCCESS".equals(response.getStatus()))
                .actionId(response.getActionId())
                .message(response.getMessage())
                .errorMessage(response.getError())
                .details(response.getDetails())
                .build();
    }

    @Data
    private static class ActionResponse {
        private String actionId;
        private String status;
        private String message;
        private String error;
        private Map<String, Object> details;
    }
}
