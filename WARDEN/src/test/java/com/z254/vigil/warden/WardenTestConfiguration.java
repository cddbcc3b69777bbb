package com.z254.vigil.warden;

import com.z254.vigil.warden.client.RemediationConnector;
import com.z254.vigil.warden.config.ExecutionEntitlement;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Primary;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Test configuration for WARDEN integration tests.
 * Grants execution capability and answers every remediation with success instead of
 * calling the external connector.
 */
@TestConfiguration
public class WardenTestConfiguration {

    @Bean
    @Primary
    public ExecutionEntitlement testEntitlement() {
        return new ExecutionEntitlement() {
            @Override
            public boolean isExecutionPermitted() {
                return true;
            }

            @Override
            public String source() {
                return "test";
            }
        };
    }

    @Bean
    @Primary
    public RemediationConnector stubConnector() {
        return request -> Mono.just(RemediationConnector.ConnectorResult.builder()
                .success(true)
                .actionId("act_" + request.getIntentId())
                .message(request.getAction() + " applied to " + request.getTargetComponent())
                .details(Map.of("stub", true))
                .build());
    }
}
