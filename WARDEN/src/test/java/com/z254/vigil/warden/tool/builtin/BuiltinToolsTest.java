package com.z254.vigil.warden.tool.builtin;

import com.z254.vigil.warden.client.RemediationConnector;
import com.z254.vigil.warden.client.RemediationConnector.ConnectorRequest;
import com.z254.vigil.warden.client.RemediationConnector.ConnectorResult;
import com.z254.vigil.warden.config.WardenProperties.ExecutionMode;
import com.z254.vigil.warden.tool.RemediationTool;
import com.z254.vigil.warden.tool.ToolContext;
import com.z254.vigil.warden.tool.ToolRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the connector-backed built-in tools.
 */
@ExtendWith(MockitoExtension.class)
class BuiltinToolsTest {

    @Mock
    private RemediationConnector connector;

    private static ToolContext context(Map<String, Object> parameters) {
        return ToolContext.builder()
                .intentId("intent_0123456789abcdef")
                .component("api-service")
                .parameters(parameters)
                .mode(ExecutionMode.APPROVAL)
                .approvedBy("alice")
                .build();
    }

    @Nested
    @DisplayName("Execution")
    class Execution {

        @Test
        @DisplayName("should forward the intent to the connector and map a success")
        void forwardsSuccess() {
            when(connector.execute(any())).thenReturn(Mono.just(ConnectorResult.builder()
                    .success(true)
                    .actionId("act_1")
                    .message("scaled to 4 replicas")
                    .build()));

            StepVerifier.create(new ScaleOutTool(connector).execute(context(Map.of("instances", 2))))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isTrue();
                        assertThat(result.getOutput()).isEqualTo("scaled to 4 replicas");
                        assertThat(result.getExternalActionId()).isEqualTo("act_1");
                    })
                    .verifyComplete();

            ArgumentCaptor<ConnectorRequest> request = ArgumentCaptor.forClass(ConnectorRequest.class);
            verify(connector).execute(request.capture());
            assertThat(request.getValue().getIntentId()).isEqualTo("intent_0123456789abcdef");
            assertThat(request.getValue().getAction()).isEqualTo("scale_out");
            assertThat(request.getValue().getTargetComponent()).isEqualTo("api-service");
            assertThat(request.getValue().getApprovedBy()).isEqualTo("alice");
            assertThat(request.getValue().getParameters()).containsEntry("instances", 2);
            assertThat(request.getValue().getTimeoutMs()).isEqualTo(120_000);
        }

        @Test
        @DisplayName("should map a connector failure to a failed result")
        void mapsFailure() {
            when(connector.execute(any())).thenReturn(Mono.just(ConnectorResult.builder()
                    .success(false)
                    .errorMessage("mesh unreachable")
                    .build()));

            StepVerifier.create(new CircuitBreakerTool(connector).execute(context(Map.of())))
                    .assertNext(result -> {
                        assertThat(result.isSuccess()).isFalse();
                        assertThat(result.getErrorCode()).isEqualTo("CONNECTOR_FAILURE");
                        assertThat(result.getErrorMessage()).isEqualTo("mesh unreachable");
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("Preconditions")
    class Preconditions {

        @Test
        @DisplayName("should bound the requested scale-out")
        void scaleOutBounds() {
            ScaleOutTool tool = new ScaleOutTool(connector);

            StepVerifier.create(tool.validate(context(Map.of())))
                    .assertNext(result -> assertThat(result.valid()).isTrue())
                    .verifyComplete();
            StepVerifier.create(tool.validate(context(Map.of("instances", "3"))))
                    .assertNext(result -> assertThat(result.valid()).isTrue())
                    .verifyComplete();
            StepVerifier.create(tool.validate(context(Map.of("instances", 11))))
                    .assertNext(result -> assertThat(result.message()).isEqualTo("instances must be between 1 and 10, got 11"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should refuse a rollback without a target revision")
        void rollbackNeedsRevision() {
            RollbackTool tool = new RollbackTool(connector);

            StepVerifier.create(tool.validate(context(Map.of())))
                    .assertNext(result -> {
                        assertThat(result.valid()).isFalse();
                        assertThat(result.message()).startsWith("No backup exists");
                    })
                    .verifyComplete();
            StepVerifier.create(tool.validate(context(Map.of(RollbackTool.TARGET_REVISION, "v41"))))
                    .assertNext(result -> assertThat(result.valid()).isTrue())
                    .verifyComplete();
        }
    }

    @Test
    @DisplayName("should register every built-in tool under its policy action name")
    void registry() {
        ToolRegistry registry = new ToolRegistry(List.of(
                new RestartContainerTool(connector),
                new ScaleOutTool(connector),
                new TrafficShiftTool(connector),
                new CircuitBreakerTool(connector),
                new RollbackTool(connector),
                new AlertTeamTool(connector)));

        assertThat(registry.getToolCount()).isEqualTo(6);
        assertThat(registry.getAllTools()).extracting(RemediationTool::getName).containsExactlyInAnyOrder(
                "restart_container", "scale_out", "traffic_shift", "circuit_breaker", "rollback", "alert_team");
        assertThat(registry.getTool("traffic_shift")).isPresent();
        assertThat(registry.getTool("unknown")).isEmpty();
        assertThatThrownBy(() -> registry.register(new ScaleOutTool(connector)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("scale_out");
    }
}
