package com.z254.vigil.warden.api.v1;

import com.fasterxml.jackson.databind.JsonNode;
import com.z254.vigil.warden.WardenTestConfiguration;
import com.z254.vigil.warden.api.dto.ApprovalDecisionRequest;
import com.z254.vigil.warden.api.dto.ManualOutcomeRequest;
import com.z254.vigil.warden.support.TestEvents;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.AutoConfigureWebTestClient;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration tests for the WARDEN REST API.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@AutoConfigureWebTestClient
@ActiveProfiles("test")
@Import(WardenTestConfiguration.class)
class WardenApiIntegrationTest {

    @Autowired
    private WebTestClient webTestClient;

    private JsonNode postEvent(Map<String, Object> record, String mode) {
        return webTestClient.post()
                .uri(uri -> mode == null
                        ? uri.path("/api/v1/events").build()
                        : uri.path("/api/v1/events").queryParam("mode", mode).build())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(record)
                .exchange()
                .expectStatus().isOk()
                .expectBody(JsonNode.class)
                .returnResult()
                .getResponseBody();
    }

    private static Map<String, Object> degraded(String component) {
        return TestEvents.with(TestEvents.degradedApiService(), "component", component);
    }

    @Nested
    @DisplayName("POST /api/v1/events")
    class Events {

        @Test
        @DisplayName("should return advisory decisions in the default mode")
        void advisoryByDefault() {
            JsonNode result = postEvent(degraded("search-api"), null);

            assertThat(result.get("status").asText()).isEqualTo("ANOMALY");
            assertThat(result.get("classification").get("level").asText()).isEqualTo("CRITICAL");
            assertThat(result.get("healingIntents")).hasSize(4);
            result.get("gatewayResponses").forEach(response ->
                    assertThat(response.get("status").asText()).isEqualTo("ADVISORY_ONLY"));
        }

        @Test
        @DisplayName("should return NORMAL for a healthy record")
        void healthy() {
            JsonNode result = postEvent(TestEvents.healthy("profile-api"), null);

            assertThat(result.get("status").asText()).isEqualTo("NORMAL");
            assertThat(result.has("incidentId")).isFalse();
        }

        @Test
        @DisplayName("should reject an invalid record with 400 and the offending field")
        void rejectsInvalid() {
            webTestClient.post()
                    .uri("/api/v1/events")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(TestEvents.with(degraded("search-api"), "latency_p99", -5))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("REJECTED")
                    .jsonPath("$.rejectedField").isEqualTo("latency_p99");
        }

        @Test
        @DisplayName("should reject an unknown execution mode")
        void unknownMode() {
            webTestClient.post()
                    .uri("/api/v1/events?mode=YOLO")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(degraded("search-api"))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("Approval workflow")
    class Approvals {

        @Test
        @SuppressWarnings("unchecked")
        @DisplayName("should park approval-mode intents and resolve them on approve and reject")
        void approveAndReject() {
            JsonNode result = postEvent(degraded("checkout-api"), "APPROVAL");
            JsonNode responses = result.get("gatewayResponses");
            assertThat(responses).hasSize(4);
            responses.forEach(response ->
                    assertThat(response.get("status").asText()).isEqualTo("PENDING_APPROVAL"));
            String first = responses.get(0).get("approvalId").asText();
            String second = responses.get(1).get("approvalId").asText();

            webTestClient.get()
                    .uri("/api/v1/approvals")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[*].approvalId").value(ids -> assertThat((List<Object>) ids).contains(first, second));

            webTestClient.post()
                    .uri("/api/v1/approvals/{id}/approve", first)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new ApprovalDecisionRequest("alice", null))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("COMPLETED")
                    .jsonPath("$.result.externalActionId").exists();

            webTestClient.post()
                    .uri("/api/v1/approvals/{id}/reject", second)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new ApprovalDecisionRequest("bob", "not now"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("DENIED")
                    .jsonPath("$.reason").isEqualTo("rejected by bob: not now");

            webTestClient.post()
                    .uri("/api/v1/approvals/{id}/approve", first)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new ApprovalDecisionRequest("alice", null))
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should require an approver")
        void requiresApprover() {
            webTestClient.post()
                    .uri("/api/v1/approvals/{id}/approve", "appr_unknown")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("reason", "no name"))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.message").value(message -> assertThat((String) message).contains("approver"));
        }
    }

    @Nested
    @DisplayName("Outcomes and memory")
    class Outcomes {

        @Test
        @DisplayName("should record a manual outcome and rank the action for the component")
        void manualOutcome() {
            String incidentId = postEvent(degraded("ledger-api"), null).get("incidentId").asText();

            webTestClient.post()
                    .uri("/api/v1/outcomes")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(ManualOutcomeRequest.builder()
                            .incidentId(incidentId)
                            .actions(List.of("scale_out"))
                            .success(true)
                            .durationMinutes(7.5)
                            .lessonsLearned("two replicas were enough")
                            .build())
                    .exchange()
                    .expectStatus().isCreated()
                    .expectBody()
                    .jsonPath("$.outcomeId").value(id -> assertThat((String) id).startsWith("out_"));

            webTestClient.get()
                    .uri("/api/v1/memory/effective-actions/{component}", "Ledger-API")
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$[0].action").isEqualTo("scale_out")
                    .jsonPath("$[0].successRate").isEqualTo(1.0);
        }

        @Test
        @DisplayName("should answer 404 for an unknown incident")
        void unknownIncident() {
            webTestClient.post()
                    .uri("/api/v1/outcomes")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(ManualOutcomeRequest.builder()
                            .incidentId("inc_0000000000000000")
                            .actions(List.of("scale_out"))
                            .success(true)
                            .build())
                    .exchange()
                    .expectStatus().isNotFound();
        }

        @Test
        @DisplayName("should validate the outcome body")
        void invalidBody() {
            webTestClient.post()
                    .uri("/api/v1/outcomes")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("incidentId", "inc_1", "actions", List.of(), "success", true))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Nested
    @DisplayName("GET /api/v1/audit")
    class Audit {

        @Test
        @DisplayName("should list and export the decisions for an intent")
        void listsAndExports() {
            JsonNode result = postEvent(degraded("billing-api"), null);
            String intentId = result.get("healingIntents").get(0).get("intentId").asText();

            webTestClient.get()
                    .uri(uri -> uri.path("/api/v1/audit").queryParam("intentId", intentId).build())
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.length()").isEqualTo(1)
                    .jsonPath("$[0].status").isEqualTo("ADVISORY_ONLY")
                    .jsonPath("$[0].component").isEqualTo("billing-api");

            webTestClient.get()
                    .uri("/api/v1/audit/export")
                    .accept(MediaType.APPLICATION_NDJSON)
                    .exchange()
                    .expectStatus().isOk()
                    .expectHeader().contentTypeCompatibleWith(MediaType.APPLICATION_NDJSON);
        }
    }
}
