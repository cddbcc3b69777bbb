package com.z254.vigil.warden.api.v1;

import com.z254.vigil.warden.api.dto.ApprovalDecisionRequest;
import com.z254.vigil.warden.api.dto.PendingApprovalDto;
import com.z254.vigil.warden.domain.model.GatewayResponse;
import com.z254.vigil.warden.gateway.SafetyGateway;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for the approval workflow.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/approvals")
@Tag(name = "Approvals", description = "Pending approval workflow")
public class ApprovalController {

    private final SafetyGateway gateway;

    public ApprovalController(SafetyGateway gateway) {
        this.gateway = gateway;
    }

    @GetMapping
    @Operation(summary = "List pending approvals", description = "Pending approvals, oldest first")
    public Mono<List<PendingApprovalDto>> listPending() {
        return Mono.fromCallable(() -> gateway.pendingApprovals().stream()
                .map(PendingApprovalDto::from)
                .toList());
    }

    @PostMapping("/{id}/approve")
    @Operation(summary = "Approve", description = "Approve a pending request and execute it")
    public Mono<GatewayResponse> approve(
            @Parameter(description = "Approval ID") @PathVariable String id,
            @Valid @RequestBody ApprovalDecisionRequest request) {

        log.info("Approval {} approved by {}", id, request.getApprover());
        return gateway.approve(id, request.getApprover());
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Reject", description = "Reject a pending request")
    public Mono<GatewayResponse> reject(
            @Parameter(description = "Approval ID") @PathVariable String id,
            @Valid @RequestBody ApprovalDecisionRequest request) {

        log.info("Approval {} rejected by {}", id, request.getApprover());
        return gateway.reject(id, request.getApprover(), request.getReason());
    }
}
