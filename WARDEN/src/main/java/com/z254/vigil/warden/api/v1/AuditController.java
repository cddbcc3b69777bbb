package com.z254.vigil.warden.api.v1;

import com.z254.vigil.warden.domain.model.ExecutionRecord;
import com.z254.vigil.warden.gateway.AuditTrail;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * REST API controller for the gateway audit trail.
 */
@RestController
@RequestMapping("/api/v1/audit")
@Tag(name = "Audit", description = "Safety gateway audit trail")
public class AuditController {

    private final AuditTrail auditTrail;

    public AuditController(AuditTrail auditTrail) {
        this.auditTrail = auditTrail;
    }

    @GetMapping
    @Operation(summary = "List audit records", description = "Audit records in sequence order")
    public Mono<List<ExecutionRecord>> list(
            @Parameter(description = "Only records after this sequence")
            @RequestParam(defaultValue = "0") long afterSequence,
            @Parameter(description = "Only records for this intent")
            @RequestParam(required = false) String intentId) {

        return Mono.fromCallable(() -> {
            List<ExecutionRecord> records = auditTrail.recordsAfter(afterSequence);
            if (intentId == null) {
                return records;
            }
            return records.stream()
                    .filter(r -> intentId.equals(r.getIntentId()))
                    .toList();
        });
    }

    @GetMapping(value = "/export", produces = MediaType.APPLICATION_NDJSON_VALUE)
    @Operation(summary = "Export audit trail", description = "Full audit trail as newline-delimited JSON")
    public Flux<ExecutionRecord> export() {
        return auditTrail.stream();
    }
}
