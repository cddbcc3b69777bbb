package com.z254.vigil.warden.api.v1;

import com.z254.vigil.warden.api.dto.ManualOutcomeRequest;
import com.z254.vigil.warden.domain.model.ActionEffectiveness;
import com.z254.vigil.warden.memory.GuardedIncidentMemory;
import com.z254.vigil.warden.outcome.OutcomeRecorder;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * REST API controller for incident outcomes and action effectiveness.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Memory", description = "Incident outcomes and action effectiveness")
public class MemoryController {

    private final OutcomeRecorder outcomeRecorder;
    private final GuardedIncidentMemory memory;

    public MemoryController(OutcomeRecorder outcomeRecorder, GuardedIncidentMemory memory) {
        this.outcomeRecorder = outcomeRecorder;
        this.memory = memory;
    }

    @PostMapping("/outcomes")
    @Operation(summary = "Report manual remediation",
            description = "Record the outcome of a remediation performed outside the gateway")
    public Mono<ResponseEntity<Map<String, String>>> reportOutcome(@Valid @RequestBody ManualOutcomeRequest request) {
        log.info("Manual outcome reported: incidentId={}, actions={}, success={}",
                request.getIncidentId(), request.getActions(), request.getSuccess());

        return outcomeRecorder.reportManualRemediation(request.getIncidentId(), request.getActions(),
                        request.getSuccess(), request.getDurationMinutes(), request.getLessonsLearned())
                .map(outcomeId -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(Map.of("outcomeId", outcomeId)))
                .defaultIfEmpty(ResponseEntity.status(HttpStatus.NOT_FOUND)
                        .body(Map.of("message", "Outcome not recorded: unknown incident or memory unavailable")));
    }

    @GetMapping("/memory/effective-actions/{component}")
    @Operation(summary = "Most effective actions",
            description = "Actions ranked by historical success rate for a component")
    public Mono<List<ActionEffectiveness>> effectiveActions(
            @Parameter(description = "Component name") @PathVariable String component,
            @Parameter(description = "Maximum number of actions") @RequestParam(defaultValue = "5") int limit) {

        String normalized = component.trim().toLowerCase(Locale.ROOT);
        return Mono.fromCallable(() -> memory.mostEffectiveActions(normalized, limit).orElseThrow());
    }
}
