package com.z254.vigil.warden.api.v1;

import com.z254.vigil.warden.config.WardenProperties.ExecutionMode;
import com.z254.vigil.warden.domain.model.PipelineResult;
import com.z254.vigil.warden.domain.model.PipelineStatus;
import com.z254.vigil.warden.pipeline.DecisionPipeline;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * REST API controller for telemetry ingestion.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/events")
@Tag(name = "Events", description = "Telemetry ingestion and decisions")
public class EventController {

    private final DecisionPipeline pipeline;

    public EventController(DecisionPipeline pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping
    @Operation(summary = "Process event",
            description = "Validate, classify and decide on one telemetry record. Rejected records return 400 "
                    + "with the offending field.")
    public Mono<ResponseEntity<PipelineResult>> processEvent(
            @RequestBody Map<String, Object> record,
            @Parameter(description = "Execution mode for emitted intents; defaults to the configured mode")
            @RequestParam(required = false) ExecutionMode mode) {

        return pipeline.process(record, mode)
                .map(result -> result.getStatus() == PipelineStatus.REJECTED
                        ? ResponseEntity.badRequest().body(result)
                        : ResponseEntity.ok(result));
    }
}
