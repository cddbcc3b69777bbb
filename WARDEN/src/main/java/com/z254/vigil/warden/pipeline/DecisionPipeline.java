package com.z254.vigil.warden.pipeline;

import com.z254.vigil.warden.classification.AnomalyClassifier;
import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.config.WardenProperties.ExecutionMode;
import com.z254.vigil.warden.domain.model.AnomalyClassification;
import com.z254.vigil.warden.domain.model.BusinessImpact;
import com.z254.vigil.warden.domain.model.CandidateAction;
import com.z254.vigil.warden.domain.model.GatewayResponse;
import com.z254.vigil.warden.domain.model.HealingIntent;
import com.z254.vigil.warden.domain.model.PipelineResult;
import com.z254.vigil.warden.domain.model.PipelineStatus;
import com.z254.vigil.warden.domain.model.RecallContext;
import com.z254.vigil.warden.domain.model.TelemetryEvent;
import com.z254.vigil.warden.gateway.SafetyGateway;
import com.z254.vigil.warden.memory.GuardedIncidentMemory;
import com.z254.vigil.warden.observability.WardenMetrics;
import com.z254.vigil.warden.observability.WardenStructuredLogger;
import com.z254.vigil.warden.observability.WardenStructuredLogger.PipelineEventType;
import com.z254.vigil.warden.policy.PolicyEngine;
import com.z254.vigil.warden.policy.PolicyFirings;
import com.z254.vigil.warden.validation.EventValidationException;
import com.z254.vigil.warden.validation.EventValidator;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-event decision pipeline.
 * <p>
 * Processing stages:
 * <ol>
 *     <li>Validate and fingerprint the raw record; invalid records stop here</li>
 *     <li>Classify against static thresholds and the component baseline; NORMAL stops here</li>
 *     <li>Recall similar incidents and evaluate policies in parallel, each bounded by the
 *         analysis timeout and degraded to "no data" on timeout or failure</li>
 *     <li>Store the incident, build intents and submit them to the {@link SafetyGateway}</li>
 * </ol>
 * Events for different components run fully concurrently; per-component state is serialized
 * inside the classifier and the policy engine. Policy firings stay tentative until the intents
 * are handed to the gateway; a timed-out, failed or cancelled run releases them.
 */
@Slf4j
@Component
public class DecisionPipeline {

    static final String RECALL_BRANCH = "recall";
    static final String POLICY_BRANCH = "policy";

    private final EventValidator validator;
    private final AnomalyClassifier classifier;
    private final GuardedIncidentMemory memory;
    private final PolicyEngine policyEngine;
    private final IntentFactory intentFactory;
    private final SafetyGateway gateway;
    private final BusinessImpactEstimator impactEstimator;
    private final WardenProperties properties;
    private final WardenMetrics metrics;
    private final WardenStructuredLogger structuredLogger;
    private final Scheduler scheduler;

    @Autowired
    public DecisionPipeline(EventValidator validator,
                            AnomalyClassifier classifier,
                            GuardedIncidentMemory memory,
                            PolicyEngine policyEngine,
                            IntentFactory intentFactory,
                            SafetyGateway gateway,
                            ObjectProvider<BusinessImpactEstimator> impactEstimator,
                            WardenProperties properties,
                            WardenMetrics metrics,
                            WardenStructuredLogger structuredLogger) {
        this(validator, classifier, memory, policyEngine, intentFactory, gateway,
                impactEstimator.getIfAvailable(), properties, metrics, structuredLogger, Schedulers.boundedElastic());
    }

    public DecisionPipeline(EventValidator validator,
                            AnomalyClassifier classifier,
                            GuardedIncidentMemory memory,
                            PolicyEngine policyEngine,
                            IntentFactory intentFactory,
                            SafetyGateway gateway,
                            BusinessImpactEstimator impactEstimator,
                            WardenProperties properties,
                            WardenMetrics metrics,
                            WardenStructuredLogger structuredLogger,
                            Scheduler scheduler) {
        this.validator = validator;
        this.classifier = classifier;
        this.memory = memory;
        this.policyEngine = policyEngine;
        this.intentFactory = intentFactory;
        this.gateway = gateway;
        this.impactEstimator = impactEstimator;
        this.properties = properties;
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.scheduler = scheduler;
    }

    /**
     * Process one raw telemetry record in the configured default mode.
     */
    public Mono<PipelineResult> process(Map<String, ?> raw) {
        return process(raw, properties.getGateway().getDefaultMode());
    }

    /**
     * Process one raw telemetry record, submitting intents in {@code mode}.
     */
    public Mono<PipelineResult> process(Map<String, ?> raw, ExecutionMode mode) {
        return Mono.defer(() -> {
            Timer.Sample sample = metrics.startPipelineTimer();
            return run(raw, mode != null ? mode : properties.getGateway().getDefaultMode())
                    .doFinally(signal -> metrics.recordPipelineLatency(sample));
        });
    }

    private Mono<PipelineResult> run(Map<String, ?> raw, ExecutionMode mode) {
        TelemetryEvent event;
        try {
            event = validator.validate(raw);
        } catch (EventValidationException e) {
            return Mono.just(rejected(raw, e));
        }
        metrics.recordEventAccepted();

        AnomalyClassification classification = classifier.classify(event);
        metrics.recordClassification(classification.getLevel());
        structuredLogger.logPipelineEvent(event.incidentId(), event.getComponent(), PipelineEventType.EVENT_CLASSIFIED,
                "Event classified", Map.of(
                        "level", classification.getLevel().name(),
                        "score", classification.getScore(),
                        "staticOnly", classification.isStaticOnly()));

        if (!classification.isAnomalous()) {
            return Mono.just(PipelineResult.builder()
                    .status(PipelineStatus.NORMAL)
                    .classification(classification)
                    .build());
        }

        PendingFirings firings = new PendingFirings();
        return Mono.zip(recall(event), evaluatePolicies(event, classification, firings))
                .flatMap(analysis -> decide(event, classification, analysis.getT1(), analysis.getT2(), mode, firings))
                .doFinally(signal -> firings.abandon());
    }

    private Mono<RecallContext> recall(TelemetryEvent event) {
        int limit = properties.getPipeline().getRecallLimit();
        return Mono.fromCallable(() -> memory.recall(event, limit))
                .subscribeOn(scheduler)
                .map(response -> {
                    if (!response.isAvailable()) {
                        degraded(event, RECALL_BRANCH, response.reason());
                        return RecallContext.unavailable();
                    }
                    return RecallContexts.from(response.value());
                })
                .timeout(properties.getPipeline().getAnalysisTimeout())
                .onErrorResume(e -> {
                    degraded(event, RECALL_BRANCH, describe(e));
                    return Mono.just(RecallContext.unavailable());
                });
    }

    private Mono<List<CandidateAction>> evaluatePolicies(TelemetryEvent event, AnomalyClassification classification,
                                                         PendingFirings firings) {
        return Mono.fromCallable(() -> firings.attach(policyEngine.reserve(event, classification)).candidates())
                .subscribeOn(scheduler)
                .timeout(properties.getPipeline().getAnalysisTimeout())
                .onErrorResume(e -> {
                    firings.abandon();
                    degraded(event, POLICY_BRANCH, describe(e));
                    return Mono.just(List.of());
                });
    }

    private Mono<PipelineResult> decide(TelemetryEvent event,
                                        AnomalyClassification classification,
                                        RecallContext recall,
                                        List<CandidateAction> candidates,
                                        ExecutionMode mode,
                                        PendingFirings firings) {
        return Mono.fromCallable(() -> memory.recordIncident(event))
                .subscribeOn(scheduler)
                .flatMap(stored -> {
                    if (!stored.isAvailable()) {
                        log.warn("Incident {} not stored: {}", event.incidentId(), stored.reason());
                    }
                    List<HealingIntent> intents = intentFactory.create(event, classification, candidates, recall);
                    if (!intents.isEmpty()) {
                        structuredLogger.logPipelineEvent(event.incidentId(), event.getComponent(),
                                PipelineEventType.INTENTS_EMITTED, "Healing intents emitted", Map.of(
                                        "intents", intents.stream().map(HealingIntent::getToolName).toList(),
                                        "mode", mode.name()));
                    }
                    return Flux.fromIterable(intents)
                            .concatMap(intent -> {
                                firings.commit();
                                return gateway.submit(intent, mode);
                            })
                            .collectList()
                            .map(responses -> complete(event, classification, recall, intents, responses));
                });
    }

    private PipelineResult complete(TelemetryEvent event,
                                    AnomalyClassification classification,
                                    RecallContext recall,
                                    List<HealingIntent> intents,
                                    List<GatewayResponse> responses) {
        PipelineResult result = PipelineResult.builder()
                .status(PipelineStatus.ANOMALY)
                .incidentId(event.incidentId())
                .classification(classification)
                .healingIntents(intents)
                .gatewayResponses(List.copyOf(responses))
                .businessImpact(estimateImpact(event, classification))
                .recallContext(recall)
                .build();

        structuredLogger.logPipelineEvent(event.incidentId(), event.getComponent(), PipelineEventType.COMPLETED,
                "Event processed", Map.of(
                        "level", classification.getLevel().name(),
                        "intents", intents.size(),
                        "statuses", responses.stream().map(r -> r.getStatus().name()).toList()));
        return result;
    }

    private BusinessImpact estimateImpact(TelemetryEvent event, AnomalyClassification classification) {
        if (impactEstimator == null) {
            return null;
        }
        try {
            return impactEstimator.estimate(event, classification);
        } catch (RuntimeException e) {
            log.warn("Business impact estimation failed for {}: {}", event.incidentId(), e.getMessage());
            return null;
        }
    }

    private PipelineResult rejected(Map<String, ?> raw, EventValidationException e) {
        metrics.recordEventRejected(e.getField());
        Object component = raw != null ? raw.get(EventValidator.COMPONENT) : null;
        structuredLogger.logPipelineEvent(null, component != null ? component.toString() : null,
                PipelineEventType.EVENT_REJECTED, "Telemetry record rejected",
                Map.of("field", e.getField(), "reason", e.getReason()));
        return PipelineResult.builder()
                .status(PipelineStatus.REJECTED)
                .rejectedField(e.getField())
                .rejectionReason(e.getReason())
                .build();
    }

    private void degraded(TelemetryEvent event, String branch, String reason) {
        metrics.recordAnalysisDegraded(branch);
        structuredLogger.logPipelineEvent(event.incidentId(), event.getComponent(),
                PipelineEventType.ANALYSIS_DEGRADED, "Analysis branch degraded to no data",
                Map.of("branch", branch, "reason", String.valueOf(reason)));
    }

    /**
     * Hand-off of the policy branch's firings between the evaluating thread and the pipeline.
     * Whichever of {@link #attach} and {@link #abandon} runs second releases uncommitted firings.
     */
    private static final class PendingFirings {

        private final AtomicReference<PolicyFirings> firings = new AtomicReference<>();
        private final AtomicBoolean abandoned = new AtomicBoolean();

        PolicyFirings attach(PolicyFirings reserved) {
            firings.set(reserved);
            if (abandoned.get()) {
                reserved.release();
            }
            return reserved;
        }

        void commit() {
            PolicyFirings reserved = firings.get();
            if (reserved != null) {
                reserved.commit();
            }
        }

        void abandon() {
            abandoned.set(true);
            PolicyFirings reserved = firings.get();
            if (reserved != null) {
                reserved.release();
            }
        }
    }

    private static String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timed out";
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
