package com.z254.vigil.warden.gateway;

import com.z254.vigil.warden.config.DeploymentCapabilities;
import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.config.WardenProperties.ExecutionMode;
import com.z254.vigil.warden.domain.model.ExecutionRecord;
import com.z254.vigil.warden.domain.model.GatewayResponse;
import com.z254.vigil.warden.domain.model.GatewayStatus;
import com.z254.vigil.warden.domain.model.HealingIntent;
import com.z254.vigil.warden.observability.WardenMetrics;
import com.z254.vigil.warden.observability.WardenStructuredLogger;
import com.z254.vigil.warden.observability.WardenStructuredLogger.GatewayEventType;
import com.z254.vigil.warden.outcome.OutcomeRecorder;
import com.z254.vigil.warden.resilience.BreakerState;
import com.z254.vigil.warden.resilience.CircuitOpenException;
import com.z254.vigil.warden.resilience.ResourceCircuitBreaker;
import com.z254.vigil.warden.support.BoundedLruMap;
import com.z254.vigil.warden.tool.RemediationTool;
import com.z254.vigil.warden.tool.RemediationTool.ValidationResult;
import com.z254.vigil.warden.tool.ToolContext;
import com.z254.vigil.warden.tool.ToolExecutionException;
import com.z254.vigil.warden.tool.ToolRegistry;
import com.z254.vigil.warden.tool.ToolResult;
import com.z254.vigil.warden.validation.Fingerprints;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * The only path by which a {@link HealingIntent} can have an external effect.
 * <p>
 * Each submission runs the ordered checks (blacklist, known tool, blast radius, business hours,
 * tool circuit breaker, tool+component cooldown, tool preconditions) and stops at the first
 * failure. Passing requests are then resolved by mode: ADVISORY records a "would execute"
 * recommendation, APPROVAL parks the request until approved, rejected or expired, AUTONOMOUS
 * executes under the tool's timeout and circuit breaker. Whenever the deployment lacks execution
 * capability every passing request resolves to ADVISORY_ONLY, whatever the requested mode.
 * Every decision, including duplicates, is appended to the {@link AuditTrail}.
 * <p>
 * Cooldowns and the idempotency window are held in strict LRU maps. A duplicate submission
 * returns the latest decision for the intent, so a parked request that was later approved,
 * rejected or expired reports its final status.
 */
@Slf4j
@Component
public class SafetyGateway {

    private final ToolRegistry toolRegistry;
    private final DeploymentCapabilities capabilities;
    private final AuditTrail auditTrail;
    private final ApprovalRegistry approvalRegistry;
    private final OutcomeRecorder outcomeRecorder;
    private final WardenProperties.Gateway config;
    private final BusinessHoursWindow businessHours;
    private final WardenMetrics metrics;
    private final WardenStructuredLogger structuredLogger;
    private final Clock clock;
    private final Set<String> blacklist;

    private final Map<String, ResourceCircuitBreaker> toolBreakers = new ConcurrentHashMap<>();
    private final BoundedLruMap<String, Instant> cooldowns;
    private final BoundedLruMap<String, Submission> submissions;

    public SafetyGateway(ToolRegistry toolRegistry,
                         DeploymentCapabilities capabilities,
                         AuditTrail auditTrail,
                         ApprovalRegistry approvalRegistry,
                         OutcomeRecorder outcomeRecorder,
                         WardenProperties properties,
                         WardenMetrics metrics,
                         WardenStructuredLogger structuredLogger,
                         Clock clock) {
        this.toolRegistry = toolRegistry;
        this.capabilities = capabilities != null ? capabilities : DeploymentCapabilities.advisoryOnly();
        this.auditTrail = auditTrail;
        this.approvalRegistry = approvalRegistry;
        this.outcomeRecorder = outcomeRecorder;
        this.config = properties.getGateway();
        this.businessHours = new BusinessHoursWindow(config.getBusinessHours());
        this.metrics = metrics;
        this.structuredLogger = structuredLogger;
        this.clock = clock;
        this.blacklist = config.getBlacklist().stream()
                .map(name -> name.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.cooldowns = new BoundedLruMap<>(config.getMaxTrackedCooldowns());
        this.submissions = new BoundedLruMap<>(config.getIdempotencyCapacity());

        log.info("Safety gateway initialized: executionPermitted={}, source={}, defaultMode={}",
                this.capabilities.isExecutionPermitted(), this.capabilities.getSource(), config.getDefaultMode());
    }

    /**
     * Submit an intent. A repeated intent id returns the original decision marked as duplicate.
     */
    public Mono<GatewayResponse> submit(HealingIntent intent, ExecutionMode requestedMode) {
        ExecutionMode mode = requestedMode != null ? requestedMode : config.getDefaultMode();
        return Mono.defer(() -> {
            Instant now = clock.instant();
            Submission fresh = new Submission(Mono.defer(() -> process(intent, mode)).cache(), now);
            Submission current = submissions.compute(intent.getIntentId(), (id, existing) ->
                    existing != null && existing.isLive(now, config.getIdempotencyWindow()) ? existing : fresh);
            if (current != fresh) {
                return current.decision().map(original -> duplicate(intent, mode, original));
            }
            return fresh.decision();
        });
    }

    /**
     * Approve a pending request and execute it.
     *
     * @throws ApprovalNotFoundException (as error signal) if nothing is pending under the id
     */
    public Mono<GatewayResponse> approve(String approvalId, String approver) {
        return Mono.defer(() -> {
            PendingApproval pending = approvalRegistry.claim(approvalId)
                    .orElseThrow(() -> new ApprovalNotFoundException(approvalId));
            GatewayRequest request = pending.getRequest();
            HealingIntent intent = pending.getIntent();

            if (pending.isExpired(clock.instant())) {
                return Mono.just(expire(pending));
            }

            Optional<RemediationTool> tool = toolRegistry.getTool(intent.getToolName());
            if (tool.isEmpty()) {
                return Mono.just(deny(request, null, "Unknown tool: " + intent.getToolName(), approvalId));
            }

            request.transitionTo(GatewayStatus.APPROVED);
            structuredLogger.logGatewayEvent(intent.getIntentId(), intent.getComponent(), GatewayEventType.APPROVED,
                    "Remediation approved", Map.of("approvalId", approvalId, "approver", String.valueOf(approver)));

            if (!capabilities.isExecutionPermitted()) {
                return Mono.just(advisory(request, approvalId, "execution capability not granted"));
            }
            return execute(request, tool.get(), approvalId, approver);
        }).doOnNext(this::settle);
    }

    /**
     * Reject a pending request.
     */
    public Mono<GatewayResponse> reject(String approvalId, String approver, String reason) {
        return Mono.fromCallable(() -> {
            PendingApproval pending = approvalRegistry.claim(approvalId)
                    .orElseThrow(() -> new ApprovalNotFoundException(approvalId));
            String detail = "rejected by " + approver + (reason != null && !reason.isBlank() ? ": " + reason : "");
            structuredLogger.logGatewayEvent(pending.getIntent().getIntentId(), pending.getIntent().getComponent(),
                    GatewayEventType.REJECTED, "Remediation rejected", Map.of("approvalId", approvalId));
            return deny(pending.getRequest(), null, detail, approvalId);
        }).doOnNext(this::settle);
    }

    /**
     * Auto-reject approvals whose TTL has elapsed.
     *
     * @return number of approvals expired
     */
    @Scheduled(fixedDelayString = "${warden.gateway.approval-sweep-interval-ms:30000}")
    public int expireApprovals() {
        List<PendingApproval> expired = approvalRegistry.claimExpired(clock.instant());
        expired.forEach(pending -> settle(expire(pending)));
        return expired.size();
    }

    public List<PendingApproval> pendingApprovals() {
        return approvalRegistry.list();
    }

    public Map<String, BreakerState> toolBreakerStates() {
        Map<String, BreakerState> states = new HashMap<>();
        toolBreakers.forEach((tool, breaker) -> states.put(tool, breaker.getState()));
        return states;
    }

    public DeploymentCapabilities getCapabilities() {
        return capabilities;
    }

    // ========== Submission ==========

    private Mono<GatewayResponse> process(HealingIntent intent, ExecutionMode mode) {
        GatewayRequest request = new GatewayRequest(intent, mode, clock.instant());
        request.transitionTo(GatewayStatus.VALIDATING);

        SafetyCheck blacklisted = checkBlacklist(intent);
        if (!blacklisted.isPassed()) {
            return Mono.just(deny(request, blacklisted, blacklisted.getMessage(), null));
        }
        Optional<RemediationTool> resolved = toolRegistry.getTool(intent.getToolName());
        if (resolved.isEmpty()) {
            SafetyCheck unknown = SafetyCheck.fail(SafetyCheck.UNKNOWN_TOOL, "Unknown tool: " + intent.getToolName());
            return Mono.just(deny(request, unknown, unknown.getMessage(), null));
        }
        RemediationTool tool = resolved.get();

        for (SafetyCheck check : List.of(
                checkBlastRadius(intent, tool),
                checkBusinessHours(intent, tool),
                checkCircuitBreaker(tool),
                checkCooldown(intent))) {
            if (!check.isPassed()) {
                return Mono.just(deny(request, check, check.getMessage(), null));
            }
        }

        ToolContext context = contextFor(intent, mode, null);
        return tool.validate(context)
                .defaultIfEmpty(ValidationResult.success())
                .onErrorResume(e -> Mono.just(ValidationResult.failure("tool validation error: " + e.getMessage())))
                .flatMap(validation -> {
                    if (!validation.valid()) {
                        SafetyCheck precondition = SafetyCheck.fail(SafetyCheck.TOOL_PRECONDITION, validation.message());
                        return Mono.just(deny(request, precondition, validation.message(), null));
                    }
                    if (!claimCooldown(intent)) {
                        SafetyCheck cooldown = SafetyCheck.fail(SafetyCheck.COOLDOWN, cooldownMessage(intent));
                        return Mono.just(deny(request, cooldown, cooldown.getMessage(), null));
                    }
                    return accept(request, tool);
                });
    }

    private Mono<GatewayResponse> accept(GatewayRequest request, RemediationTool tool) {
        ExecutionMode mode = request.getMode();

        if (mode == ExecutionMode.ADVISORY || !capabilities.isExecutionPermitted()) {
            request.transitionTo(GatewayStatus.APPROVED);
            String reason = mode == ExecutionMode.ADVISORY ? null : "execution capability not granted";
            return Mono.just(advisory(request, null, reason));
        }

        if (mode == ExecutionMode.APPROVAL) {
            return Mono.just(park(request));
        }

        request.transitionTo(GatewayStatus.APPROVED);
        return execute(request, tool, null, null);
    }

    private GatewayResponse park(GatewayRequest request) {
        HealingIntent intent = request.getIntent();
        Instant now = clock.instant();
        String approvalId = Fingerprints.shortId("appr_", intent.getIntentId());
        request.transitionTo(GatewayStatus.PENDING_APPROVAL);
        approvalRegistry.register(PendingApproval.builder()
                .approvalId(approvalId)
                .intent(intent)
                .request(request)
                .requestedAt(now)
                .expiresAt(now.plus(config.getApprovalTtl()))
                .build());

        ExecutionRecord record = audit(request, true, null, GatewayStatus.PENDING_APPROVAL, approvalId,
                "expires " + now.plus(config.getApprovalTtl()));
        metrics.recordGatewayDecision(GatewayStatus.PENDING_APPROVAL);
        structuredLogger.logGatewayEvent(intent.getIntentId(), intent.getComponent(), GatewayEventType.PENDING_APPROVAL,
                "Remediation awaiting approval", Map.of("approvalId", approvalId, "tool", intent.getToolName()));
        return response(request, GatewayStatus.PENDING_APPROVAL, record)
                .approvalId(approvalId)
                .build();
    }

    private Mono<GatewayResponse> execute(GatewayRequest request, RemediationTool tool,
                                          String approvalId, String approver) {
        HealingIntent intent = request.getIntent();
        String toolName = tool.getName();
        Duration timeout = tool.getMetadata().getTimeout();
        ToolContext context = contextFor(intent, request.getMode(), approver);

        request.transitionTo(GatewayStatus.EXECUTING);
        structuredLogger.logGatewayEvent(intent.getIntentId(), intent.getComponent(), GatewayEventType.EXECUTING,
                "Executing remediation", Map.of("tool", toolName, "timeoutMs", timeout.toMillis()));

        Timer.Sample sample = metrics.startToolTimer();
        Instant started = clock.instant();
        AtomicBoolean recorded = new AtomicBoolean();

        return breakerFor(toolName)
                .callReactive(() -> tool.execute(context)
                        .timeout(timeout)
                        .switchIfEmpty(Mono.error(() -> new ToolExecutionException(toolName, "EMPTY_RESULT",
                                "tool returned no result")))
                        .onErrorMap(TimeoutException.class, e -> new ToolExecutionException(toolName, "TIMEOUT",
                                "tool timed out after " + timeout.toMillis() + "ms", e))
                        .flatMap(result -> {
                            if (result.isSuccess()) {
                                return Mono.just(result);
                            }
                            String code = result.getErrorCode() != null ? result.getErrorCode() : "TOOL_FAILURE";
                            return Mono.<ToolResult>error(new ToolExecutionException(toolName, code,
                                    String.valueOf(result.getErrorMessage())));
                        }))
                .map(result -> {
                    Duration elapsed = Duration.between(started, clock.instant());
                    result.setDuration(elapsed);
                    metrics.recordToolExecution(sample, toolName, true);
                    GatewayResponse response = complete(request, approvalId, result);
                    if (recorded.compareAndSet(false, true)) {
                        outcomeRecorder.recordExecution(intent, true, elapsed, result.getOutput());
                    }
                    return response;
                })
                .onErrorResume(error -> {
                    Duration elapsed = Duration.between(started, clock.instant());
                    metrics.recordToolExecution(sample, toolName, false);
                    ToolResult failure = toFailure(toolName, error, elapsed);
                    GatewayResponse response = fail(request, approvalId, failure);
                    if (recorded.compareAndSet(false, true)) {
                        outcomeRecorder.recordExecution(intent, false, elapsed, failure.getErrorMessage());
                    }
                    return Mono.just(response);
                });
    }

    // ========== Checks ==========

    private SafetyCheck checkBlacklist(HealingIntent intent) {
        String tool = intent.getToolName() == null ? "" : intent.getToolName().toLowerCase(Locale.ROOT);
        return blacklist.contains(tool)
                ? SafetyCheck.fail(SafetyCheck.BLACKLIST, "Action '" + intent.getToolName() + "' is blacklisted")
                : SafetyCheck.pass(SafetyCheck.BLACKLIST);
    }

    private SafetyCheck checkBlastRadius(HealingIntent intent, RemediationTool tool) {
        int blastRadius = intent.getRiskProfile() != null
                ? intent.getRiskProfile().getBlastRadius()
                : tool.getMetadata().getDefaultBlastRadius();
        if (blastRadius > config.getMaxBlastRadius()) {
            return SafetyCheck.fail(SafetyCheck.BLAST_RADIUS, String.format(
                    "Blast radius %d exceeds maximum %d", blastRadius, config.getMaxBlastRadius()));
        }
        return SafetyCheck.pass(SafetyCheck.BLAST_RADIUS);
    }

    private SafetyCheck checkBusinessHours(HealingIntent intent, RemediationTool tool) {
        boolean safe = intent.getRiskProfile() != null
                ? intent.getRiskProfile().isSafeForBusinessHours()
                : tool.getMetadata().isSafeForBusinessHours();
        if (!safe && businessHours.isRestricted(clock.instant())) {
            return SafetyCheck.fail(SafetyCheck.BUSINESS_HOURS,
                    "Action '" + intent.getToolName() + "' is not safe during business hours");
        }
        return SafetyCheck.pass(SafetyCheck.BUSINESS_HOURS);
    }

    private SafetyCheck checkCircuitBreaker(RemediationTool tool) {
        if (!breakerFor(tool.getName()).isCallPermitted()) {
            return SafetyCheck.fail(SafetyCheck.CIRCUIT_BREAKER, "Circuit breaker open for tool " + tool.getName());
        }
        return SafetyCheck.pass(SafetyCheck.CIRCUIT_BREAKER);
    }

    private SafetyCheck checkCooldown(HealingIntent intent) {
        Instant last = cooldowns.get(cooldownKey(intent));
        if (last != null && clock.instant().isBefore(last.plus(config.getToolCooldown()))) {
            return SafetyCheck.fail(SafetyCheck.COOLDOWN, cooldownMessage(intent));
        }
        return SafetyCheck.pass(SafetyCheck.COOLDOWN);
    }

    /**
     * Atomically re-checks and starts the tool+component cooldown; false if another request won.
     */
    private boolean claimCooldown(HealingIntent intent) {
        Instant now = clock.instant();
        AtomicBoolean claimed = new AtomicBoolean();
        cooldowns.compute(cooldownKey(intent), (key, last) -> {
            if (last != null && now.isBefore(last.plus(config.getToolCooldown()))) {
                return last;
            }
            claimed.set(true);
            return now;
        });
        return claimed.get();
    }

    /**
     * Make {@code response} the decision that later duplicates of its intent report.
     */
    private void settle(GatewayResponse response) {
        submissions.computeIfPresent(response.getIntentId(),
                (id, submission) -> new Submission(Mono.just(response), submission.submittedAt()));
    }

    private String cooldownMessage(HealingIntent intent) {
        return "Cooldown active for " + intent.getToolName() + " on " + intent.getComponent();
    }

    private static String cooldownKey(HealingIntent intent) {
        return intent.getToolName() + "|" + intent.getComponent();
    }

    // ========== Resolution ==========

    private GatewayResponse deny(GatewayRequest request, SafetyCheck failedCheck, String reason, String approvalId) {
        HealingIntent intent = request.getIntent();
        request.transitionTo(GatewayStatus.DENIED);
        boolean validationPassed = failedCheck == null;
        ExecutionRecord record = audit(request, validationPassed,
                failedCheck != null ? failedCheck.getName() + ": " + reason : null,
                GatewayStatus.DENIED, approvalId, reason);
        metrics.recordGatewayDecision(GatewayStatus.DENIED);
        structuredLogger.logGatewayEvent(intent.getIntentId(), intent.getComponent(), GatewayEventType.DENIED,
                "Remediation denied", Map.of("tool", String.valueOf(intent.getToolName()), "reason", reason));
        return response(request, GatewayStatus.DENIED, record)
                .reason(reason)
                .approvalId(approvalId)
                .build();
    }

    private GatewayResponse advisory(GatewayRequest request, String approvalId, String reason) {
        HealingIntent intent = request.getIntent();
        request.transitionTo(GatewayStatus.ADVISORY_ONLY);
        ExecutionRecord record = audit(request, true, null, GatewayStatus.ADVISORY_ONLY, approvalId,
                reason != null ? "would execute; " + reason : "would execute");
        metrics.recordGatewayDecision(GatewayStatus.ADVISORY_ONLY);
        structuredLogger.logGatewayEvent(intent.getIntentId(), intent.getComponent(), GatewayEventType.ADVISORY_ONLY,
                "Remediation recommended", Map.of("tool", intent.getToolName(),
                        "requestedMode", request.getMode().name()));
        return response(request, GatewayStatus.ADVISORY_ONLY, record)
                .wouldExecute(true)
                .approvalId(approvalId)
                .reason(reason)
                .build();
    }

    private GatewayResponse complete(GatewayRequest request, String approvalId, ToolResult result) {
        HealingIntent intent = request.getIntent();
        request.transitionTo(GatewayStatus.COMPLETED);
        ExecutionRecord record = audit(request, true, null, GatewayStatus.COMPLETED, approvalId, result.getOutput());
        metrics.recordGatewayDecision(GatewayStatus.COMPLETED);
        structuredLogger.logGatewayEvent(intent.getIntentId(), intent.getComponent(), GatewayEventType.COMPLETED,
                "Remediation completed", Map.of("tool", intent.getToolName()));
        return response(request, GatewayStatus.COMPLETED, record)
                .approvalId(approvalId)
                .result(result.toMap())
                .build();
    }

    private GatewayResponse fail(GatewayRequest request, String approvalId, ToolResult failure) {
        HealingIntent intent = request.getIntent();
        request.transitionTo(GatewayStatus.FAILED);
        ExecutionRecord record = audit(request, true, null, GatewayStatus.FAILED, approvalId,
                failure.getErrorCode() + ": " + failure.getErrorMessage());
        metrics.recordGatewayDecision(GatewayStatus.FAILED);
        structuredLogger.logGatewayEvent(intent.getIntentId(), intent.getComponent(), GatewayEventType.FAILED,
                "Remediation failed", Map.of("tool", intent.getToolName(),
                        "errorCode", failure.getErrorCode(), "error", String.valueOf(failure.getErrorMessage())));
        return response(request, GatewayStatus.FAILED, record)
                .approvalId(approvalId)
                .reason(failure.getErrorMessage())
                .result(failure.toMap())
                .build();
    }

    private GatewayResponse expire(PendingApproval pending) {
        HealingIntent intent = pending.getIntent();
        structuredLogger.logGatewayEvent(intent.getIntentId(), intent.getComponent(), GatewayEventType.EXPIRED,
                "Approval expired", Map.of("approvalId", pending.getApprovalId(),
                        "expiresAt", pending.getExpiresAt().toString()));
        return deny(pending.getRequest(), null, "approval expired", pending.getApprovalId());
    }

    private GatewayResponse duplicate(HealingIntent intent, ExecutionMode mode, GatewayResponse original) {
        ExecutionRecord record = auditTrail.append(ExecutionRecord.builder()
                .intentId(intent.getIntentId())
                .toolName(intent.getToolName())
                .component(intent.getComponent())
                .justification(intent.getJustification())
                .mode(mode)
                .validationPassed(false)
                .validationReason("duplicate intent id")
                .status(original.getStatus())
                .approvalId(original.getApprovalId())
                .duplicateOf(original.getAuditSequence())
                .detail("duplicate of audit #" + original.getAuditSequence())
                .submittedAt(clock.instant()));
        structuredLogger.logGatewayEvent(intent.getIntentId(), intent.getComponent(), GatewayEventType.DUPLICATE,
                "Duplicate intent submission", Map.of("originalSequence", original.getAuditSequence(),
                        "duplicateSequence", record.getSequence()));
        return original.toBuilder()
                .duplicate(true)
                .reason("duplicate of audit #" + original.getAuditSequence())
                .build();
    }

    private ExecutionRecord audit(GatewayRequest request, boolean validationPassed, String validationReason,
                                  GatewayStatus status, String approvalId, String detail) {
        HealingIntent intent = request.getIntent();
        return auditTrail.append(ExecutionRecord.builder()
                .intentId(intent.getIntentId())
                .toolName(intent.getToolName())
                .component(intent.getComponent())
                .justification(intent.getJustification())
                .mode(request.getMode())
                .validationPassed(validationPassed)
                .validationReason(validationReason)
                .status(status)
                .approvalId(approvalId)
                .detail(detail)
                .submittedAt(request.getSubmittedAt()));
    }

    private GatewayResponse.GatewayResponseBuilder response(GatewayRequest request, GatewayStatus status,
                                                           ExecutionRecord record) {
        HealingIntent intent = request.getIntent();
        return GatewayResponse.builder()
                .intentId(intent.getIntentId())
                .toolName(intent.getToolName())
                .component(intent.getComponent())
                .status(status)
                .mode(request.getMode())
                .auditSequence(record.getSequence());
    }

    private ToolContext contextFor(HealingIntent intent, ExecutionMode mode, String approver) {
        return ToolContext.builder()
                .intentId(intent.getIntentId())
                .component(intent.getComponent())
                .parameters(intent.getParameters() != null ? intent.getParameters() : Map.of())
                .mode(mode)
                .approvedBy(approver)
                .build();
    }

    private ToolResult toFailure(String toolName, Throwable error, Duration elapsed) {
        String code;
        if (error instanceof ToolExecutionException tee) {
            code = tee.getErrorCode();
        } else if (error instanceof CircuitOpenException) {
            code = "CIRCUIT_OPEN";
        } else {
            code = "TOOL_ERROR";
        }
        ToolResult failure = ToolResult.failure(toolName, code, error.getMessage());
        failure.setDuration(elapsed);
        return failure;
    }

    private ResourceCircuitBreaker breakerFor(String toolName) {
        return toolBreakers.computeIfAbsent(toolName,
                name -> new ResourceCircuitBreaker("tool:" + name, config.getCircuitBreaker(), clock));
    }

    private record Submission(Mono<GatewayResponse> decision, Instant submittedAt) {

        boolean isLive(Instant now, Duration window) {
            return now.isBefore(submittedAt.plus(window));
        }
    }
}
