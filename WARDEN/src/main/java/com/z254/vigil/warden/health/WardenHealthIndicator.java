package com.z254.vigil.warden.health;

import com.z254.vigil.warden.gateway.AuditTrail;
import com.z254.vigil.warden.gateway.SafetyGateway;
import com.z254.vigil.warden.memory.GuardedIncidentMemory;
import com.z254.vigil.warden.memory.MemoryStats;
import com.z254.vigil.warden.resilience.BreakerState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health indicator for WARDEN service.
 * <p>
 * Reports on:
 * <ul>
 *     <li>Incident memory breaker state and size</li>
 *     <li>Per-tool breaker states</li>
 *     <li>Pending approvals and audit trail size</li>
 *     <li>Deployment execution capability</li>
 * </ul>
 * An open memory breaker degrades recall only, so the service stays UP.
 */
@Slf4j
@Component
public class WardenHealthIndicator implements ReactiveHealthIndicator {

    static final String DEGRADED = "DEGRADED";
    static final String AVAILABLE = "AVAILABLE";

    private final GuardedIncidentMemory memory;
    private final SafetyGateway gateway;
    private final AuditTrail auditTrail;

    public WardenHealthIndicator(GuardedIncidentMemory memory, SafetyGateway gateway, AuditTrail auditTrail) {
        this.memory = memory;
        this.gateway = gateway;
        this.auditTrail = auditTrail;
    }

    @Override
    public Mono<Health> health() {
        return Mono.fromCallable(this::checkHealth)
                .onErrorResume(e -> {
                    log.error("Health check failed", e);
                    return Mono.just(Health.down().withException(e).build());
                });
    }

    private Health checkHealth() {
        Map<String, Object> details = new LinkedHashMap<>();

        BreakerState memoryBreaker = memory.getCircuitBreaker().getState();
        details.put("memory", memoryBreaker == BreakerState.CLOSED ? AVAILABLE : DEGRADED);
        details.put("memory.breaker", memoryBreaker.name());
        MemoryStats stats = memory.stats();
        details.put("memory.incidents", stats.getIncidentCount());
        details.put("memory.outcomes", stats.getOutcomeCount());
        details.put("memory.maxIncidents", stats.getMaxIncidents());

        Map<String, String> toolBreakers = new LinkedHashMap<>();
        gateway.toolBreakerStates().forEach((tool, state) -> toolBreakers.put(tool, state.name()));
        details.put("tools.breakers", toolBreakers);

        details.put("approvals.pending", gateway.pendingApprovals().size());
        details.put("audit.records", auditTrail.size());
        details.put("execution.permitted", gateway.getCapabilities().isExecutionPermitted());
        details.put("execution.source", gateway.getCapabilities().getSource());

        return Health.up().withDetails(details).build();
    }
}
