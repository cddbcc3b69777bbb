package com.z254.vigil.warden.policy;

import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.domain.model.AnomalyClassification;
import com.z254.vigil.warden.domain.model.CandidateAction;
import com.z254.vigil.warden.domain.model.ComparisonOperator;
import com.z254.vigil.warden.domain.model.HealingPolicy;
import com.z254.vigil.warden.domain.model.PolicyCondition;
import com.z254.vigil.warden.domain.model.TelemetryEvent;
import com.z254.vigil.warden.domain.model.TelemetryMetric;
import com.z254.vigil.warden.observability.WardenMetrics;
import com.z254.vigil.warden.support.BoundedLruMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates the policy catalog against classified events.
 * <p>
 * Policies run in ascending priority order and are additive unless one is terminal. A policy
 * fires only if every condition holds, its cooldown for the component has elapsed and it has
 * fired fewer than {@code maxExecutionsPerHour} times in the last hour. The rate check and the
 * firing record happen together per policy, so a policy either fires with all of its actions or
 * not at all.
 * <p>
 * {@link #reserve} records firings tentatively: the caller commits them once the resulting actions
 * are handed on, or releases them if the unit of work is abandoned, which rolls back the cooldown
 * and rate counters. Tracking state is kept per component in a strict LRU map bounded by
 * {@code maxTrackedComponents}.
 */
@Slf4j
@Component
public class PolicyEngine {

    private final PolicyCatalog catalog;
    private final WardenMetrics metrics;
    private final Clock clock;
    private final BoundedLruMap<String, Map<String, FiringWindow>> trackers;

    public PolicyEngine(PolicyCatalog catalog, WardenProperties properties, WardenMetrics metrics, Clock clock) {
        this.catalog = catalog;
        this.metrics = metrics;
        this.clock = clock;
        this.trackers = new BoundedLruMap<>(properties.getPolicy().getMaxTrackedComponents());
    }

    /**
     * Evaluate and commit in one step.
     *
     * @return candidate actions ordered by policy priority, then by each policy's action order
     */
    public List<CandidateAction> evaluate(TelemetryEvent event, AnomalyClassification classification) {
        PolicyFirings firings = reserve(event, classification);
        firings.commit();
        return firings.candidates();
    }

    /**
     * Evaluate the catalog and tentatively record the firings. The result must be either
     * committed or released.
     */
    public PolicyFirings reserve(TelemetryEvent event, AnomalyClassification classification) {
        List<CandidateAction> candidates = new ArrayList<>();
        List<PolicyFirings.Reservation> reservations = new ArrayList<>();
        Instant now = clock.instant();

        trackers.compute(event.getComponent(), (component, windows) -> {
            Map<String, FiringWindow> state = windows != null ? windows : new HashMap<>();
            try {
                for (HealingPolicy policy : catalog.getPolicies()) {
                    if (!policy.isEnabled()) {
                        continue;
                    }
                    try {
                        PolicyFirings.Reservation reservation = tryFire(policy, event, classification, state, now);
                        if (reservation != null) {
                            reservations.add(reservation);
                            List<String> actions = policy.getActions();
                            for (int i = 0; i < actions.size(); i++) {
                                candidates.add(new CandidateAction(policy.getName(), actions.get(i), policy.getPriority(), i));
                            }
                            if (policy.isTerminal()) {
                                break;
                            }
                        }
                    } catch (PolicyEvaluationException e) {
                        metrics.recordPolicyError();
                        log.warn("Skipping malformed policy: {}", e.getMessage());
                    }
                }
            } catch (RuntimeException e) {
                rollback(state, reservations);
                throw e;
            }
            return state;
        });

        return new PolicyFirings(this, event.getComponent(), candidates, reservations);
    }

    /**
     * Last firing time of a policy for a component, if still tracked. Counts as an access.
     */
    public Optional<Instant> lastFired(String policyName, String component) {
        Map<String, FiringWindow> state = trackers.get(component);
        if (state == null) {
            return Optional.empty();
        }
        FiringWindow window = state.get(policyName);
        return window == null ? Optional.empty() : Optional.ofNullable(window.lastFired());
    }

    public int trackedComponents() {
        return trackers.size();
    }

    void committed(PolicyFirings firings) {
        for (PolicyFirings.Reservation reservation : firings.reservations()) {
            metrics.recordPolicyFired(reservation.policyName());
            log.info("Policy {} fired for {}", reservation.policyName(), firings.component());
        }
    }

    void released(PolicyFirings firings) {
        if (firings.reservations().isEmpty()) {
            return;
        }
        // an evicted component has nothing left to roll back
        trackers.computeIfPresent(firings.component(), (component, state) -> {
            rollback(state, firings.reservations());
            return state;
        });
        log.info("Released {} uncommitted policy firings for {}", firings.reservations().size(), firings.component());
    }

    private static void rollback(Map<String, FiringWindow> state, List<PolicyFirings.Reservation> reservations) {
        for (PolicyFirings.Reservation reservation : reservations) {
            FiringWindow window = state.get(reservation.policyName());
            if (window != null) {
                window.rollback(reservation.firedAt(), reservation.previousFiring());
            }
        }
    }

    private PolicyFirings.Reservation tryFire(HealingPolicy policy, TelemetryEvent event,
                                              AnomalyClassification classification,
                                              Map<String, FiringWindow> state, Instant now) {
        validate(policy);
        if (!classification.getLevel().isAtLeast(policy.getMinimumLevel())) {
            return null;
        }
        for (PolicyCondition condition : policy.getConditions()) {
            if (!matches(policy, condition, event)) {
                return null;
            }
        }

        FiringWindow window = state.get(policy.getName());
        if (window != null && window.inCooldown(now, policy.getCooldown())) {
            log.debug("Policy {} in cooldown for {}", policy.getName(), event.getComponent());
            return null;
        }
        if (window != null && window.firingsInWindow(now) >= policy.getMaxExecutionsPerHour()) {
            log.debug("Policy {} rate limited for {}", policy.getName(), event.getComponent());
            return null;
        }
        FiringWindow target = state.computeIfAbsent(policy.getName(), name -> new FiringWindow());
        Instant previous = target.lastFired();
        target.record(now);
        return new PolicyFirings.Reservation(policy.getName(), now, previous);
    }

    private boolean matches(HealingPolicy policy, PolicyCondition condition, TelemetryEvent event) {
        TelemetryMetric metric = resolveMetric(policy, condition);
        ComparisonOperator operator = resolveOperator(policy, condition);
        Double value = metric.valueOf(event);
        // unreported optional metrics never satisfy a condition
        return value != null && operator.test(value, condition.getThreshold());
    }

    private void validate(HealingPolicy policy) {
        String name = policy.getName();
        if (name == null || name.isBlank()) {
            throw new PolicyEvaluationException(String.valueOf(name), "name is required");
        }
        if (policy.getConditions() == null || policy.getConditions().isEmpty()) {
            throw new PolicyEvaluationException(name, "at least one condition is required");
        }
        for (PolicyCondition condition : policy.getConditions()) {
            resolveMetric(policy, condition);
            resolveOperator(policy, condition);
            if (condition.getThreshold() == null || !Double.isFinite(condition.getThreshold())) {
                throw new PolicyEvaluationException(name, "condition '" + condition + "' has no finite threshold");
            }
        }
        if (policy.getActions() == null || policy.getActions().isEmpty()
                || policy.getActions().stream().anyMatch(a -> a == null || a.isBlank())) {
            throw new PolicyEvaluationException(name, "actions must be non-empty names");
        }
        if (policy.getCooldown() == null || policy.getCooldown().isNegative()) {
            throw new PolicyEvaluationException(name, "cooldown must be non-negative");
        }
        if (policy.getMaxExecutionsPerHour() <= 0) {
            throw new PolicyEvaluationException(name, "maxExecutionsPerHour must be positive");
        }
        if (policy.getMinimumLevel() == null) {
            throw new PolicyEvaluationException(name, "unknown minimum classification level");
        }
    }

    private static TelemetryMetric resolveMetric(HealingPolicy policy, PolicyCondition condition) {
        return TelemetryMetric.fromKey(condition.getMetric())
                .orElseThrow(() -> new PolicyEvaluationException(policy.getName(),
                        "unknown metric '" + condition.getMetric() + "'"));
    }

    private static ComparisonOperator resolveOperator(HealingPolicy policy, PolicyCondition condition) {
        return ComparisonOperator.fromSymbol(condition.getOperator())
                .orElseThrow(() -> new PolicyEvaluationException(policy.getName(),
                        "unknown operator '" + condition.getOperator() + "'"));
    }
}
