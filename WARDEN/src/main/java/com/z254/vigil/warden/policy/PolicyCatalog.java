package com.z254.vigil.warden.policy;

import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.domain.model.ClassificationLevel;
import com.z254.vigil.warden.domain.model.HealingPolicy;
import com.z254.vigil.warden.domain.model.PolicyCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Immutable, priority-ordered set of policies loaded once at startup.
 * <p>
 * Definitions are converted leniently: an unknown metric, operator or level is carried through
 * and rejected when the policy is evaluated, so one bad entry cannot block the others.
 */
@Slf4j
@Component
public class PolicyCatalog {

    private final List<HealingPolicy> policies;

    @Autowired
    public PolicyCatalog(WardenProperties properties) {
        this(load(properties.getPolicy()));
    }

    public PolicyCatalog(List<HealingPolicy> policies) {
        // stable sort keeps declaration order among equal priorities
        this.policies = policies.stream()
                .sorted(Comparator.comparingInt(HealingPolicy::getPriority))
                .toList();
        log.info("Loaded {} healing policies: {}", this.policies.size(),
                this.policies.stream().map(HealingPolicy::getName).toList());
    }

    public List<HealingPolicy> getPolicies() {
        return policies;
    }

    private static List<HealingPolicy> load(WardenProperties.Policy config) {
        if (config.getDefinitions().isEmpty()) {
            return DefaultHealingPolicies.defaults(config.getDefaultCooldown(), config.getDefaultMaxExecutionsPerHour());
        }
        return config.getDefinitions().stream()
                .map(definition -> toPolicy(definition, config))
                .toList();
    }

    private static HealingPolicy toPolicy(WardenProperties.PolicyDefinition definition, WardenProperties.Policy config) {
        List<PolicyCondition> conditions = definition.getConditions().stream()
                .map(c -> PolicyCondition.builder()
                        .metric(c.getMetric())
                        .operator(c.getOperator())
                        .threshold(c.getThreshold())
                        .build())
                .toList();

        return HealingPolicy.builder()
                .name(definition.getName())
                .conditions(conditions)
                .actions(List.copyOf(definition.getActions()))
                .priority(definition.getPriority())
                .cooldown(definition.getCooldown() != null ? definition.getCooldown() : config.getDefaultCooldown())
                .maxExecutionsPerHour(definition.getMaxExecutionsPerHour() != null
                        ? definition.getMaxExecutionsPerHour()
                        : config.getDefaultMaxExecutionsPerHour())
                .minimumLevel(parseLevel(definition.getMinimumLevel()))
                .terminal(definition.isTerminal())
                .enabled(definition.isEnabled())
                .build();
    }

    private static ClassificationLevel parseLevel(String level) {
        if (level == null) {
            return ClassificationLevel.DEGRADING;
        }
        try {
            return ClassificationLevel.valueOf(level.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
