package com.z254.vigil.warden.config;

import com.z254.vigil.warden.memory.EmbeddingProvider;
import com.z254.vigil.warden.memory.GuardedIncidentMemory;
import com.z254.vigil.warden.memory.InMemoryIncidentGraph;
import com.z254.vigil.warden.memory.IncidentOutcomeMemory;
import com.z254.vigil.warden.memory.MetricEmbeddingProvider;
import com.z254.vigil.warden.observability.WardenMetrics;
import com.z254.vigil.warden.observability.WardenStructuredLogger;
import com.z254.vigil.warden.resilience.ResourceCircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wiring for the collaborators that are not plain components: the clock, the memory stack
 * behind its circuit breaker, and the frozen deployment capabilities.
 */
@Slf4j
@Configuration
public class WardenConfiguration {

    public static final String MEMORY_RESOURCE = "incident-memory";

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public EmbeddingProvider embeddingProvider() {
        return new MetricEmbeddingProvider();
    }

    @Bean
    @ConditionalOnMissingBean
    public IncidentOutcomeMemory incidentOutcomeMemory(EmbeddingProvider embeddingProvider,
                                                       WardenProperties properties,
                                                       Clock clock) {
        return new InMemoryIncidentGraph(embeddingProvider, properties, clock);
    }

    @Bean
    public GuardedIncidentMemory guardedIncidentMemory(IncidentOutcomeMemory memory,
                                                       WardenProperties properties,
                                                       WardenMetrics metrics,
                                                       WardenStructuredLogger structuredLogger,
                                                       Clock clock) {
        ResourceCircuitBreaker breaker = new ResourceCircuitBreaker(
                MEMORY_RESOURCE, properties.getMemory().getCircuitBreaker(), clock);
        return new GuardedIncidentMemory(memory, breaker, metrics, structuredLogger);
    }

    /**
     * Denies execution unless another entitlement bean is registered.
     */
    @Bean
    @ConditionalOnMissingBean
    public ExecutionEntitlement executionEntitlement() {
        return ExecutionEntitlement.denied();
    }

    @Bean
    public DeploymentCapabilities deploymentCapabilities(ExecutionEntitlement entitlement) {
        DeploymentCapabilities capabilities = DeploymentCapabilities.from(entitlement);
        log.info("Deployment capabilities resolved: executionPermitted={}, source={}",
                capabilities.isExecutionPermitted(), capabilities.getSource());
        return capabilities;
    }
}
