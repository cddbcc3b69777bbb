package com.z254.vigil.warden.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.DayOfWeek;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Configuration properties for the WARDEN service.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Telemetry validation bounds</li>
 *     <li>Anomaly classification thresholds and baseline tuning</li>
 *     <li>Incident-outcome memory sizing and circuit breaking</li>
 *     <li>Healing policies, cooldowns and rate limits</li>
 *     <li>Safety gateway guardrails and approval workflow</li>
 * </ul>
 * The execution capability of a deployment is deliberately absent here; it is supplied by
 * {@link ExecutionEntitlement}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "warden")
public class WardenProperties {

    private final Validation validation = new Validation();
    private final Classification classification = new Classification();
    private final Memory memory = new Memory();
    private final Policy policy = new Policy();
    private final Gateway gateway = new Gateway();
    private final Connector connector = new Connector();
    private final Pipeline pipeline = new Pipeline();

    /**
     * Field bounds applied by the event validator.
     */
    @Data
    public static class Validation {
        @Positive
        private int maxComponentLength = 63;

        @Positive
        private double maxLatencyMs = 10_000;

        @Positive
        private double maxThroughput = 1_000_000_000d;
    }

    /**
     * Anomaly classifier configuration.
     */
    @Data
    public static class Classification {
        /** Weight of the newest observation in the exponential baseline */
        @DecimalMin("0.01")
        @DecimalMax("1.0")
        private double ewmaAlpha = 0.3;

        /** Observations required before dynamic deviation contributes to the score */
        private int warmupSamples = 5;

        /** z-score at which dynamic deviation starts counting */
        private double deviationOnset = 2.0;

        /** z-score at which dynamic deviation saturates at 1.0 */
        private double deviationSaturation = 4.0;

        @Positive
        private int maxTrackedComponents = 10_000;

        /** Per-metric aggregation weights keyed by metric name; missing entries weigh 1.0 */
        private Map<String, Double> weights = new LinkedHashMap<>();

        private final Thresholds thresholds = new Thresholds();

        @Data
        public static class Thresholds {
            private double latencyWarningMs = 150;
            private double latencyCriticalMs = 300;
            private double errorRateWarning = 0.05;
            private double errorRateCritical = 0.30;
            private double cpuWarning = 0.80;
            private double cpuCritical = 0.90;
            private double memoryWarning = 0.80;
            private double memoryCritical = 0.90;
        }
    }

    /**
     * Incident-outcome memory configuration.
     */
    @Data
    public static class Memory {
        @Positive
        private int maxIncidents = 1000;

        /** Only incidents created within this window are recalled */
        @NotNull
        private Duration recallLookback = Duration.ofDays(7);

        /** Identical outcome reports inside one bucket are recorded once */
        @NotNull
        private Duration outcomeBucket = Duration.ofSeconds(60);

        @Positive
        private int defaultRecallLimit = 5;

        private final Breaker circuitBreaker = new Breaker();
    }

    /**
     * Policy engine configuration.
     */
    @Data
    public static class Policy {
        @Positive
        private int maxTrackedComponents = 100;

        @NotNull
        private Duration defaultCooldown = Duration.ofSeconds(300);

        @Positive
        private int defaultMaxExecutionsPerHour = 5;

        /** Configured policies; when empty the built-in catalog is used */
        private List<PolicyDefinition> definitions = new ArrayList<>();
    }

    /**
     * Externally configured healing policy.
     */
    @Data
    public static class PolicyDefinition {
        @NotBlank
        private String name;
        private List<ConditionDefinition> conditions = new ArrayList<>();
        private List<String> actions = new ArrayList<>();
        private int priority = 5;
        private Duration cooldown;
        private Integer maxExecutionsPerHour;
        private String minimumLevel = "DEGRADING";
        private boolean terminal;
        private boolean enabled = true;
    }

    @Data
    public static class ConditionDefinition {
        private String metric;
        private String operator;
        private Double threshold;
    }

    /**
     * Safety gateway configuration.
     */
    @Data
    public static class Gateway {
        @NotNull
        private ExecutionMode defaultMode = ExecutionMode.ADVISORY;

        private Set<String> blacklist = new LinkedHashSet<>(List.of(
                "database_drop", "full_rollout", "system_shutdown", "secret_rotation"));

        @Positive
        private int maxBlastRadius = 5;

        @NotNull
        private Duration toolCooldown = Duration.ofMinutes(5);

        @NotNull
        private Duration approvalTtl = Duration.ofMinutes(30);

        /** Interval of the expired-approval sweep */
        @Positive
        private long approvalSweepIntervalMs = 30_000;

        @NotNull
        private Duration idempotencyWindow = Duration.ofHours(24);

        @Positive
        private int idempotencyCapacity = 10_000;

        @Positive
        private int maxTrackedCooldowns = 10_000;

        private final BusinessHours businessHours = new BusinessHours();
        private final Breaker circuitBreaker = new Breaker();
    }

    @Data
    public static class BusinessHours {
        private boolean enabled = false;
        private String zone = "UTC";
        private int startHour = 9;
        private int endHour = 18;
        private Set<DayOfWeek> days = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
    }

    /**
     * Circuit breaker settings shared by memory and per-tool breakers.
     */
    @Data
    public static class Breaker {
        @Positive
        private int failureThreshold = 3;

        @NotNull
        private Duration recoveryTimeout = Duration.ofSeconds(30);
    }

    /**
     * Remediation-execution collaborator.
     */
    @Data
    public static class Connector {
        @NotBlank
        private String url = "http://localhost:8095";
        @NotNull
        private Duration timeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Pipeline {
        @NotNull
        private Duration analysisTimeout = Duration.ofSeconds(5);

        /** Confidence floor for generated intents */
        private double baseConfidence = 0.5;

        /** Multiplier applied when similar incidents were recalled */
        private double similarityBoost = 1.1;

        @Positive
        private int recallLimit = 5;
    }

    /**
     * Execution ladder requested for a gateway submission.
     */
    public enum ExecutionMode {
        /** Recommend only, never execute */
        ADVISORY,
        /** Execute after human sign-off */
        APPROVAL,
        /** Execute directly under guardrails */
        AUTONOMOUS
    }
}
