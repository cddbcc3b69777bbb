package com.z254.vigil.warden.pipeline;

import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.domain.model.AnomalyClassification;
import com.z254.vigil.warden.domain.model.CandidateAction;
import com.z254.vigil.warden.domain.model.HealingIntent;
import com.z254.vigil.warden.domain.model.RecallContext;
import com.z254.vigil.warden.domain.model.RiskProfile;
import com.z254.vigil.warden.domain.model.TelemetryEvent;
import com.z254.vigil.warden.tool.RemediationTool;
import com.z254.vigil.warden.tool.ToolMetadata;
import com.z254.vigil.warden.tool.ToolRegistry;
import com.z254.vigil.warden.tool.builtin.ScaleOutTool;
import com.z254.vigil.warden.validation.Fingerprints;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns candidate actions into immutable {@link HealingIntent}s.
 * <p>
 * Intent ids derive from the event fingerprint and the tool name only, so a tool proposed by
 * two policies for the same event yields one intent (the first in policy order wins) and
 * re-submitting an identical event reproduces the same ids.
 */
@Component
public class IntentFactory {

    private final ToolRegistry toolRegistry;
    private final WardenProperties.Pipeline config;
    private final Clock clock;

    public IntentFactory(ToolRegistry toolRegistry, WardenProperties properties, Clock clock) {
        this.toolRegistry = toolRegistry;
        this.config = properties.getPipeline();
        this.clock = clock;
    }

    public List<HealingIntent> create(TelemetryEvent event,
                                      AnomalyClassification classification,
                                      List<CandidateAction> candidates,
                                      RecallContext recall) {
        double confidence = confidence(classification, recall);
        Set<String> seen = new LinkedHashSet<>();
        List<HealingIntent> intents = new ArrayList<>();

        for (CandidateAction candidate : candidates) {
            String intentId = intentId(event.getFingerprint(), candidate.toolName());
            if (!seen.add(intentId)) {
                continue;
            }
            Map<String, Object> parameters = parameters(candidate, classification);
            intents.add(HealingIntent.builder()
                    .intentId(intentId)
                    .toolName(candidate.toolName())
                    .component(event.getComponent())
                    .incidentId(event.incidentId())
                    .fingerprint(event.getFingerprint())
                    .policyName(candidate.policyName())
                    .parameters(parameters)
                    .justification(justification(event, classification, candidate, recall))
                    .confidence(confidence)
                    .riskProfile(riskProfile(candidate.toolName(), parameters))
                    .createdAt(clock.instant())
                    .build());
        }
        return List.copyOf(intents);
    }

    public static String intentId(String fingerprint, String toolName) {
        return Fingerprints.shortId("intent_", fingerprint + ":" + toolName);
    }

    double confidence(AnomalyClassification classification, RecallContext recall) {
        double confidence = Math.max(config.getBaseConfidence(), classification.getScore());
        if (recall != null && recall.hasSimilarIncidents()) {
            confidence *= config.getSimilarityBoost();
        }
        return Math.min(1.0, confidence);
    }

    private Map<String, Object> parameters(CandidateAction candidate, AnomalyClassification classification) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("policy", candidate.policyName());
        parameters.put("level", classification.getLevel().name());
        parameters.put("anomaly_score", round(classification.getScore()));
        return parameters;
    }

    /**
     * Risk attributes from the tool's metadata; an explicit {@code instances} parameter overrides
     * the default blast radius. Unknown tools get no profile and are denied by the gateway.
     */
    private RiskProfile riskProfile(String toolName, Map<String, Object> parameters) {
        return toolRegistry.getTool(toolName)
                .map(RemediationTool::getMetadata)
                .map(metadata -> {
                    int blastRadius = blastRadius(metadata, parameters.get(ScaleOutTool.INSTANCES));
                    double riskScore = Math.min(1.0,
                            metadata.getSafetyLevel().riskWeight() * (1.0 + blastRadius / 10.0));
                    return RiskProfile.builder()
                            .safetyLevel(metadata.getSafetyLevel())
                            .blastRadius(blastRadius)
                            .safeForBusinessHours(metadata.isSafeForBusinessHours())
                            .riskScore(riskScore)
                            .build();
                })
                .orElse(null);
    }

    private static int blastRadius(ToolMetadata metadata, Object instances) {
        if (instances instanceof Number number) {
            return number.intValue();
        }
        return metadata.getDefaultBlastRadius();
    }

    private String justification(TelemetryEvent event, AnomalyClassification classification,
                                 CandidateAction candidate, RecallContext recall) {
        StringBuilder text = new StringBuilder()
                .append("Policy ").append(candidate.policyName())
                .append(" proposed ").append(candidate.toolName())
                .append(" for ").append(event.getComponent())
                .append(": ").append(classification.getLevel())
                .append(" anomaly (score ").append(format(classification.getScore())).append(')')
                .append("; latency_p99=").append(format(event.getLatencyP99())).append("ms")
                .append(", error_rate=").append(format(event.getErrorRate()))
                .append(", throughput=").append(format(event.getThroughput()));

        if (recall == null || !recall.isAvailable()) {
            text.append(". No historical context available.");
        } else if (recall.hasSimilarIncidents()) {
            text.append(". ").append(recall.getSimilarIncidents().size())
                    .append(" similar incident(s), average similarity ").append(format(recall.getAverageSimilarity()))
                    .append(", historical success rate ").append(format(recall.getHistoricalSuccessRate()));
            if (recall.getMostEffectiveAction() != null) {
                text.append(", most effective action ").append(recall.getMostEffectiveAction());
            }
            text.append('.');
        } else {
            text.append(". No similar incidents recorded.");
        }

        String justification = text.toString();
        return justification.length() > HealingIntent.MAX_JUSTIFICATION_LENGTH
                ? justification.substring(0, HealingIntent.MAX_JUSTIFICATION_LENGTH)
                : justification;
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
