package com.z254.vigil.warden.validation;

import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.domain.model.EventSeverity;
import com.z254.vigil.warden.domain.model.TelemetryEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;
import java.util.regex.Pattern;

/**
 * Normalizes raw telemetry records into canonical {@link TelemetryEvent}s.
 * <p>
 * Stateless apart from logging. Every failure names the offending field; rejected records
 * never reach the classifier.
 */
@Slf4j
@Component
public class EventValidator {

    public static final String COMPONENT = "component";
    public static final String LATENCY_P99 = "latency_p99";
    public static final String ERROR_RATE = "error_rate";
    public static final String THROUGHPUT = "throughput";
    public static final String CPU_UTIL = "cpu_util";
    public static final String MEMORY_UTIL = "memory_util";
    public static final String SEVERITY = "severity";

    private static final Pattern COMPONENT_PATTERN = Pattern.compile("^[a-z0-9]+(-[a-z0-9]+)*$");

    private final WardenProperties.Validation limits;
    private final Clock clock;

    public EventValidator(WardenProperties properties, Clock clock) {
        this.limits = properties.getValidation();
        this.clock = clock;
    }

    /**
     * Validate and normalize a raw record.
     *
     * @throws EventValidationException naming the first offending field
     */
    public TelemetryEvent validate(Map<String, ?> raw) {
        if (raw == null) {
            throw reject("record", "record is missing");
        }
        try {
            String component = normalizeComponent(raw.get(COMPONENT));
            double latency = requiredNumber(raw, LATENCY_P99, 0, limits.getMaxLatencyMs());
            double errorRate = requiredNumber(raw, ERROR_RATE, 0, 1);
            double throughput = requiredNumber(raw, THROUGHPUT, 0, limits.getMaxThroughput());
            Double cpu = optionalNumber(raw, CPU_UTIL, 0, 1);
            Double memory = optionalNumber(raw, MEMORY_UTIL, 0, 1);
            EventSeverity severity = parseSeverity(raw.get(SEVERITY));

            String fingerprint = Fingerprints.sha256Hex(
                    canonicalEncoding(component, latency, errorRate, throughput, cpu, memory, severity));

            return TelemetryEvent.builder()
                    .component(component)
                    .latencyP99(latency)
                    .errorRate(errorRate)
                    .throughput(throughput)
                    .cpuUtil(cpu)
                    .memoryUtil(memory)
                    .severity(severity)
                    .fingerprint(fingerprint)
                    .receivedAt(clock.instant())
                    .build();
        } catch (EventValidationException e) {
            log.warn("Dropping invalid telemetry record: field={}, reason={}", e.getField(), e.getReason());
            throw e;
        }
    }

    /**
     * Canonical field encoding hashed into the fingerprint. Reception time is excluded.
     */
    static String canonicalEncoding(String component, double latency, double errorRate, double throughput,
                                    Double cpu, Double memory, EventSeverity severity) {
        StringJoiner joiner = new StringJoiner("|");
        joiner.add(COMPONENT + "=" + component);
        joiner.add(LATENCY_P99 + "=" + Fingerprints.canonicalNumber(latency));
        joiner.add(ERROR_RATE + "=" + Fingerprints.canonicalNumber(errorRate));
        joiner.add(THROUGHPUT + "=" + Fingerprints.canonicalNumber(throughput));
        joiner.add(CPU_UTIL + "=" + Fingerprints.canonicalNumber(cpu));
        joiner.add(MEMORY_UTIL + "=" + Fingerprints.canonicalNumber(memory));
        joiner.add(SEVERITY + "=" + severity.name());
        return joiner.toString();
    }

    private String normalizeComponent(Object value) {
        if (value == null) {
            throw reject(COMPONENT, "is required");
        }
        if (!(value instanceof CharSequence)) {
            throw reject(COMPONENT, "must be a string");
        }
        String component = value.toString().trim().toLowerCase(Locale.ROOT);
        if (component.isEmpty()) {
            throw reject(COMPONENT, "must not be blank");
        }
        if (component.length() > limits.getMaxComponentLength()) {
            throw reject(COMPONENT, "exceeds " + limits.getMaxComponentLength() + " characters");
        }
        if (!COMPONENT_PATTERN.matcher(component).matches()) {
            throw reject(COMPONENT, "must contain only lowercase letters, digits and single hyphens");
        }
        return component;
    }

    private double requiredNumber(Map<String, ?> raw, String field, double min, double max) {
        Double value = optionalNumber(raw, field, min, max);
        if (value == null) {
            throw reject(field, "is required");
        }
        return value;
    }

    private Double optionalNumber(Map<String, ?> raw, String field, double min, double max) {
        Object value = raw.get(field);
        if (value == null) {
            return null;
        }
        double number;
        if (value instanceof Number n) {
            number = n.doubleValue();
        } else if (value instanceof CharSequence text) {
            try {
                number = Double.parseDouble(text.toString().trim());
            } catch (NumberFormatException e) {
                throw reject(field, "is not a number: '" + text + "'");
            }
        } else {
            throw reject(field, "must be numeric");
        }
        if (Double.isNaN(number) || Double.isInfinite(number)) {
            throw reject(field, "must be finite");
        }
        if (number < min || number > max) {
            throw reject(field, "must be within [" + Fingerprints.canonicalNumber(min) + ", "
                    + Fingerprints.canonicalNumber(max) + "], got " + Fingerprints.canonicalNumber(number));
        }
        return number;
    }

    private EventSeverity parseSeverity(Object value) {
        if (value == null) {
            return EventSeverity.LOW;
        }
        try {
            return EventSeverity.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw reject(SEVERITY, "unknown severity '" + value + "'");
        }
    }

    private static EventValidationException reject(String field, String reason) {
        return new EventValidationException(field, reason);
    }
}
