package com.z254.vigil.warden.gateway;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of one ordered gateway validation check.
 */
@Value
@Builder
public class SafetyCheck {

    public static final String BLACKLIST = "BLACKLIST";
    public static final String UNKNOWN_TOOL = "UNKNOWN_TOOL";
    public static final String BLAST_RADIUS = "BLAST_RADIUS";
    public static final String BUSINESS_HOURS = "BUSINESS_HOURS";
    public static final String CIRCUIT_BREAKER = "CIRCUIT_BREAKER";
    public static final String COOLDOWN = "COOLDOWN";
    public static final String TOOL_PRECONDITION = "TOOL_PRECONDITION";

    String name;

    boolean passed;

    String message;

    static SafetyCheck pass(String name) {
        return SafetyCheck.builder().name(name).passed(true).build();
    }

    static SafetyCheck fail(String name, String message) {
        return SafetyCheck.builder().name(name).passed(false).message(message).build();
    }
}
