package com.z254.vigil.warden.config;

/**
 * Externally verified answer to "may this deployment execute remediations autonomously".
 * <p>
 * Implementations consult a licensing or entitlement service; the answer must never be derived
 * from request data or plain configuration strings.
 */
public interface ExecutionEntitlement {

    boolean isExecutionPermitted();

    /**
     * Human-readable origin of the decision, reported in health details.
     */
    default String source() {
        return getClass().getSimpleName();
    }

    /**
     * Fallback used when no entitlement check is wired: execution is never permitted.
     */
    static ExecutionEntitlement denied() {
        return new ExecutionEntitlement() {
            @Override
            public boolean isExecutionPermitted() {
                return false;
            }

            @Override
            public String source() {
                return "none";
            }
        };
    }
}
