package com.z254.vigil.warden.gateway;

/**
 * No pending approval exists under the given id (never created, already resolved or expired).
 */
public class ApprovalNotFoundException extends RuntimeException {

    public ApprovalNotFoundException(String approvalId) {
        super("No pending approval: " + approvalId);
    }
}
