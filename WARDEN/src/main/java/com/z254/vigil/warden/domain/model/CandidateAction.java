package com.z254.vigil.warden.domain.model;

/**
 * Action proposed by a fired policy.
 *
 * @param policyName    the policy that fired
 * @param toolName      target tool
 * @param priority      priority of the firing policy
 * @param actionOrder   position within the policy's action list
 */
public record CandidateAction(String policyName, String toolName, int priority, int actionOrder) {
}
