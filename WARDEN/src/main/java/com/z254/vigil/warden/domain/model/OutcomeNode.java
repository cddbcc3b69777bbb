package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Recorded result of one remediation attempt, owned by exactly one incident.
 */
@Value
@Builder
public class OutcomeNode {

    String outcomeId;

    /** Owning incident, the source of the "resolved-by" edge */
    String incidentId;

    List<String> actions;

    boolean success;

    double resolutionMinutes;

    String lessonsLearned;

    Instant recordedAt;
}
