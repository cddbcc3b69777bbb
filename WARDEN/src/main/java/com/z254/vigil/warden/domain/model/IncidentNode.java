package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a stored incident together with its outcome history.
 */
@Value
@Builder
public class IncidentNode {

    String incidentId;

    TelemetryEvent event;

    double[] embedding;

    Instant createdAt;

    /** Insertion order, breaks ties between incidents created at the same instant */
    long sequence;

    List<OutcomeNode> outcomes;

    public String getComponent() {
        return event.getComponent();
    }

    public String getFingerprint() {
        return event.getFingerprint();
    }
}
