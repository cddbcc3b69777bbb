package com.z254.vigil.warden.memory;

import com.z254.vigil.warden.domain.model.ActionEffectiveness;
import com.z254.vigil.warden.domain.model.IncidentNode;
import com.z254.vigil.warden.domain.model.SimilarIncident;
import com.z254.vigil.warden.domain.model.TelemetryEvent;

import java.util.List;
import java.util.Optional;

/**
 * Graph of past incidents linked to the outcomes that resolved them.
 */
public interface IncidentOutcomeMemory {

    /**
     * Store the incident for this event, or touch the existing node with the same fingerprint.
     */
    IncidentNode recordIncident(TelemetryEvent event);

    /**
     * Up to {@code k} nearest stored incidents, ascending distance, ties broken by most recent creation.
     */
    List<SimilarIncident> recall(TelemetryEvent event, int k);

    /**
     * Attach an outcome to a stored incident.
     *
     * @return the outcome id, the existing id for a repeated report in the same time bucket, or empty
     *         when the incident is not (or no longer) stored
     */
    Optional<String> storeOutcome(String incidentId, List<String> actions, boolean success,
                                  double durationMinutes, String lessonsLearned);

    /**
     * Actions ranked by historical success rate on the component.
     */
    List<ActionEffectiveness> mostEffectiveActions(String component, int k);

    Optional<IncidentNode> findIncident(String incidentId);

    MemoryStats stats();
}
