package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Historical context assembled from recalled incidents, used to enrich intents.
 */
@Value
@Builder
public class RecallContext {

    /** False when memory was unavailable or the recall branch timed out */
    boolean available;

    List<SimilarIncident> similarIncidents;

    double averageSimilarity;

    /** Success rate over all outcomes attached to the recalled incidents */
    double historicalSuccessRate;

    /** Most frequently successful action among recalled outcomes, may be null */
    String mostEffectiveAction;

    public static RecallContext unavailable() {
        return RecallContext.builder()
                .available(false)
                .similarIncidents(List.of())
                .build();
    }

    public boolean hasSimilarIncidents() {
        return similarIncidents != null && !similarIncidents.isEmpty();
    }
}
