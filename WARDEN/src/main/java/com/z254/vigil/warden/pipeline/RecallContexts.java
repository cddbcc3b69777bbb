package com.z254.vigil.warden.pipeline;

import com.z254.vigil.warden.domain.model.OutcomeNode;
import com.z254.vigil.warden.domain.model.RecallContext;
import com.z254.vigil.warden.domain.model.SimilarIncident;

import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Folds recalled incidents into a {@link RecallContext}.
 */
final class RecallContexts {

    private RecallContexts() {
    }

    static RecallContext from(List<SimilarIncident> hits) {
        if (hits == null || hits.isEmpty()) {
            return RecallContext.builder()
                    .available(true)
                    .similarIncidents(List.of())
                    .build();
        }

        double averageSimilarity = hits.stream()
                .mapToDouble(SimilarIncident::getSimilarity)
                .average()
                .orElse(0.0);

        int outcomes = 0;
        int successes = 0;
        Map<String, Integer> successfulActions = new HashMap<>();
        for (SimilarIncident hit : hits) {
            for (OutcomeNode outcome : hit.getIncident().getOutcomes()) {
                outcomes++;
                if (outcome.isSuccess()) {
                    successes++;
                    outcome.getActions().forEach(action -> successfulActions.merge(action, 1, Integer::sum));
                }
            }
        }

        // ties resolve alphabetically so the context is stable across runs
        String mostEffective = successfulActions.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(null);

        return RecallContext.builder()
                .available(true)
                .similarIncidents(hits)
                .averageSimilarity(averageSimilarity)
                .historicalSuccessRate(outcomes == 0 ? 0.0 : (double) successes / outcomes)
                .mostEffectiveAction(mostEffective)
                .build();
    }
}
