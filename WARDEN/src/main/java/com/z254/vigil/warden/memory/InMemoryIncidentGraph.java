package com.z254.vigil.warden.memory;

import com.z254.vigil.warden.config.WardenProperties;
import com.z254.vigil.warden.domain.model.ActionEffectiveness;
import com.z254.vigil.warden.domain.model.IncidentNode;
import com.z254.vigil.warden.domain.model.OutcomeNode;
import com.z254.vigil.warden.domain.model.SimilarIncident;
import com.z254.vigil.warden.domain.model.TelemetryEvent;
import com.z254.vigil.warden.validation.Fingerprints;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process incident-outcome graph.
 * <p>
 * Incidents are keyed by their fingerprint-derived id in an access-ordered map, so iteration
 * order is least-recently-accessed first and eviction removes the head. Every operation runs
 * under one lock per instance; recall hits and writes count as accesses, listing and ranking do not.
 */
@Slf4j
public class InMemoryIncidentGraph implements IncidentOutcomeMemory {

    private static final Comparator<SimilarIncident> RECALL_ORDER = Comparator
            .comparingDouble(SimilarIncident::getDistance)
            .thenComparing((SimilarIncident s) -> s.getIncident().getCreatedAt(), Comparator.reverseOrder())
            .thenComparing((SimilarIncident s) -> s.getIncident().getSequence(), Comparator.reverseOrder());

    private final EmbeddingProvider embeddingProvider;
    private final Clock clock;
    private final int maxIncidents;
    private final Duration recallLookback;
    private final long outcomeBucketMillis;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, StoredIncident> incidents = new LinkedHashMap<>(64, 0.75f, true);
    private long sequence;
    private long evictions;
    private int outcomeCount;

    public InMemoryIncidentGraph(EmbeddingProvider embeddingProvider, WardenProperties properties, Clock clock) {
        WardenProperties.Memory config = properties.getMemory();
        this.embeddingProvider = embeddingProvider;
        this.clock = clock;
        this.maxIncidents = config.getMaxIncidents();
        this.recallLookback = config.getRecallLookback();
        this.outcomeBucketMillis = Math.max(1, config.getOutcomeBucket().toMillis());
    }

    @Override
    public IncidentNode recordIncident(TelemetryEvent event) {
        String incidentId = event.incidentId();
        double[] embedding = embed(event);

        lock.lock();
        try {
            StoredIncident existing = incidents.get(incidentId);
            if (existing != null) {
                if (!existing.event.getFingerprint().equals(event.getFingerprint())) {
                    throw new IllegalStateException("Incident id collision for " + incidentId);
                }
                return existing.snapshot();
            }
            StoredIncident stored = new StoredIncident(incidentId, event, embedding, clock.instant(), ++sequence);
            incidents.put(incidentId, stored);
            evictOverflow();
            log.debug("Stored incident {} for component {}", incidentId, event.getComponent());
            return stored.snapshot();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<SimilarIncident> recall(TelemetryEvent event, int k) {
        if (k <= 0) {
            return List.of();
        }
        double[] query = embed(event);
        Instant horizon = clock.instant().minus(recallLookback);

        lock.lock();
        try {
            List<SimilarIncident> candidates = new ArrayList<>();
            for (StoredIncident stored : incidents.values()) {
                if (stored.createdAt.isBefore(horizon)) {
                    continue;
                }
                double distance = euclidean(query, stored.embedding);
                candidates.add(SimilarIncident.builder()
                        .incident(stored.snapshot())
                        .distance(distance)
                        .similarity(1.0 / (1.0 + distance))
                        .build());
            }
            candidates.sort(RECALL_ORDER);
            List<SimilarIncident> hits = List.copyOf(candidates.subList(0, Math.min(k, candidates.size())));
            // touch after iterating, access-ordered maps reorder on get
            hits.forEach(hit -> incidents.get(hit.getIncident().getIncidentId()));
            return hits;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<String> storeOutcome(String incidentId, List<String> actions, boolean success,
                                         double durationMinutes, String lessonsLearned) {
        Objects.requireNonNull(incidentId, "incidentId");
        List<String> actionList = List.copyOf(actions);
        Instant now = clock.instant();
        long bucket = now.toEpochMilli() / outcomeBucketMillis;
        String outcomeId = Fingerprints.shortId("out_",
                incidentId + "|" + String.join(",", actionList) + "|" + bucket);

        lock.lock();
        try {
            StoredIncident stored = incidents.get(incidentId);
            if (stored == null) {
                log.debug("Outcome {} dropped, incident {} not stored", outcomeId, incidentId);
                return Optional.empty();
            }
            boolean duplicate = stored.outcomes.stream().anyMatch(o -> o.getOutcomeId().equals(outcomeId));
            if (duplicate) {
                return Optional.of(outcomeId);
            }
            stored.outcomes.add(OutcomeNode.builder()
                    .outcomeId(outcomeId)
                    .incidentId(incidentId)
                    .actions(actionList)
                    .success(success)
                    .resolutionMinutes(durationMinutes)
                    .lessonsLearned(lessonsLearned)
                    .recordedAt(now)
                    .build());
            outcomeCount++;
            return Optional.of(outcomeId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<ActionEffectiveness> mostEffectiveActions(String component, int k) {
        Map<String, int[]> tally = new LinkedHashMap<>();

        lock.lock();
        try {
            for (StoredIncident stored : incidents.values()) {
                if (!stored.event.getComponent().equals(component)) {
                    continue;
                }
                for (OutcomeNode outcome : stored.outcomes) {
                    for (String action : outcome.getActions()) {
                        int[] counts = tally.computeIfAbsent(action, a -> new int[2]);
                        counts[0]++;
                        if (outcome.isSuccess()) {
                            counts[1]++;
                        }
                    }
                }
            }
        } finally {
            lock.unlock();
        }

        return tally.entrySet().stream()
                .map(e -> ActionEffectiveness.builder()
                        .action(e.getKey())
                        .attempts(e.getValue()[0])
                        .successes(e.getValue()[1])
                        .build())
                .sorted(Comparator.comparingDouble(ActionEffectiveness::getSuccessRate).reversed()
                        .thenComparing(ActionEffectiveness::getAttempts, Comparator.reverseOrder())
                        .thenComparing(ActionEffectiveness::getAction))
                .limit(Math.max(0, k))
                .toList();
    }

    @Override
    public Optional<IncidentNode> findIncident(String incidentId) {
        lock.lock();
        try {
            StoredIncident stored = incidents.get(incidentId);
            return Optional.ofNullable(stored).map(StoredIncident::snapshot);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public MemoryStats stats() {
        lock.lock();
        try {
            return MemoryStats.builder()
                    .incidentCount(incidents.size())
                    .outcomeCount(outcomeCount)
                    .evictions(evictions)
                    .maxIncidents(maxIncidents)
                    .build();
        } finally {
            lock.unlock();
        }
    }

    private void evictOverflow() {
        Iterator<Map.Entry<String, StoredIncident>> iterator = incidents.entrySet().iterator();
        while (incidents.size() > maxIncidents && iterator.hasNext()) {
            StoredIncident eldest = iterator.next().getValue();
            iterator.remove();
            evictions++;
            outcomeCount -= eldest.outcomes.size();
            log.debug("Evicted incident {} with {} outcomes", eldest.incidentId, eldest.outcomes.size());
        }
    }

    private double[] embed(TelemetryEvent event) {
        double[] vector = embeddingProvider.embed(event);
        if (vector == null || vector.length != embeddingProvider.dimension()) {
            throw new IllegalStateException("Embedding provider returned "
                    + (vector == null ? "null" : vector.length + " dimensions")
                    + ", expected " + embeddingProvider.dimension());
        }
        return vector.clone();
    }

    private static double euclidean(double[] a, double[] b) {
        double sum = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            sum += d * d;
        }
        return Math.sqrt(sum);
    }

    private static final class StoredIncident {
        private final String incidentId;
        private final TelemetryEvent event;
        private final double[] embedding;
        private final Instant createdAt;
        private final long sequence;
        private final List<OutcomeNode> outcomes = new ArrayList<>();

        private StoredIncident(String incidentId, TelemetryEvent event, double[] embedding,
                               Instant createdAt, long sequence) {
            this.incidentId = incidentId;
            this.event = event;
            this.embedding = embedding;
            this.createdAt = createdAt;
            this.sequence = sequence;
        }

        private IncidentNode snapshot() {
            return IncidentNode.builder()
                    .incidentId(incidentId)
                    .event(event)
                    .embedding(embedding.clone())
                    .createdAt(createdAt)
                    .sequence(sequence)
                    .outcomes(List.copyOf(outcomes))
                    .build();
        }
    }
}
