package com.z254.vigil.warden.memory;

import com.z254.vigil.warden.domain.model.TelemetryEvent;

/**
 * Projects events into a fixed-dimension vector space for similarity recall.
 * Implementations must be deterministic for a given event and must always return
 * vectors of length {@link #dimension()}.
 */
public interface EmbeddingProvider {

    int dimension();

    double[] embed(TelemetryEvent event);
}
