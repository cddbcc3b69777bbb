package com.z254.vigil.warden.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * A recalled incident and its distance to the query event.
 */
@Value
@Builder
public class SimilarIncident {

    IncidentNode incident;

    double distance;

    /** {@code 1 / (1 + distance)} */
    double similarity;
}
