package com.z254.vigil.warden.memory;

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time counters of an incident memory.
 */
@Value
@Builder
public class MemoryStats {
    int incidentCount;
    int outcomeCount;
    long evictions;
    int maxIncidents;
}
