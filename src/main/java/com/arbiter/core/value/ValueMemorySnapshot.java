package com.arbiter.core.value;

import java.time.Instant;
import java.util.List;

/**
 * The persisted state record: the global value function plus the bounded
 * alignment history and drift events.
 */
public record ValueMemorySnapshot(
    String version,
    Instant lastUpdated,
    GlobalValueFunction globalValueFunction,
    List<AlignmentRecord> alignmentHistory,
    List<DriftEvent> driftEvents
) {

    public ValueMemorySnapshot {
        alignmentHistory = alignmentHistory != null ? List.copyOf(alignmentHistory) : List.of();
        driftEvents = driftEvents != null ? List.copyOf(driftEvents) : List.of();
    }
}
