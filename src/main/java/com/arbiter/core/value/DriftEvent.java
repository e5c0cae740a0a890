package com.arbiter.core.value;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * Recorded when an action's alignment score falls below the drift threshold.
 */
public record DriftEvent(
    Instant timestamp,
    String agentId,
    String actionType,
    boolean aligned,
    double alignmentScore,
    List<String> warnings
) implements Serializable {

    public DriftEvent {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
