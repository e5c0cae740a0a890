package com.arbiter.core.value;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;

/**
 * One entry of the bounded alignment history.
 */
public record AlignmentRecord(
    Instant timestamp,
    String agentId,
    String actionType,
    boolean aligned,
    double alignmentScore,
    List<String> warnings
) implements Serializable {

    public AlignmentRecord {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
