package com.arbiter.core.value;

import java.io.Serializable;

/**
 * Summary of the retained alignment history.
 *
 * @param lastDrift most recent drift event, or {@code null} if none is retained
 */
public record AlignmentStatistics(
    int totalActions,
    int alignedActions,
    double alignmentRate,
    double averageAlignmentScore,
    int driftEvents,
    DriftEvent lastDrift
) implements Serializable {}
