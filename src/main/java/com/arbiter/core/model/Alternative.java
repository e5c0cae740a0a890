package com.arbiter.core.model;

import java.io.Serializable;

/**
 * A fallback strategy offered when a candidate is over budget.
 *
 * @param strategy         stable strategy name, e.g. "reduce_scope"
 * @param description      what the strategy does
 * @param estimatedSavings LOC saved, independent of the other strategies
 * @param implementation   concrete next step derived from the specification
 */
public record Alternative(
    String strategy,
    String description,
    int estimatedSavings,
    String implementation
) implements Serializable {}
