package com.arbiter.core.pricing;

import java.io.Serializable;

/**
 * Base complexity cost plus the surcharge for the specification's risk level.
 */
public record CostBreakdown(
    double baseCost,
    double securityCost
) implements Serializable {

    public double total() {
        return baseCost + securityCost;
    }
}
