package com.arbiter.core.policy;

import java.io.Serializable;

/**
 * Cost levels at which a session is warned, a single operation is rejected,
 * and a whole session is capped.
 */
public record CostThresholds(
    double warning,
    double rejection,
    double sessionLimit
) implements Serializable {

    public static CostThresholds defaults() {
        return new CostThresholds(100.0, 500.0, 2000.0);
    }
}
