package com.arbiter.core.model;

import java.io.Serializable;

/**
 * Outcome of checking one estimated cost against a budget limit.
 *
 * @param status          the graduated classification
 * @param usagePercentage cost as a percentage of the limit (100.0 when the limit is zero)
 * @param message         human-readable explanation
 */
public record BudgetCheck(
    BudgetStatus status,
    double usagePercentage,
    String message
) implements Serializable {

    public boolean canProceed() {
        return status.canProceed();
    }
}
