package com.arbiter.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Priced cost of one specification. Always paired with the specification it
 * was computed for; never persisted.
 */
public record Cost(
    int loc,
    int dependencies,
    int abstractions,
    double total,
    double security,
    boolean withinBudget,
    BudgetStatus budgetStatus,
    double usagePercentage,
    String message,
    List<Alternative> alternatives  // empty unless rejected
) implements Serializable {

    public Cost {
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
    }
}
