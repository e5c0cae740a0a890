package com.arbiter.core.policy;

import java.io.Serializable;
import java.util.List;

/**
 * Governance policy for one project: budgets, forbidden patterns, permissions
 * and cost thresholds.
 */
public record Policy(
    String name,
    PolicyBudgets budgets,
    List<ForbiddenPattern> forbiddenPatterns,
    Permissions permissions,
    CostThresholds costThresholds
) implements Serializable {

    public Policy {
        if (budgets == null) {
            throw new IllegalArgumentException("Policy budgets are required");
        }
        name = name != null ? name : "default";
        forbiddenPatterns = forbiddenPatterns != null ? List.copyOf(forbiddenPatterns) : List.of();
        permissions = permissions != null ? permissions : Permissions.denyAll();
        costThresholds = costThresholds != null ? costThresholds : CostThresholds.defaults();
    }

    /** A policy with only budgets set; everything else takes its default. */
    public static Policy withBudgets(PolicyBudgets budgets) {
        return new Policy("default", budgets, List.of(), Permissions.denyAll(), CostThresholds.defaults());
    }

    public List<String> forbiddenPatternNames() {
        return forbiddenPatterns.stream().map(ForbiddenPattern::name).toList();
    }
}
