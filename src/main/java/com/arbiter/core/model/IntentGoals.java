package com.arbiter.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Goals and hard constraints extracted from a free-text build intent.
 *
 * @param explicitGoals      goal tags in match order, e.g. "high_quality", "simplicity"
 * @param impliedGoals       weights for goal types the intent changed (only changed entries)
 * @param optimizationTarget the target the intent asks for
 * @param constraints        hard constraint tags in match order
 */
public record IntentGoals(
    Set<String> explicitGoals,
    Map<GoalType, Double> impliedGoals,
    OptimizationTarget optimizationTarget,
    List<String> constraints
) implements Serializable {

    public static final String HIGH_QUALITY = "high_quality";
    public static final String SIMPLICITY = "simplicity";
    public static final String MAINTAINABILITY = "maintainability";
    public static final String PERFORMANCE = "performance";
    public static final String TESTABILITY = "testability";

    public static final String NO_EXTERNAL_DEPENDENCIES = "no_external_dependencies";
    public static final String NO_CLASSES = "no_classes";
    public static final String OPTIMIZE_FOR_PERFORMANCE = "optimize_for_performance";

    public IntentGoals {
        explicitGoals = explicitGoals != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(explicitGoals))
                : Set.of();
        EnumMap<GoalType, Double> weights = new EnumMap<>(GoalType.class);
        if (impliedGoals != null) {
            weights.putAll(impliedGoals);
        }
        impliedGoals = Collections.unmodifiableMap(weights);
        optimizationTarget = optimizationTarget != null ? optimizationTarget : OptimizationTarget.BALANCE;
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
    }

    /** Goals for an intent that matched nothing: balanced, no tags, no constraints. */
    public static IntentGoals neutral() {
        return new IntentGoals(Set.of(), Map.of(), OptimizationTarget.BALANCE, List.of());
    }

    public boolean hasGoal(String tag) {
        return explicitGoals.contains(tag);
    }

    public boolean hasConstraint(String constraint) {
        return constraints.contains(constraint);
    }
}
