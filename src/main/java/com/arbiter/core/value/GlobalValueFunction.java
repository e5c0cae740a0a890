package com.arbiter.core.value;

import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.OptimizationTarget;
import com.arbiter.core.model.WorkspaceState;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Project-wide multi-criteria value function.
 * <p>
 * Scores any (state, action) pair as the weighted mean of per-goal scores from
 * {@link GoalScorers}. Weights need not sum to one. Mutated only through
 * {@link #updateGoalWeight} and {@link #setOptimizationTarget}, both of which
 * bump {@code updatedAt}. Not thread-safe: callers serialize writers.
 */
public class GlobalValueFunction {

    public static final String DEFAULT_VERSION = "1.0";

    private final String version;
    private final List<GlobalGoal> goals;
    private final Map<String, Object> constraints;
    private OptimizationTarget optimizationTarget;
    private final Instant createdAt;
    private Instant updatedAt;

    @JsonCreator
    public GlobalValueFunction(
            @JsonProperty("version") String version,
            @JsonProperty("goals") List<GlobalGoal> goals,
            @JsonProperty("constraints") Map<String, Object> constraints,
            @JsonProperty("optimization_target") OptimizationTarget optimizationTarget,
            @JsonProperty("created_at") Instant createdAt,
            @JsonProperty("updated_at") Instant updatedAt) {
        this.version = version != null ? version : DEFAULT_VERSION;
        this.goals = new ArrayList<>(goals != null ? goals : List.of());
        var seen = new HashSet<GoalType>();
        for (GlobalGoal goal : this.goals) {
            if (!seen.add(goal.goalType())) {
                throw new IllegalArgumentException("Duplicate goal type: " + goal.goalType().wireValue());
            }
        }
        this.constraints = new LinkedHashMap<>(constraints != null ? constraints : Map.of());
        this.optimizationTarget = optimizationTarget != null ? optimizationTarget : OptimizationTarget.BALANCE;
        this.createdAt = createdAt != null ? createdAt : Instant.now();
        this.updatedAt = updatedAt != null ? updatedAt : this.createdAt;
    }

    /**
     * The documented default: five goals, balanced target, and the standard
     * size constraints.
     */
    public static GlobalValueFunction defaults() {
        var goals = List.of(
                new GlobalGoal(GoalType.CODE_QUALITY, 0.30, 0.70,
                        "Code must have type hints, docstrings, and error handling",
                        List.of("type_hint_coverage", "docstring_coverage")),
                new GlobalGoal(GoalType.MAINTAINABILITY, 0.25, 0.60,
                        "Code must be easy to understand and modify",
                        List.of("cyclomatic_complexity", "lines_per_function")),
                new GlobalGoal(GoalType.SIMPLICITY, 0.20, 0.50,
                        "Prefer simple solutions over complex abstractions",
                        List.of("abstraction_count", "nesting_depth")),
                new GlobalGoal(GoalType.CONSISTENCY, 0.15, 0.60,
                        "Follow existing codebase patterns and conventions",
                        List.of("pattern_similarity")),
                new GlobalGoal(GoalType.TESTABILITY, 0.10, 0.50,
                        "Code must be testable with clear interfaces",
                        List.of("test_coverage")));
        var constraints = new LinkedHashMap<String, Object>();
        constraints.put("max_loc", 500);
        constraints.put("max_complexity", 10);
        constraints.put("min_test_coverage", 0.8);
        Instant now = Instant.now();
        return new GlobalValueFunction(DEFAULT_VERSION, goals, constraints, OptimizationTarget.BALANCE, now, now);
    }

    /**
     * Weighted mean of the per-goal scores, or 0.0 when the total weight is zero.
     */
    public double evaluate(WorkspaceState state, AgentAction action) {
        double totalWeight = 0.0;
        double weighted = 0.0;
        for (GlobalGoal goal : goals) {
            totalWeight += goal.weight();
            weighted += goal.weight() * GoalScorers.score(goal.goalType(), state, action);
        }
        if (totalWeight == 0.0) {
            return 0.0;
        }
        return GoalScorers.clamp(weighted / totalWeight);
    }

    /** Per-goal scores in goal order. */
    public Map<GoalType, Double> goalScores(WorkspaceState state, AgentAction action) {
        var scores = new EnumMap<GoalType, Double>(GoalType.class);
        for (GlobalGoal goal : goals) {
            scores.put(goal.goalType(), GoalScorers.score(goal.goalType(), state, action));
        }
        return scores;
    }

    /**
     * Describes every goal whose score falls below its threshold, as
     * {@code "<goal>: <score> < <threshold> (<description>)"}.
     */
    public List<String> checkThresholdViolations(WorkspaceState state, AgentAction action) {
        var violations = new ArrayList<String>();
        for (GlobalGoal goal : goals) {
            double value = GoalScorers.score(goal.goalType(), state, action);
            if (value < goal.threshold()) {
                violations.add(String.format(Locale.ROOT, "%s: %.2f < %.2f (%s)",
                        goal.goalType().wireValue(), value, goal.threshold(), goal.description()));
            }
        }
        return violations;
    }

    /**
     * Replaces the weight of the matching goal in place.
     *
     * @return {@code false} if no goal of that type is registered
     * @throws IllegalArgumentException if the weight is outside [0, 1]
     */
    public boolean updateGoalWeight(GoalType type, double newWeight) {
        for (int i = 0; i < goals.size(); i++) {
            if (goals.get(i).goalType() == type) {
                goals.set(i, goals.get(i).withWeight(newWeight));
                touch();
                return true;
            }
        }
        return false;
    }

    public Optional<GlobalGoal> goal(GoalType type) {
        return goals.stream().filter(g -> g.goalType() == type).findFirst();
    }

    public String getVersion() {
        return version;
    }

    public List<GlobalGoal> getGoals() {
        return Collections.unmodifiableList(goals);
    }

    public Map<String, Object> getConstraints() {
        return Collections.unmodifiableMap(constraints);
    }

    public OptimizationTarget getOptimizationTarget() {
        return optimizationTarget;
    }

    public void setOptimizationTarget(OptimizationTarget optimizationTarget) {
        this.optimizationTarget = optimizationTarget;
        touch();
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    private void touch() {
        Instant now = Instant.now();
        // Keep updatedAt strictly increasing even when the clock has not advanced.
        updatedAt = now.isAfter(updatedAt) ? now : updatedAt.plusNanos(1);
    }
}
