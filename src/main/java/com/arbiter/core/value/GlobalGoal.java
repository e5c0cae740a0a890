package com.arbiter.core.value;

import com.arbiter.core.model.GoalType;

import java.io.Serializable;
import java.util.List;

/**
 * One weighted criterion of the global value function.
 *
 * @param goalType    which criterion
 * @param weight      relative weight in [0, 1]; weights are normalized at evaluation
 * @param threshold   minimum acceptable score in [0, 1]
 * @param description what the criterion demands, quoted in violation messages
 * @param metrics     names of the measurements behind the criterion
 */
public record GlobalGoal(
    GoalType goalType,
    double weight,
    double threshold,
    String description,
    List<String> metrics
) implements Serializable {

    public GlobalGoal {
        if (goalType == null) {
            throw new IllegalArgumentException("goal_type is required");
        }
        requireUnit("weight", weight);
        requireUnit("threshold", threshold);
        description = description != null ? description : "";
        metrics = metrics != null ? List.copyOf(metrics) : List.of();
    }

    public GlobalGoal withWeight(double newWeight) {
        return new GlobalGoal(goalType, newWeight, threshold, description, metrics);
    }

    private static void requireUnit(String field, double value) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(field + " must be within [0, 1], got " + value);
        }
    }
}
