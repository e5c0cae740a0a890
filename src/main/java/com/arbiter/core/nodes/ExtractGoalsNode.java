package com.arbiter.core.nodes;

import com.arbiter.core.goals.GoalExtractor;
import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.IntentGoals;
import com.arbiter.core.state.CoordinationState;
import com.arbiter.core.value.GlobalValueMemory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;

/**
 * Extracts goals from the intent and folds them into the global value
 * function: every implied weight replaces the current one and the
 * optimization target is set to the one the intent asks for.
 */
@Component
public class ExtractGoalsNode {

    private final GoalExtractor goalExtractor;
    private final GlobalValueMemory valueMemory;

    public ExtractGoalsNode(GoalExtractor goalExtractor, GlobalValueMemory valueMemory) {
        this.goalExtractor = goalExtractor;
        this.valueMemory = valueMemory;
    }

    public Map<String, Object> apply(CoordinationState state) {
        IntentGoals goals = goalExtractor.extract(state.intent());
        var entries = new ArrayList<String>();
        entries.add("Extracted goals: " + goals.explicitGoals()
                + (goals.constraints().isEmpty() ? "" : ", constraints: " + goals.constraints()));

        valueMemory.initialize();
        for (Map.Entry<GoalType, Double> implied : goals.impliedGoals().entrySet()) {
            if (valueMemory.updateGlobalGoal(implied.getKey(), implied.getValue())) {
                entries.add(String.format(Locale.ROOT, "Updated %s weight to %.2f",
                        implied.getKey().wireValue(), implied.getValue()));
            }
        }
        valueMemory.setOptimizationTarget(goals.optimizationTarget());
        entries.add("Optimization target: " + goals.optimizationTarget().wireValue());

        return Map.of(
                "goals", goals,
                "phase", CoordinationPhase.GENERATE_CANDIDATES.name(),
                "coordinationLog", entries
        );
    }
}
