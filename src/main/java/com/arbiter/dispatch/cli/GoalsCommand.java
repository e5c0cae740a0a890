package com.arbiter.dispatch.cli;

import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.OptimizationTarget;
import com.arbiter.core.value.GlobalGoal;
import com.arbiter.core.value.GlobalValueFunction;
import com.arbiter.core.value.GlobalValueMemory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * CLI command: arbiter goals [--set type=weight] [--target target] [--reset]
 * <p>
 * Shows the global value function, optionally changing goal weights or the
 * optimization target first. Changes are persisted.
 */
@Command(name = "goals", mixinStandardHelpOptions = true, description = "Show or adjust the global value goals")
@Component
public class GoalsCommand implements Runnable {

    @Option(names = "--set", description = "Set a goal weight, e.g. --set code_quality=0.4 (repeatable)")
    private Map<String, String> weights = new LinkedHashMap<>();

    @Option(names = "--target", description = "Optimization target: maximize_quality, maximize_speed, balance")
    private String target;

    @Option(names = "--reset", description = "Discard stored goals and history and restore the defaults")
    private boolean reset;

    @Spec
    private CommandSpec spec;

    private final GlobalValueMemory valueMemory;

    public GoalsCommand(GlobalValueMemory valueMemory) {
        this.valueMemory = valueMemory;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        valueMemory.initialize();

        if (reset) {
            valueMemory.resetToDefaults();
            ConsoleOutput.success("Global value function reset to defaults");
        }

        for (Map.Entry<String, String> entry : weights.entrySet()) {
            GoalType type;
            double weight;
            try {
                type = GoalType.parse(entry.getKey());
                weight = Double.parseDouble(entry.getValue());
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), "Invalid goal weight " + entry.getKey()
                        + "=" + entry.getValue() + ": " + e.getMessage());
            }
            if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
                throw new ParameterException(spec.commandLine(),
                        "Weight for " + type.wireValue() + " must be between 0 and 1, got " + entry.getValue());
            }
            if (valueMemory.updateGlobalGoal(type, weight)) {
                ConsoleOutput.success(String.format(Locale.ROOT, "Updated %s weight to %.2f", type.wireValue(), weight));
            } else {
                ConsoleOutput.error("No global goal of type " + type.wireValue());
            }
        }

        if (target != null) {
            try {
                valueMemory.setOptimizationTarget(OptimizationTarget.parse(target));
                ConsoleOutput.success("Optimization target set to " + target);
            } catch (IllegalArgumentException e) {
                throw new ParameterException(spec.commandLine(), "Invalid target: " + target
                        + ". Valid targets: maximize_quality, maximize_speed, balance");
            }
        }

        GlobalValueFunction global = valueMemory.getGlobalValueFunction();
        System.out.println();
        System.out.println("GLOBAL VALUE FUNCTION v" + global.getVersion()
                + " (target: " + global.getOptimizationTarget().wireValue() + ")");
        System.out.printf("  %-16s %7s %10s  %s%n", "GOAL", "WEIGHT", "THRESHOLD", "DESCRIPTION");
        for (GlobalGoal goal : global.getGoals()) {
            System.out.printf(Locale.ROOT, "  %-16s %7.2f %10.2f  %s%n",
                    goal.goalType().wireValue(), goal.weight(), goal.threshold(), goal.description());
        }
        if (!global.getConstraints().isEmpty()) {
            System.out.println("  Constraints: " + global.getConstraints());
        }
        System.out.println("  Updated: " + global.getUpdatedAt());
    }
}
