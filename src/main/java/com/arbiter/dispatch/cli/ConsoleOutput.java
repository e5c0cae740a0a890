package com.arbiter.dispatch.cli;

import com.arbiter.core.events.ArbiterEvent;
import com.arbiter.core.model.Alternative;
import com.arbiter.core.model.Cost;
import com.arbiter.core.model.Specification;
import picocli.CommandLine;

import java.util.Locale;

/**
 * ANSI-colored terminal output utilities for the Arbiter CLI.
 */
public class ConsoleOutput {

    private ConsoleOutput() {
        // utility class
    }

    public static void printBanner() {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|bold,fg(yellow) ARBITER v0.1.0|@"));
        System.out.println("──────────────────────────────────");
    }

    public static void info(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(cyan) [ARBITER]|@ " + message));
    }

    public static void success(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(green) +|@ " + message));
    }

    public static void warn(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(yellow) !|@ " + message));
    }

    public static void error(String message) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "@|fg(red) x|@ " + message));
    }

    public static void section(String title) {
        System.out.println();
        System.out.println(CommandLine.Help.Ansi.AUTO.string("@|bold " + title + "|@"));
    }

    public static void spec(Specification spec) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(blue) [" + spec.variant() + "]|@ " + spec.intent()));
        System.out.println("    Risk: " + spec.riskLevel().wireValue()
                + " | LOC: " + spec.budgets().maxLocDelta()
                + " | Files: " + spec.budgets().maxNewFiles()
                + " | Deps: " + spec.budgets().maxNewDependencies()
                + " | Abstractions: " + spec.budgets().maxNewAbstractions());
        for (String criterion : spec.successCriteria()) {
            System.out.println("    - " + criterion);
        }
    }

    public static void cost(Cost cost) {
        String color = switch (cost.budgetStatus()) {
            case APPROVED -> "fg(green)";
            case ADVISORY -> "fg(cyan)";
            case WARNING -> "fg(yellow)";
            case REJECTED -> "fg(red)";
        };
        System.out.println(CommandLine.Help.Ansi.AUTO.string(String.format(Locale.ROOT,
                "  Cost: %.1f (security %.1f) @|%s %s|@ %s",
                cost.total(), cost.security(), color,
                cost.budgetStatus().wireValue().toUpperCase(), cost.message())));
    }

    public static void alternative(Alternative alternative) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                "  @|fg(magenta) " + alternative.strategy() + "|@ saves ~"
                        + alternative.estimatedSavings() + " - " + alternative.description()));
        System.out.println("      " + alternative.implementation());
    }

    /**
     * Live progress line for an event published while a coordination runs.
     */
    public static void event(ArbiterEvent event) {
        switch (event.eventType()) {
            case SPEC_SELECTED -> info(String.format(Locale.ROOT, "Selected %s spec (score %.2f, %s)",
                    event.text("variant").toLowerCase(Locale.ROOT), event.number("score"),
                    event.text("budgetStatus")));
            case ALIGNMENT_DRIFT -> warn(String.format(Locale.ROOT, "Drift: %s scored %.2f on %s",
                    event.agentId(), event.number("alignmentScore"), event.text("actionType")));
            default -> info(event.eventType().wireValue() + " " + event.coordinationId());
        }
    }

    public static void logEntry(int index, String entry) {
        System.out.println(CommandLine.Help.Ansi.AUTO.string(
                String.format("  @|faint %2d.|@ %s", index, entry)));
    }
}
