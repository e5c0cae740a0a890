package com.arbiter.dispatch.cli;

import com.arbiter.core.engine.Coordinator;
import com.arbiter.core.events.ArbiterEvent;
import com.arbiter.core.events.EventBus;
import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.model.CoordinationResult;
import com.arbiter.core.model.SpecificationValidationException;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.Locale;

/**
 * CLI command: arbiter coordinate "&lt;intent&gt;"
 * <p>
 * Runs one coordination for a build intent and prints the selected
 * specification, its cost, the alignment outcome and the coordination log.
 */
@Command(name = "coordinate", mixinStandardHelpOptions = true,
        description = "Select, price and validate a specification for a build intent")
@Component
public class CoordinateCommand implements Runnable {

    @Parameters(index = "0", description = "Natural language build intent")
    private String intent;

    @Option(names = {"--quiet", "-q"}, description = "Omit the coordination log")
    private boolean quiet;

    private final Coordinator coordinator;
    private final EventBus eventBus;

    public CoordinateCommand(Coordinator coordinator, EventBus eventBus) {
        this.coordinator = coordinator;
        this.eventBus = eventBus;
    }

    @Override
    public void run() {
        ConsoleOutput.printBanner();
        ConsoleOutput.info("Coordinating: " + intent);

        CoordinationResult result;
        try (var progress = eventBus.subscribe(ConsoleOutput::event,
                ArbiterEvent.Type.SPEC_SELECTED, ArbiterEvent.Type.ALIGNMENT_DRIFT)) {
            result = coordinator.coordinate(intent);
        } catch (SpecificationValidationException e) {
            ConsoleOutput.error("Invalid intent: " + e.getMessage());
            return;
        } catch (Exception e) {
            ConsoleOutput.error("Coordination failed: " + rootCauseMessage(e));
            return;
        }

        System.out.println();
        System.out.println("COORDINATION " + result.coordinationId());
        if (result.goals() != null) {
            System.out.println("Goals: " + result.goals().explicitGoals()
                    + " | Target: " + result.goals().optimizationTarget().wireValue()
                    + (result.goals().constraints().isEmpty() ? "" : " | Constraints: " + result.goals().constraints()));
        }

        if (result.phase() == CoordinationPhase.ERROR) {
            ConsoleOutput.error(result.error());
            if (!result.alternatives().isEmpty()) {
                ConsoleOutput.section("ALTERNATIVES:");
                result.alternatives().forEach(ConsoleOutput::alternative);
            }
        } else {
            ConsoleOutput.section("SELECTED SPEC:");
            ConsoleOutput.spec(result.selectedSpec());
            ConsoleOutput.cost(result.cost());
            System.out.println(String.format(Locale.ROOT, "  Selection score: %.2f", result.selectionScore()));
            if (result.execution() != null) {
                System.out.println("  Execution: " + result.execution().summary());
            }

            System.out.println();
            if (result.shouldRefine()) {
                ConsoleOutput.warn("Refinement required (aligned: " + result.aligned() + ")");
                for (String warning : result.warnings()) {
                    ConsoleOutput.warn("  " + warning);
                }
            } else {
                ConsoleOutput.success("Aligned with global values");
            }
        }

        if (!quiet) {
            ConsoleOutput.section("COORDINATION LOG:");
            int index = 1;
            for (String entry : result.coordinationLog()) {
                ConsoleOutput.logEntry(index++, entry);
            }
        }
    }

    private static String rootCauseMessage(Throwable e) {
        Throwable cause = e;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
