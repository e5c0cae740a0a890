package com.arbiter.dispatch.cli;

import com.arbiter.core.engine.Coordinator;
import com.arbiter.core.events.ArbiterEvent;
import com.arbiter.core.events.EventBus;
import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.Alternative;
import com.arbiter.core.model.BudgetStatus;
import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.model.CoordinationResult;
import com.arbiter.core.model.Cost;
import com.arbiter.core.model.ExecutionResult;
import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.IntentGoals;
import com.arbiter.core.model.RiskLevel;
import com.arbiter.core.model.SpecVariant;
import com.arbiter.core.model.Specification;
import com.arbiter.core.model.SpecificationBudget;
import com.arbiter.core.model.SpecificationValidationException;
import com.arbiter.core.model.WorkspaceState;
import com.arbiter.core.value.GlobalValueMemory;
import com.arbiter.core.value.InMemoryValueMemoryStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Tests for the Arbiter CLI command structure.
 * These tests exercise picocli directly without a Spring context,
 * validating command parsing, help output and execution behavior.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private Coordinator coordinator;
    private EventBus eventBus;
    private GlobalValueMemory memory;

    @BeforeEach
    void setUp() {
        coordinator = mock(Coordinator.class);
        eventBus = new EventBus();
        memory = new GlobalValueMemory(new InMemoryValueMemoryStore());
    }

    /**
     * Custom picocli IFactory that supplies the test dependencies to commands.
     */
    private CommandLine.IFactory createFactory() {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == CoordinateCommand.class) {
                    return (K) new CoordinateCommand(coordinator, eventBus);
                }
                if (cls == GoalsCommand.class) {
                    return (K) new GoalsCommand(memory);
                }
                if (cls == AlignmentCommand.class) {
                    return (K) new AlignmentCommand(memory);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            CommandLine commandLine = new CommandLine(new ArbiterCommand(), createFactory());
            int exitCode = commandLine.execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private static Specification spec() {
        return new Specification("create a simple calculator class", SpecVariant.BASE,
                List.of("Implement: create a simple calculator class"),
                new SpecificationBudget(150, 4, 3, 5, 10), RiskLevel.LOW,
                Set.of(), List.of(), List.of(), List.of());
    }

    // ── Top-level command ───────────────────────────────────────────

    @Nested
    @DisplayName("top-level command")
    class TopLevel {

        @Test
        @DisplayName("--help lists the subcommands")
        void help() {
            CliResult result = execute("--help");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("coordinate"));
            assertTrue(result.output().contains("goals"));
            assertTrue(result.output().contains("alignment"));
        }

        @Test
        @DisplayName("--version prints the version")
        void version() {
            CliResult result = execute("--version");

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Arbiter 0.1.0"));
        }

        @Test
        @DisplayName("no subcommand prints the banner and usage")
        void noSubcommand() {
            CliResult result = execute();

            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("ARBITER"));
            assertTrue(result.output().contains("Usage"));
        }

        @Test
        @DisplayName("an unknown subcommand fails")
        void unknownSubcommand() {
            assertNotEquals(0, execute("deploy").exitCode());
        }
    }

    // ── coordinate ──────────────────────────────────────────────────

    @Nested
    @DisplayName("coordinate")
    class Coordinate {

        @Test
        @DisplayName("prints the selected spec, refinement warnings and the log")
        void selected() {
            var cost = new Cost(150, 3, 5, 400.0, 0.0, true, BudgetStatus.APPROVED, 15.0,
                    "Within budget: 15.0% used.", List.of());
            var execution = new ExecutionResult(
                    new AgentAction("code_generation", "", List.of(), Map.of()), "Dry run: nothing generated");
            var result = new CoordinationResult("ARB-2026-0001", "create a simple calculator class",
                    CoordinationPhase.REFINE, IntentGoals.neutral(), List.of(), spec(), cost, 0.85,
                    null, execution, false, List.of("code_quality: 0.50 < 0.70"), true,
                    "Please refine the result to address:\n- code_quality: 0.50 < 0.70\n", null, List.of(),
                    List.of("Coordination ARB-2026-0001 started: create a simple calculator class"));
            when(coordinator.coordinate(anyString())).thenReturn(result);

            CliResult cli = execute("coordinate", "create a simple calculator class");

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("COORDINATION ARB-2026-0001"));
            assertTrue(cli.output().contains("SELECTED SPEC:"));
            assertTrue(cli.output().contains("Cost: 400.0"));
            assertTrue(cli.output().contains("Selection score: 0.85"));
            assertTrue(cli.output().contains("code_quality: 0.50 < 0.70"));
            assertTrue(cli.output().contains("COORDINATION LOG:"));
        }

        @Test
        @DisplayName("--quiet omits the coordination log")
        void quiet() {
            var result = new CoordinationResult("ARB-2026-0002", "add a cache", CoordinationPhase.DONE,
                    null, List.of(), spec(), new Cost(150, 3, 5, 400.0, 0.0, true, BudgetStatus.APPROVED,
                    15.0, "Within budget: 15.0% used.", List.of()), 0.9, null, null, true, List.of(),
                    false, null, null, List.of(), List.of("entry"));
            when(coordinator.coordinate(anyString())).thenReturn(result);

            CliResult cli = execute("coordinate", "--quiet", "add a cache");

            assertTrue(cli.output().contains("Aligned with global values"));
            assertFalse(cli.output().contains("COORDINATION LOG:"));
        }

        @Test
        @DisplayName("prints alternatives when everything is over budget")
        void overBudget() {
            var result = new CoordinationResult("ARB-2026-0003", "redesign the payment architecture",
                    CoordinationPhase.ERROR, null, List.of(), null, null, 0.0, null, null, false, List.of(),
                    false, null, "All spec candidates exceed budget",
                    List.of(new Alternative("reduce_scope", "Remove non-essential features from specification",
                            80, "Review the 3 success criteria and drop the optional ones")),
                    List.of());
            when(coordinator.coordinate(anyString())).thenReturn(result);

            CliResult cli = execute("coordinate", "redesign the payment architecture");

            assertTrue(cli.output().contains("All spec candidates exceed budget"));
            assertTrue(cli.output().contains("ALTERNATIVES:"));
            assertTrue(cli.output().contains("reduce_scope"));
            assertFalse(cli.output().contains("SELECTED SPEC:"));
        }

        @Test
        @DisplayName("prints selection and drift events while the coordination runs")
        void liveProgress() {
            var cost = new Cost(150, 3, 5, 400.0, 0.0, true, BudgetStatus.APPROVED, 15.0,
                    "Within budget: 15.0% used.", List.of());
            var result = new CoordinationResult("ARB-2026-0004", "add a cache", CoordinationPhase.REFINE,
                    null, List.of(), spec(), cost, 0.85, null, null, false, List.of(), true, null, null,
                    List.of(), List.of());
            when(coordinator.coordinate(anyString())).thenAnswer(invocation -> {
                eventBus.publish(ArbiterEvent.of(ArbiterEvent.Type.SPEC_SELECTED, "ARB-2026-0004",
                        "arbiter_coordinator", Map.of("variant", "BASE", "score", 0.85, "budgetStatus", "approved")));
                eventBus.publish(ArbiterEvent.of(ArbiterEvent.Type.ALIGNMENT_DRIFT, "ARB-2026-0004",
                        "arbiter_coordinator", Map.of("alignmentScore", 0.2, "actionType", "code_generation")));
                eventBus.publish(ArbiterEvent.of(ArbiterEvent.Type.COORDINATION_COMPLETED, "ARB-2026-0004",
                        "arbiter_coordinator", Map.of("phase", "REFINE")));
                return result;
            });

            CliResult cli = execute("coordinate", "--quiet", "add a cache");

            assertTrue(cli.output().contains("Selected base spec (score 0.85, approved)"));
            assertTrue(cli.output().contains("Drift: arbiter_coordinator scored 0.20 on code_generation"));
            assertFalse(cli.output().contains("[ARBITER] coordination.completed"));
        }

        @Test
        @DisplayName("stops listening once the coordination returns")
        void listenerRemoved() {
            var result = new CoordinationResult("ARB-2026-0005", "add a cache", CoordinationPhase.ERROR,
                    null, List.of(), null, null, 0.0, null, null, false, List.of(), false, null,
                    "All spec candidates exceed budget", List.of(), List.of());
            when(coordinator.coordinate(anyString())).thenReturn(result);
            execute("coordinate", "add a cache");

            ByteArrayOutputStream capture = new ByteArrayOutputStream();
            PrintStream originalOut = System.out;
            System.setOut(new PrintStream(capture, true));
            try {
                eventBus.publish(ArbiterEvent.of(ArbiterEvent.Type.SPEC_SELECTED, "ARB-2026-0006",
                        "arbiter_coordinator", Map.of("variant", "BASE")));
            } finally {
                System.setOut(originalOut);
            }
            assertFalse(capture.toString().contains("Selected base spec"));
        }

        @Test
        @DisplayName("reports an invalid intent")
        void invalidIntent() {
            when(coordinator.coordinate(anyString()))
                    .thenThrow(new SpecificationValidationException("Intent must not be empty"));

            CliResult cli = execute("coordinate", " ");

            assertTrue(cli.output().contains("Invalid intent: Intent must not be empty"));
        }

        @Test
        @DisplayName("reports the root cause of a failure")
        void failure() {
            when(coordinator.coordinate(anyString()))
                    .thenThrow(new RuntimeException("wrapper", new IllegalStateException("graph broke")));

            CliResult cli = execute("coordinate", "add a cache");

            assertTrue(cli.output().contains("Coordination failed: graph broke"));
        }

        @Test
        @DisplayName("requires an intent")
        void missingIntent() {
            assertNotEquals(0, execute("coordinate").exitCode());
        }
    }

    // ── goals ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("goals")
    class Goals {

        @Test
        @DisplayName("shows the default goals")
        void show() {
            CliResult cli = execute("goals");

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("GLOBAL VALUE FUNCTION v1.0 (target: balance)"));
            assertTrue(cli.output().contains("code_quality"));
            assertTrue(cli.output().contains("testability"));
        }

        @Test
        @DisplayName("--set updates a weight")
        void setWeight() {
            CliResult cli = execute("goals", "--set", "simplicity=0.4");

            assertTrue(cli.output().contains("Updated simplicity weight to 0.40"));
            assertEquals(0.4, memory.getGlobalValueFunction()
                    .goal(GoalType.SIMPLICITY).orElseThrow().weight());
        }

        @Test
        @DisplayName("--set rejects unknown goals and out-of-range weights")
        void invalidWeights() {
            CliResult unknown = execute("goals", "--set", "elegance=0.4");
            CliResult outOfRange = execute("goals", "--set", "simplicity=1.5");

            assertEquals(CommandLine.ExitCode.USAGE, unknown.exitCode());
            assertTrue(unknown.output().contains("Invalid goal weight"));
            assertEquals(CommandLine.ExitCode.USAGE, outOfRange.exitCode());
            assertTrue(outOfRange.output().contains("must be between 0 and 1"));
        }

        @Test
        @DisplayName("--set rejects NaN without touching the stored weight")
        void nanWeight() {
            memory.initialize();
            double before = memory.getGlobalValueFunction().goal(GoalType.CODE_QUALITY).orElseThrow().weight();

            CliResult cli = execute("goals", "--set", "code_quality=NaN");

            assertEquals(CommandLine.ExitCode.USAGE, cli.exitCode());
            assertTrue(cli.output().contains("Weight for code_quality must be between 0 and 1, got NaN"));
            assertFalse(cli.output().contains("IllegalArgumentException"));
            assertEquals(before, memory.getGlobalValueFunction().goal(GoalType.CODE_QUALITY).orElseThrow().weight());
        }

        @Test
        @DisplayName("--target changes the optimization target")
        void target() {
            CliResult cli = execute("goals", "--target", "maximize_quality");

            assertTrue(cli.output().contains("(target: maximize_quality)"));
        }

        @Test
        @DisplayName("--target rejects unknown targets")
        void invalidTarget() {
            CliResult cli = execute("goals", "--target", "fastest");

            assertEquals(CommandLine.ExitCode.USAGE, cli.exitCode());
            assertTrue(cli.output().contains("Invalid target: fastest"));
        }
    }

    // ── alignment ───────────────────────────────────────────────────

    @Nested
    @DisplayName("alignment")
    class Alignment {

        @Test
        @DisplayName("reports when there is no history")
        void empty() {
            CliResult cli = execute("alignment");

            assertEquals(0, cli.exitCode());
            assertTrue(cli.output().contains("No alignment records yet."));
        }

        @Test
        @DisplayName("summarizes recorded validations and drift")
        void withHistory() {
            memory.registerAgent("gen-1", "generator", List.of("completeness"));
            memory.validateAgentAction("gen-1",
                    new AgentAction("code_generation", "", List.of(), Map.of()), WorkspaceState.empty());

            CliResult cli = execute("alignment", "-n", "5");

            assertTrue(cli.output().contains("Actions validated: 1 (0 aligned, 0.0%)"));
            assertTrue(cli.output().contains("Average alignment score: 0.20"));
            assertTrue(cli.output().contains("Drift events: 1"));
            assertTrue(cli.output().contains("RECENT:"));
            assertTrue(cli.output().contains("gen-1"));
        }
    }
}
