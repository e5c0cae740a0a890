package com.arbiter.core.value;

import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.GoalType;
import com.arbiter.core.model.OptimizationTarget;
import com.arbiter.core.model.WorkspaceState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class GlobalValueMemoryTest {

    private static final AgentAction EMPTY_ACTION = new AgentAction("code_generation", "", List.of(), Map.of());

    private InMemoryValueMemoryStore store;
    private GlobalValueMemory memory;

    @BeforeEach
    void setUp() {
        store = new InMemoryValueMemoryStore();
        memory = new GlobalValueMemory(store);
    }

    // ── Initialization ──────────────────────────────────────────────

    @Nested
    @DisplayName("initialize")
    class Initialize {

        @Test
        @DisplayName("creates and saves defaults when nothing is stored")
        void createsDefaults() {
            assertFalse(memory.isInitialized());

            GlobalValueFunction function = memory.initialize();

            assertTrue(memory.isInitialized());
            assertEquals(5, function.getGoals().size());
            assertTrue(store.load().isPresent());
        }

        @Test
        @DisplayName("is idempotent")
        void idempotent() {
            assertSame(memory.initialize(), memory.initialize());
        }

        @Test
        @DisplayName("restores state saved by an earlier instance")
        void restoresSavedState() {
            memory.initialize();
            memory.updateGlobalGoal(GoalType.SIMPLICITY, 0.45);

            var reloaded = new GlobalValueMemory(store);

            assertEquals(0.45, reloaded.getGlobalValueFunction()
                    .goal(GoalType.SIMPLICITY).orElseThrow().weight());
        }

        @Test
        @DisplayName("falls back to defaults when the store cannot be read")
        void loadFailure() {
            ValueMemoryStore broken = mock(ValueMemoryStore.class);
            when(broken.load()).thenThrow(new ValueMemoryStoreException("corrupt"));

            var fallback = new GlobalValueMemory(broken);
            GlobalValueFunction function = fallback.initialize();

            assertEquals(0.30, function.goal(GoalType.CODE_QUALITY).orElseThrow().weight());
            verify(broken, never()).save(any());
        }

        @Test
        @DisplayName("survives a failing save")
        void saveFailure() {
            ValueMemoryStore readOnly = mock(ValueMemoryStore.class);
            when(readOnly.load()).thenReturn(Optional.empty());
            doThrow(new ValueMemoryStoreException("disk full")).when(readOnly).save(any());

            var fragile = new GlobalValueMemory(readOnly);

            assertDoesNotThrow(fragile::initialize);
            assertTrue(fragile.isInitialized());
        }

        @Test
        @DisplayName("limits must be positive")
        void invalidLimits() {
            assertThrows(IllegalArgumentException.class, () -> new GlobalValueMemory(store, 0, 5));
            assertThrows(IllegalArgumentException.class, () -> new GlobalValueMemory(store, 5, -1));
        }
    }

    // ── Validation ──────────────────────────────────────────────────

    @Nested
    @DisplayName("validateAgentAction")
    class Validate {

        @Test
        @DisplayName("unregistered agents are approved unscored")
        void unregistered() {
            ActionValidation validation = memory.validateAgentAction("ghost", EMPTY_ACTION, WorkspaceState.empty());

            assertTrue(validation.approved());
            assertEquals(List.of("Agent not registered"), validation.warnings());
            assertFalse(validation.driftDetected());
            assertTrue(memory.alignmentHistory().isEmpty());
        }

        @Test
        @DisplayName("a low alignment score is recorded as drift")
        void drift() {
            memory.registerAgent("gen-1", "generator", List.of("completeness"));

            ActionValidation validation = memory.validateAgentAction("gen-1", EMPTY_ACTION, WorkspaceState.empty());

            assertFalse(validation.approved());
            assertTrue(validation.driftDetected());
            assertEquals("DRIFT DETECTED: Alignment score 0.20 < 0.5", validation.warnings().get(0));
            assertEquals(1, memory.driftEvents().size());
            assertEquals(1, memory.alignmentHistory().size());
            assertFalse(memory.alignmentHistory().get(0).warnings().get(0).startsWith("DRIFT"));
        }

        @Test
        @DisplayName("a high alignment score records history only")
        void noDrift() {
            memory.registerAgent("gen-1", "generator", List.of());
            var action = AgentAction.ofCode("code_generation", GoalScorersTest.DOCUMENTED_PYTHON);

            ActionValidation validation = memory.validateAgentAction("gen-1", action, WorkspaceState.empty());

            assertTrue(validation.approved());
            assertFalse(validation.driftDetected());
            assertTrue(memory.driftEvents().isEmpty());
            assertEquals(1, memory.alignmentHistory().size());
        }

        @Test
        @DisplayName("history and drift buffers stay within their caps")
        void bounded() {
            var small = new GlobalValueMemory(store, 3, 2);
            small.registerAgent("gen-1", "generator", List.of());

            for (int i = 0; i < 6; i++) {
                small.validateAgentAction("gen-1", EMPTY_ACTION, WorkspaceState.empty());
            }

            assertEquals(3, small.alignmentHistory().size());
            assertEquals(2, small.driftEvents().size());
            assertEquals(3, store.load().orElseThrow().alignmentHistory().size());
        }

        @Test
        @DisplayName("registering twice keeps the first registration")
        void registerTwice() {
            LocalValueFunction first = memory.registerAgent("gen-1", "generator", List.of());
            LocalValueFunction second = memory.registerAgent("gen-1", "refactor", List.of());

            assertSame(first, second);
            assertEquals("generator", memory.agent("gen-1").orElseThrow().agentRole());
        }
    }

    // ── Goal updates ────────────────────────────────────────────────

    @Nested
    @DisplayName("goal updates")
    class GoalUpdates {

        @Test
        @DisplayName("weight updates are ignored before initialization")
        void beforeInitialize() {
            assertFalse(memory.updateGlobalGoal(GoalType.SIMPLICITY, 0.4));
            assertFalse(memory.isInitialized());
        }

        @Test
        @DisplayName("weight updates apply after initialization")
        void afterInitialize() {
            memory.initialize();

            assertTrue(memory.updateGlobalGoal(GoalType.SIMPLICITY, 0.4));
            assertFalse(memory.updateGlobalGoal(GoalType.PERFORMANCE, 0.4));
            assertEquals(0.4, memory.getGlobalValueFunction().goal(GoalType.SIMPLICITY).orElseThrow().weight());
        }

        @Test
        @DisplayName("setting the target persists it")
        void target() {
            memory.setOptimizationTarget(OptimizationTarget.MAXIMIZE_QUALITY);

            assertEquals(OptimizationTarget.MAXIMIZE_QUALITY,
                    store.load().orElseThrow().globalValueFunction().getOptimizationTarget());
        }

        @Test
        @DisplayName("reset restores defaults and clears history")
        void reset() {
            memory.initialize();
            memory.registerAgent("gen-1", "generator", List.of());
            memory.updateGlobalGoal(GoalType.SIMPLICITY, 0.9);
            memory.validateAgentAction("gen-1", EMPTY_ACTION, WorkspaceState.empty());

            GlobalValueFunction function = memory.resetToDefaults();

            assertEquals(0.20, function.goal(GoalType.SIMPLICITY).orElseThrow().weight());
            assertTrue(memory.alignmentHistory().isEmpty());
            assertTrue(memory.driftEvents().isEmpty());
        }
    }

    // ── Statistics ──────────────────────────────────────────────────

    @Test
    @DisplayName("statistics are zero without history")
    void emptyStatistics() {
        AlignmentStatistics stats = memory.getAlignmentStatistics();

        assertEquals(0, stats.totalActions());
        assertEquals(0.0, stats.alignmentRate());
        assertEquals(0.0, stats.averageAlignmentScore());
        assertNull(stats.lastDrift());
    }

    @Test
    @DisplayName("statistics summarize the retained history")
    void statistics() {
        memory.registerAgent("gen-1", "generator", List.of());
        memory.validateAgentAction("gen-1", EMPTY_ACTION, WorkspaceState.empty());
        memory.validateAgentAction("gen-1",
                AgentAction.ofCode("code_generation", GoalScorersTest.DOCUMENTED_PYTHON), WorkspaceState.empty());

        AlignmentStatistics stats = memory.getAlignmentStatistics();

        assertEquals(2, stats.totalActions());
        assertEquals(1, stats.alignedActions());
        assertEquals(0.5, stats.alignmentRate(), 1e-9);
        assertEquals((0.2 + 0.95) / 2, stats.averageAlignmentScore(), 1e-9);
        assertEquals(1, stats.driftEvents());
        assertNotNull(stats.lastDrift());
    }
}
