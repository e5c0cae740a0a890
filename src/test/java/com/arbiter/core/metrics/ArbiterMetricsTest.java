package com.arbiter.core.metrics;

import com.arbiter.core.model.BudgetStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ArbiterMetricsTest {

    private SimpleMeterRegistry registry;
    private ArbiterMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ArbiterMetrics(registry);
    }

    @Test
    @DisplayName("recordBudgetCheck counts by status tag")
    void recordBudgetCheck() {
        metrics.recordBudgetCheck(BudgetStatus.APPROVED);
        metrics.recordBudgetCheck(BudgetStatus.APPROVED);
        metrics.recordBudgetCheck(BudgetStatus.REJECTED);

        var approved = registry.find("arbiter.budget.checks").tag("status", "approved").counter();
        var rejected = registry.find("arbiter.budget.checks").tag("status", "rejected").counter();

        assertNotNull(approved);
        assertNotNull(rejected);
        assertEquals(2.0, approved.count());
        assertEquals(1.0, rejected.count());
    }

    @Test
    @DisplayName("recordCandidates records both summaries")
    void recordCandidates() {
        metrics.recordCandidates(3, 2);

        var generated = registry.find("arbiter.candidates.generated").summary();
        var within = registry.find("arbiter.candidates.within_budget").summary();

        assertNotNull(generated);
        assertNotNull(within);
        assertEquals(3.0, generated.totalAmount());
        assertEquals(2.0, within.totalAmount());
    }

    @Test
    @DisplayName("recordCoordinationResult increments by phase tag")
    void recordCoordinationResult() {
        metrics.recordCoordinationResult("REFINE");
        metrics.recordCoordinationResult("ERROR");

        var refine = registry.find("arbiter.coordinations.total").tag("phase", "REFINE").counter();
        assertNotNull(refine);
        assertEquals(1.0, refine.count());
    }

    @Test
    @DisplayName("recordCoordinationDuration creates a timer")
    void recordCoordinationDuration() {
        metrics.recordCoordinationDuration(250);

        var timer = registry.find("arbiter.coordination.duration").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordAlignment counts drift only when drift occurred")
    void recordAlignment() {
        metrics.recordAlignment("arbiter_coordinator", 0.9, false);
        assertNull(registry.find("arbiter.alignment.drift").counter());

        metrics.recordAlignment("arbiter_coordinator", 0.3, true);

        var summary = registry.find("arbiter.alignment.score").tag("agent", "arbiter_coordinator").summary();
        var drift = registry.find("arbiter.alignment.drift").tag("agent", "arbiter_coordinator").counter();
        assertNotNull(summary);
        assertEquals(2, summary.count());
        assertNotNull(drift);
        assertEquals(1.0, drift.count());
    }

    @Test
    @DisplayName("recordRefinement increments the refinement counter")
    void recordRefinement() {
        metrics.recordRefinement();

        var counter = registry.find("arbiter.refinements.total").counter();
        assertNotNull(counter);
        assertEquals(1.0, counter.count());
    }
}
