package com.arbiter.core.metrics;

import com.arbiter.core.model.BudgetStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for Arbiter coordination.
 */
@Service
public class ArbiterMetrics {

    private final MeterRegistry registry;

    public ArbiterMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBudgetCheck(BudgetStatus status) {
        Counter.builder("arbiter.budget.checks")
                .description("Budget checks by resulting status")
                .tag("status", status.wireValue())
                .register(registry)
                .increment();
    }

    public void recordCandidates(int generated, int withinBudget) {
        DistributionSummary.builder("arbiter.candidates.generated")
                .register(registry)
                .record(generated);
        DistributionSummary.builder("arbiter.candidates.within_budget")
                .register(registry)
                .record(withinBudget);
    }

    public void recordCoordinationResult(String phase) {
        Counter.builder("arbiter.coordinations.total")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    public void recordCoordinationDuration(long ms) {
        Timer.builder("arbiter.coordination.duration")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one alignment check; drift is also counted separately per agent.
     *
     * @param agentId agent whose action was validated
     * @param score   alignment score in [0, 1]
     * @param drift   whether the score fell below the drift threshold
     */
    public void recordAlignment(String agentId, double score, boolean drift) {
        DistributionSummary.builder("arbiter.alignment.score")
                .description("Alignment score of validated agent actions")
                .tag("agent", agentId)
                .register(registry)
                .record(score);
        if (drift) {
            Counter.builder("arbiter.alignment.drift")
                    .tag("agent", agentId)
                    .register(registry)
                    .increment();
        }
    }

    public void recordRefinement() {
        Counter.builder("arbiter.refinements.total")
                .register(registry)
                .increment();
    }
}
