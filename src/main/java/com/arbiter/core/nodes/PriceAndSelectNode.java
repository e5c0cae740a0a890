package com.arbiter.core.nodes;

import com.arbiter.core.events.ArbiterEvent;
import com.arbiter.core.events.EventBus;
import com.arbiter.core.metrics.ArbiterMetrics;
import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.model.Cost;
import com.arbiter.core.model.PricedCandidate;
import com.arbiter.core.model.Specification;
import com.arbiter.core.model.WorkspaceState;
import com.arbiter.core.policy.Policy;
import com.arbiter.core.pricing.PricingKernel;
import com.arbiter.core.state.CoordinationState;
import com.arbiter.core.value.GlobalValueFunction;
import com.arbiter.core.value.GlobalValueMemory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Prices every candidate, discards those over budget and selects the one the
 * global value function scores highest.
 * <p>
 * Selection uses a strict {@code >} comparison, so on an exact tie the
 * first-generated candidate wins. When no candidate is within budget the phase
 * becomes {@link CoordinationPhase#ERROR} and the alternatives of the candidate
 * with the lowest budget usage are reported.
 */
@Component
public class PriceAndSelectNode {

    private static final Logger log = LoggerFactory.getLogger(PriceAndSelectNode.class);

    public static final String ALL_OVER_BUDGET = "All spec candidates exceed budget";

    private final PricingKernel pricingKernel;
    private final GlobalValueMemory valueMemory;
    private final Policy policy;
    private final EventBus eventBus;
    private final ArbiterMetrics metrics;

    public PriceAndSelectNode(PricingKernel pricingKernel, GlobalValueMemory valueMemory, Policy policy,
                              EventBus eventBus, ArbiterMetrics metrics) {
        this.pricingKernel = pricingKernel;
        this.valueMemory = valueMemory;
        this.policy = policy;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(CoordinationState state) {
        var entries = new ArrayList<String>();
        var priced = new ArrayList<PricedCandidate>();
        var withinBudget = new ArrayList<PricedCandidate>();

        for (Specification candidate : state.candidates()) {
            Cost cost = pricingKernel.price(candidate, policy);
            metrics.recordBudgetCheck(cost.budgetStatus());
            var pricedCandidate = new PricedCandidate(candidate, cost);
            priced.add(pricedCandidate);
            entries.add(String.format(Locale.ROOT, "Priced %s spec: cost %.1f, %s (%.1f%% of budget)",
                    variantName(candidate), cost.total(), cost.budgetStatus().wireValue(),
                    cost.usagePercentage()));
            if (cost.withinBudget()) {
                withinBudget.add(pricedCandidate);
            }
        }
        metrics.recordCandidates(priced.size(), withinBudget.size());

        var updates = new HashMap<String, Object>();
        updates.put("pricedCandidates", priced);

        if (withinBudget.isEmpty()) {
            PricedCandidate closest = closestToBudget(priced);
            log.warn("{} for coordination {}", ALL_OVER_BUDGET, state.coordinationId());
            entries.add(ALL_OVER_BUDGET);
            updates.put("phase", CoordinationPhase.ERROR.name());
            updates.put("error", ALL_OVER_BUDGET);
            if (closest != null) {
                updates.put("alternatives", closest.cost().alternatives());
                entries.add(String.format("Suggested %d alternatives for the %s spec",
                        closest.cost().alternatives().size(), variantName(closest.specification())));
            }
            updates.put("coordinationLog", entries);
            return updates;
        }

        GlobalValueFunction global = valueMemory.getGlobalValueFunction();
        WorkspaceState workspace = WorkspaceState.empty();
        PricedCandidate best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (PricedCandidate candidate : withinBudget) {
            double score = global.evaluate(workspace, AgentAction.forSpecification(candidate.specification()));
            log.debug("Candidate {} scored {}", candidate.specification().variant(), score);
            if (score > bestScore) {
                bestScore = score;
                best = candidate;
            }
        }

        entries.add(String.format(Locale.ROOT, "Selected %s spec with alignment score: %.2f",
                variantName(best.specification()), bestScore));
        eventBus.publish(ArbiterEvent.of(ArbiterEvent.Type.SPEC_SELECTED,
                state.coordinationId(), state.agentId(),
                Map.of("variant", best.specification().variant().name(),
                        "score", bestScore,
                        "budgetStatus", best.cost().budgetStatus().wireValue())));

        updates.put("selectedSpec", best.specification());
        updates.put("selectedCost", best.cost());
        updates.put("selectionScore", bestScore);
        updates.put("phase", CoordinationPhase.GATHER_CONTEXT.name());
        updates.put("coordinationLog", entries);
        return updates;
    }

    /**
     * The candidate with the lowest budget usage; the first one on a tie.
     */
    private static PricedCandidate closestToBudget(Iterable<PricedCandidate> priced) {
        PricedCandidate closest = null;
        for (PricedCandidate candidate : priced) {
            if (closest == null || candidate.cost().usagePercentage() < closest.cost().usagePercentage()) {
                closest = candidate;
            }
        }
        return closest;
    }

    private static String variantName(Specification spec) {
        return spec.variant().name().toLowerCase();
    }
}
