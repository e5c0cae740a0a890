package com.arbiter.core.nodes;

import com.arbiter.core.model.CoordinationPhase;
import com.arbiter.core.model.IntentGoals;
import com.arbiter.core.model.Specification;
import com.arbiter.core.policy.Policy;
import com.arbiter.core.spec.SpecificationBuilder;
import com.arbiter.core.state.CoordinationState;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the base specification for the intent and derives its variants.
 * Candidates keep generation order: base, simplified (when the base LOC
 * budget exceeds 100), robust.
 */
@Component
public class GenerateCandidatesNode {

    private final SpecificationBuilder specificationBuilder;
    private final Policy policy;

    public GenerateCandidatesNode(SpecificationBuilder specificationBuilder, Policy policy) {
        this.specificationBuilder = specificationBuilder;
        this.policy = policy;
    }

    public Map<String, Object> apply(CoordinationState state) {
        IntentGoals goals = state.goals().orElseGet(IntentGoals::neutral);
        Specification base = specificationBuilder.generate(state.intent(), policy, goals);
        List<Specification> candidates = specificationBuilder.candidates(base);

        String summary = candidates.stream()
                .map(c -> c.variant().name().toLowerCase() + " (" + c.budgets().maxLocDelta() + " LOC)")
                .collect(Collectors.joining(", "));
        return Map.of(
                "candidates", candidates,
                "phase", CoordinationPhase.PRICE_AND_SELECT.name(),
                "coordinationLog", List.of(
                        "Generated base spec with risk " + base.riskLevel().wireValue()
                                + " and " + base.successCriteria().size() + " success criteria",
                        "Generated " + candidates.size() + " candidate specs: " + summary)
        );
    }
}
