package com.arbiter.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * An action proposed or performed by an agent, as seen by the value function.
 *
 * @param type     action kind, e.g. "specification" or "code_generation"
 * @param code     generated content, empty when the action carries none
 * @param patterns code patterns the action exhibits (see {@link CodePatterns})
 * @param metadata free-form scalar details such as estimated LOC
 */
public record AgentAction(
    String type,
    String code,
    List<String> patterns,
    Map<String, Object> metadata
) implements Serializable {

    public AgentAction {
        type = type != null ? type : "unknown";
        code = code != null ? code : "";
        patterns = patterns != null ? List.copyOf(patterns) : List.of();
        metadata = metadata != null ? Map.copyOf(metadata) : Map.of();
    }

    public static AgentAction ofCode(String type, String code) {
        return new AgentAction(type, code, CodePatterns.detect(code), Map.of());
    }

    /**
     * Describes a candidate specification as a not-yet-executed action so it
     * can be scored before anything is generated.
     */
    public static AgentAction forSpecification(Specification spec) {
        return new AgentAction("specification", "", List.of(), Map.of(
                "intent", spec.intent(),
                "variant", spec.variant().name(),
                "estimated_loc", spec.budgets().maxLocDelta(),
                "dependencies", spec.budgets().maxNewDependencies(),
                "abstractions", spec.budgets().maxNewAbstractions(),
                "risk_level", spec.riskLevel().wireValue(),
                "has_tests", !spec.acceptanceTests().isEmpty()));
    }
}
