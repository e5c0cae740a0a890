package com.arbiter.core.value;

import java.io.Serializable;
import java.util.List;

/**
 * Result of validating one agent action against the global value function.
 * An unregistered agent is approved unscored, reported with a score of 1.0.
 */
public record ActionValidation(
    boolean approved,
    List<String> warnings,
    double alignmentScore,
    boolean driftDetected
) implements Serializable {

    public static final String AGENT_NOT_REGISTERED = "Agent not registered";

    public ActionValidation {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ActionValidation unregistered() {
        return new ActionValidation(true, List.of(AGENT_NOT_REGISTERED), 1.0, false);
    }
}
