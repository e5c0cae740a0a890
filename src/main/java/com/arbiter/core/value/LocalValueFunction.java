package com.arbiter.core.value;

import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.WorkspaceState;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Per-agent value function. Scores actions with the agent role's own
 * heuristic and compares that local score with the global one.
 */
public class LocalValueFunction {

    /** Local and global scores closer than this are considered in agreement. */
    public static final double AGREEMENT_TOLERANCE = 0.3;

    private final String agentId;
    private final String agentRole;
    private final List<String> localGoals;
    private double alignmentScore = 1.0;
    private Instant lastValidated;

    public LocalValueFunction(String agentId, String agentRole, List<String> localGoals) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent_id must not be empty");
        }
        this.agentId = agentId;
        this.agentRole = agentRole != null ? agentRole : "";
        this.localGoals = localGoals != null ? List.copyOf(localGoals) : List.of();
    }

    public double evaluateLocal(WorkspaceState state, AgentAction action) {
        return LocalScorers.score(agentRole, state, action);
    }

    /**
     * Checks whether this agent's view of the action agrees with the global one.
     * Updates {@link #alignmentScore()} as a side effect.
     */
    public AlignmentOutcome checkAlignment(GlobalValueFunction global, WorkspaceState state, AgentAction action) {
        double globalScore = global.evaluate(state, action);
        double localScore = evaluateLocal(state, action);
        double gap = Math.abs(globalScore - localScore);
        boolean agreement = gap < AGREEMENT_TOLERANCE;

        var warnings = new ArrayList<String>();
        if (!agreement) {
            warnings.add(String.format(Locale.ROOT, "Local/Global score mismatch: %.2f vs %.2f",
                    localScore, globalScore));
        }
        List<String> violations = global.checkThresholdViolations(state, action);
        warnings.addAll(violations);

        alignmentScore = 1.0 - gap;
        lastValidated = Instant.now();
        return new AlignmentOutcome(agreement && violations.isEmpty(), alignmentScore,
                globalScore, localScore, warnings);
    }

    public String agentId() {
        return agentId;
    }

    public String agentRole() {
        return agentRole;
    }

    public List<String> localGoals() {
        return localGoals;
    }

    /** Score of the last alignment check, 1.0 before the first one. */
    public double alignmentScore() {
        return alignmentScore;
    }

    public Instant lastValidated() {
        return lastValidated;
    }
}
