package com.arbiter.core.model;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of one end-to-end coordination call.
 * <p>
 * Fields after the failing phase are {@code null}: an {@link CoordinationPhase#ERROR}
 * result carries no selected specification, context or execution, but does carry
 * the {@code alternatives} of the candidate closest to budget. The
 * {@code coordinationLog} is the ordered audit trail of every step taken.
 */
public record CoordinationResult(
    String coordinationId,
    String intent,
    CoordinationPhase phase,
    IntentGoals goals,
    List<PricedCandidate> candidates,
    Specification selectedSpec,
    Cost cost,
    double selectionScore,
    ContextBundle context,
    ExecutionResult execution,
    boolean aligned,
    List<String> warnings,
    boolean shouldRefine,
    String refinementInstruction,
    String error,
    List<Alternative> alternatives,
    List<String> coordinationLog
) implements Serializable {

    public CoordinationResult {
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        alternatives = alternatives != null ? List.copyOf(alternatives) : List.of();
        coordinationLog = coordinationLog != null ? List.copyOf(coordinationLog) : List.of();
    }

    public boolean succeeded() {
        return phase == CoordinationPhase.DONE;
    }
}
