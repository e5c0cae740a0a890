package com.arbiter.core.model;

/**
 * Phases of a single coordination call. {@link #DONE}, {@link #REFINE} and
 * {@link #ERROR} are terminal.
 */
public enum CoordinationPhase {
    EXTRACT_GOALS,
    GENERATE_CANDIDATES,
    PRICE_AND_SELECT,
    GATHER_CONTEXT,
    EXECUTE,
    CHECK_ALIGNMENT,
    REFINE,
    DONE,
    ERROR;

    public boolean isTerminal() {
        return this == DONE || this == REFINE || this == ERROR;
    }
}
