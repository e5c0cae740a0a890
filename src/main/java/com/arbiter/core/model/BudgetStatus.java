package com.arbiter.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Graduated classification of a cost against its budget limit.
 */
public enum BudgetStatus {

    APPROVED("approved"),
    ADVISORY("advisory"),
    WARNING("warning"),
    REJECTED("rejected");

    private final String wireValue;

    BudgetStatus(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /** Every status except {@link #REJECTED} lets the candidate proceed. */
    public boolean canProceed() {
        return this != REJECTED;
    }
}
