package com.arbiter.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A bounded, budgeted specification produced from a build intent.
 * <p>
 * Immutable once constructed: collections are copied and variants are always
 * new instances derived from a base. Construction fails with a
 * {@link SpecificationValidationException} when the intent is blank, there are
 * no success criteria, or the budget or risk level is missing.
 */
public record Specification(
    String intent,
    SpecVariant variant,
    List<String> successCriteria,
    SpecificationBudget budgets,
    RiskLevel riskLevel,
    Set<String> forbiddenPatterns,
    List<String> securityConsiderations,
    List<AcceptanceTest> acceptanceTests,
    List<String> dependenciesNeeded
) implements Serializable {

    public Specification {
        if (intent == null || intent.isBlank()) {
            throw new SpecificationValidationException("Specification intent must not be empty");
        }
        if (successCriteria == null || successCriteria.isEmpty()) {
            throw new SpecificationValidationException("Specification must have at least one success criterion");
        }
        if (budgets == null) {
            throw new SpecificationValidationException("Specification budgets are required");
        }
        if (riskLevel == null) {
            throw new SpecificationValidationException("Specification risk_level is required");
        }
        variant = variant != null ? variant : SpecVariant.BASE;
        successCriteria = List.copyOf(successCriteria);
        forbiddenPatterns = forbiddenPatterns != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(forbiddenPatterns))
                : Set.of();
        securityConsiderations = securityConsiderations != null ? List.copyOf(securityConsiderations) : List.of();
        acceptanceTests = acceptanceTests != null ? List.copyOf(acceptanceTests) : List.of();
        dependenciesNeeded = dependenciesNeeded != null ? List.copyOf(dependenciesNeeded) : List.of();
    }

    /** Estimated lines of code, taken from the allocated LOC budget. */
    public int estimatedLoc() {
        return budgets.maxLocDelta();
    }
}
