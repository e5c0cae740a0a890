package com.arbiter.core.model;

import java.io.Serializable;

/**
 * Size limits allocated to a single specification. All fields are
 * non-negative and the LOC delta must be strictly positive.
 */
public record SpecificationBudget(
    int maxLocDelta,
    int maxNewFiles,
    int maxNewDependencies,
    int maxNewAbstractions,
    int maxCyclomaticComplexity
) implements Serializable {

    public SpecificationBudget {
        if (maxLocDelta <= 0) {
            throw new SpecificationValidationException("max_loc_delta must be positive, got " + maxLocDelta);
        }
        requireNonNegative("max_new_files", maxNewFiles);
        requireNonNegative("max_new_dependencies", maxNewDependencies);
        requireNonNegative("max_new_abstractions", maxNewAbstractions);
        requireNonNegative("max_cyclomatic_complexity", maxCyclomaticComplexity);
    }

    public SpecificationBudget withMaxLocDelta(int value) {
        return new SpecificationBudget(value, maxNewFiles, maxNewDependencies, maxNewAbstractions, maxCyclomaticComplexity);
    }

    public SpecificationBudget withMaxNewDependencies(int value) {
        return new SpecificationBudget(maxLocDelta, maxNewFiles, value, maxNewAbstractions, maxCyclomaticComplexity);
    }

    public SpecificationBudget withMaxNewAbstractions(int value) {
        return new SpecificationBudget(maxLocDelta, maxNewFiles, maxNewDependencies, value, maxCyclomaticComplexity);
    }

    private static void requireNonNegative(String field, int value) {
        if (value < 0) {
            throw new SpecificationValidationException(field + " must not be negative, got " + value);
        }
    }
}
