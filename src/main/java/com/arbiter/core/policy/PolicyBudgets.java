package com.arbiter.core.policy;

import java.io.Serializable;

/**
 * Project-wide size limits. Every field must be positive.
 */
public record PolicyBudgets(
    int maxLoc,
    int maxModules,
    int maxFiles,
    int maxDependencies
) implements Serializable {

    public PolicyBudgets {
        requirePositive("max_loc", maxLoc);
        requirePositive("max_modules", maxModules);
        requirePositive("max_files", maxFiles);
        requirePositive("max_dependencies", maxDependencies);
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("Policy budget " + field + " must be positive, got " + value);
        }
    }
}
