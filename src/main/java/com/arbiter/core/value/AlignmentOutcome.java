package com.arbiter.core.value;

import java.io.Serializable;
import java.util.List;

/**
 * Result of comparing an agent's local score with the global score.
 *
 * @param aligned        local and global agree and no global threshold is violated
 * @param alignmentScore {@code 1 - |global - local|}
 * @param globalScore    the global value function's score
 * @param localScore     the agent role's own score
 * @param warnings       mismatch description followed by threshold violations
 */
public record AlignmentOutcome(
    boolean aligned,
    double alignmentScore,
    double globalScore,
    double localScore,
    List<String> warnings
) implements Serializable {

    public AlignmentOutcome {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }
}
