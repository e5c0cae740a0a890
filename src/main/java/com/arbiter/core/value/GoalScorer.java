package com.arbiter.core.value;

import com.arbiter.core.model.AgentAction;
import com.arbiter.core.model.WorkspaceState;

/**
 * Pure scoring function for one criterion. Implementations return a value in
 * [0, 1] and must not depend on anything but their arguments.
 */
@FunctionalInterface
public interface GoalScorer {
    double score(WorkspaceState state, AgentAction action);
}
