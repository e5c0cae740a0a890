package com.arbiter.core.model;

import com.arbiter.core.policy.Permissions;

import java.io.Serializable;
import java.util.List;

/**
 * Work handed to the execution collaborator once a specification is selected.
 */
public record ExecutionTask(
    String agentId,
    Specification specification,
    IntentGoals goals,
    List<String> constraints,
    Permissions permissions
) implements Serializable {

    public ExecutionTask {
        constraints = constraints != null ? List.copyOf(constraints) : List.of();
        permissions = permissions != null ? permissions : Permissions.denyAll();
    }
}
