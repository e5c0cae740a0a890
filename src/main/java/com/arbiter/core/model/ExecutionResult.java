package com.arbiter.core.model;

import java.io.Serializable;

/**
 * What the execution collaborator produced: the action to be validated and a
 * one-line summary for the coordination log.
 */
public record ExecutionResult(
    AgentAction action,
    String summary
) implements Serializable {}
