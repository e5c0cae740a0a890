package com.arbiter.core.policy;

import java.io.Serializable;

/**
 * A code pattern the policy forbids, e.g. a global mutable singleton.
 */
public record ForbiddenPattern(
    String name,
    String description,
    String rule,
    String severity  // "error" or "warning"
) implements Serializable {}
