package com.arbiter.core.policy;

/**
 * How a permission is granted: outright, after asking the user, or not at all.
 */
public enum PermissionMode {
    ALLOW,
    PROMPT,
    DENY
}
