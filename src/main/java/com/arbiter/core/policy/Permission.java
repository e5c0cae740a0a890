package com.arbiter.core.policy;

import java.util.Optional;

/**
 * The recognized permission keys of a policy. Anything else in configuration
 * is ignored and therefore denied.
 */
public enum Permission {

    FILE_READ("file_read"),
    FILE_WRITE("file_write"),
    FILE_DELETE("file_delete"),
    SHELL_EXEC("shell_exec"),
    EXTENSIONS("extensions");

    private final String key;

    Permission(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static Optional<Permission> fromKey(String key) {
        if (key == null) return Optional.empty();
        String normalized = key.trim().toLowerCase().replace('-', '_');
        for (Permission permission : values()) {
            if (permission.key.equals(normalized)) {
                return Optional.of(permission);
            }
        }
        return Optional.empty();
    }
}
