package com.arbiter.core.policy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Typed permission table of a policy. Default-deny: a permission with no
 * entry, or with an unrecognized mode, resolves to {@link PermissionMode#DENY}.
 */
public record Permissions(Map<Permission, PermissionMode> modes) implements Serializable {

    private static final Logger log = LoggerFactory.getLogger(Permissions.class);

    public Permissions {
        EnumMap<Permission, PermissionMode> copy = new EnumMap<>(Permission.class);
        if (modes != null) {
            copy.putAll(modes);
        }
        modes = Collections.unmodifiableMap(copy);
    }

    public static Permissions denyAll() {
        return new Permissions(Map.of());
    }

    /**
     * Builds the table from raw configuration such as {@code {file_read: allow, shell_exec: prompt}}.
     * Unrecognized keys are logged and dropped; unrecognized modes become {@code DENY}.
     */
    public static Permissions fromConfig(Map<String, String> raw) {
        var modes = new EnumMap<Permission, PermissionMode>(Permission.class);
        if (raw == null) {
            return new Permissions(modes);
        }
        raw.forEach((key, value) -> {
            var permission = Permission.fromKey(key);
            if (permission.isEmpty()) {
                log.warn("Ignoring unrecognized permission '{}' (denied)", key);
                return;
            }
            modes.put(permission.get(), parseMode(key, value));
        });
        return new Permissions(modes);
    }

    public PermissionMode modeFor(Permission permission) {
        return modes.getOrDefault(permission, PermissionMode.DENY);
    }

    public boolean isAllowed(Permission permission) {
        return modeFor(permission) == PermissionMode.ALLOW;
    }

    /**
     * Looks up a permission by its raw key. Unknown keys are always denied.
     */
    public PermissionMode modeFor(String key) {
        return Permission.fromKey(key).map(this::modeFor).orElse(PermissionMode.DENY);
    }

    private static PermissionMode parseMode(String key, String value) {
        if (value == null) {
            return PermissionMode.DENY;
        }
        try {
            return PermissionMode.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            log.warn("Unrecognized mode '{}' for permission '{}', treating as deny", value, key);
            return PermissionMode.DENY;
        }
    }
}
