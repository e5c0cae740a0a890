package com.arbiter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What the global value function is currently optimizing for.
 */
public enum OptimizationTarget {

    MAXIMIZE_QUALITY("maximize_quality"),
    MAXIMIZE_SPEED("maximize_speed"),
    BALANCE("balance");

    private final String wireValue;

    OptimizationTarget(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    @JsonCreator
    public static OptimizationTarget parse(String value) {
        if (value != null) {
            for (OptimizationTarget target : values()) {
                if (target.wireValue.equalsIgnoreCase(value.trim()) || target.name().equalsIgnoreCase(value.trim())) {
                    return target;
                }
            }
        }
        throw new IllegalArgumentException("Unknown optimization target: " + value);
    }
}
