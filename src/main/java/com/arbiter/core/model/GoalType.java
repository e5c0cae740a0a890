package com.arbiter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The named criteria a global value function can weigh.
 */
public enum GoalType {

    CODE_QUALITY("code_quality"),
    MAINTAINABILITY("maintainability"),
    PERFORMANCE("performance"),
    SECURITY("security"),
    TESTABILITY("testability"),
    SIMPLICITY("simplicity"),
    CONSISTENCY("consistency");

    private final String wireValue;

    GoalType(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    /**
     * Accepts either the wire value ({@code code_quality}) or the enum name ({@code CODE_QUALITY}).
     *
     * @throws IllegalArgumentException for an unknown goal type
     */
    @JsonCreator
    public static GoalType parse(String value) {
        if (value != null) {
            for (GoalType type : values()) {
                if (type.wireValue.equalsIgnoreCase(value.trim()) || type.name().equalsIgnoreCase(value.trim())) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown goal type: " + value);
    }
}
