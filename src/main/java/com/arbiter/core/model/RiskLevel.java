package com.arbiter.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Risk classification of a specification. Each level carries the multiplier
 * the cost model applies on top of the base complexity cost.
 */
public enum RiskLevel {

    LOW("low", 1.0),
    MEDIUM("medium", 1.2),
    HIGH("high", 1.5),
    CRITICAL("critical", 2.0);

    private final String wireValue;
    private final double multiplier;

    RiskLevel(String wireValue, double multiplier) {
        this.wireValue = wireValue;
        this.multiplier = multiplier;
    }

    @JsonValue
    public String wireValue() {
        return wireValue;
    }

    public double multiplier() {
        return multiplier;
    }

    /**
     * Parses a lowercase wire value such as {@code "critical"}.
     *
     * @throws SpecificationValidationException if the value is not a known risk level
     */
    @JsonCreator
    public static RiskLevel parse(String value) {
        if (value != null) {
            for (RiskLevel level : values()) {
                if (level.wireValue.equalsIgnoreCase(value.trim())) {
                    return level;
                }
            }
        }
        throw new SpecificationValidationException("Invalid risk_level: " + value
                + " (expected one of low, medium, high, critical)");
    }
}
