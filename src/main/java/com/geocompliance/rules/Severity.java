package com.geocompliance.rules;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Rule severity. The weight is what a matching rule adds to the confidence accumulator.
 */
public enum Severity {
    LOW("low", 0.1),
    MEDIUM("medium", 0.3),
    HIGH("high", 0.5),
    CRITICAL("critical", 0.7);

    private final String value;
    private final double weight;

    Severity(String value, double weight) {
        this.value = value;
        this.weight = weight;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public double weight() {
        return weight;
    }

    @JsonCreator
    public static Severity fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown severity: " + raw));
    }
}
