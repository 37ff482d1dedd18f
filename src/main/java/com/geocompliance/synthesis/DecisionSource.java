package com.geocompliance.synthesis;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Which path produced a {@link FinalRecord}.
 */
public enum DecisionSource {
    COLLABORATOR("collaborator"),
    FALLBACK("fallback"),
    ERROR("error");

    private final String value;

    DecisionSource(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DecisionSource fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown decision source: " + raw));
    }
}
