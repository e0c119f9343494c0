package io.github.casevault.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ReviewDecision {
    APPROVE,
    REJECT;

    @JsonValue
    public String toValue() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static ReviewDecision fromString(String value) {
        if (value == null) {
            return null;
        }
        return ReviewDecision.valueOf(value.trim().toUpperCase());
    }
}
