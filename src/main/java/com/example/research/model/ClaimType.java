package com.example.research.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ClaimType {
    FACTUAL("factual"),
    PREDICTION("prediction"),
    OPINION("opinion"),
    DEFINITION("definition");

    private final String value;

    ClaimType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ClaimType fromValue(String value) {
        for (ClaimType t : values()) {
            if (t.value.equalsIgnoreCase(value)) return t;
        }
        throw new IllegalArgumentException("Unknown claim type: " + value);
    }
}
