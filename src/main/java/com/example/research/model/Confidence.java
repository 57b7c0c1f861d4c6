package com.example.research.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How strongly a claim is asserted, judged from its wording.
 */
public enum Confidence {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low"),
    UNCERTAIN("uncertain");

    private final String value;

    Confidence(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static Confidence fromValue(String value) {
        for (Confidence c : values()) {
            if (c.value.equalsIgnoreCase(value)) return c;
        }
        throw new IllegalArgumentException("Unknown confidence: " + value);
    }
}
