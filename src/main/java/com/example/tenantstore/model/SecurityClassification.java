package com.example.tenantstore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Government of Canada security markings. */
public enum SecurityClassification {
    PUBLIC("public"),
    INTERNAL("internal"),
    PROTECTED_A("protected_a"),
    PROTECTED_B("protected_b");

    private final String value;

    SecurityClassification(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SecurityClassification fromValue(String value) {
        for (SecurityClassification c : values()) {
            if (c.value.equals(value)) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown classification: " + value);
    }
}
