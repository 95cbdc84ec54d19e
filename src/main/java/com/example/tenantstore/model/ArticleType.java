package com.example.tenantstore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ArticleType {
    JURISPRUDENCE("jurisprudence"),
    REGULATION("regulation"),
    PROCEDURE("procedure"),
    GUIDANCE("guidance");

    private final String value;

    ArticleType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ArticleType fromValue(String value) {
        for (ArticleType t : values()) {
            if (t.value.equals(value)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown article type: " + value);
    }
}
