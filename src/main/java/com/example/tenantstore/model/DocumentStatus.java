package com.example.tenantstore.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Processing state machine: uploaded, processing, then completed or failed. A failed
 * document may be reprocessed.
 */
public enum DocumentStatus {
    UPLOADED("uploaded"),
    PROCESSING("processing"),
    COMPLETED("completed"),
    FAILED("failed");

    private final String value;

    DocumentStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean canTransitionTo(DocumentStatus next) {
        return allowedNext().contains(next);
    }

    public Set<DocumentStatus> allowedNext() {
        switch (this) {
            case UPLOADED:
                return EnumSet.of(PROCESSING);
            case PROCESSING:
                return EnumSet.of(COMPLETED, FAILED);
            case FAILED:
                return EnumSet.of(PROCESSING);
            default:
                return EnumSet.noneOf(DocumentStatus.class);
        }
    }

    @JsonCreator
    public static DocumentStatus fromValue(String value) {
        for (DocumentStatus s : values()) {
            if (s.value.equals(value)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown document status: " + value);
    }
}
