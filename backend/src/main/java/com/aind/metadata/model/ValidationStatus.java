package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ValidationStatus {
    VALID("valid"),
    WARNINGS("warnings"),
    ERRORS("errors");

    private final String value;

    ValidationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ValidationStatus fromValue(String value) {
        for (ValidationStatus status : values()) {
            if (status.value.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown validation status: " + value);
    }
}
