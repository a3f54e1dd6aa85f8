package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueSeverity {
    ERROR("error"),
    WARNING("warning");

    private final String value;

    IssueSeverity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static IssueSeverity fromValue(String value) {
        return "error".equalsIgnoreCase(value) ? ERROR : WARNING;
    }
}
