package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Shared records (subject, procedures, instrument, rig) are reused across sessions;
 * asset records belong to a single data asset.
 */
public enum RecordCategory {
    SHARED("shared"),
    ASSET("asset");

    private final String value;

    RecordCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static RecordCategory fromValue(String value) {
        for (RecordCategory category : values()) {
            if (category.value.equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("category must be one of: shared, asset (got '" + value + "')");
    }
}
