package com.aind.metadata.model;

import com.aind.metadata.exception.InvalidRecordTypeException;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The nine record types. The category of each type is fixed here and nowhere else.
 */
public enum RecordType {
    SUBJECT("subject", RecordCategory.SHARED),
    PROCEDURES("procedures", RecordCategory.SHARED),
    INSTRUMENT("instrument", RecordCategory.SHARED),
    RIG("rig", RecordCategory.SHARED),
    DATA_DESCRIPTION("data_description", RecordCategory.ASSET),
    ACQUISITION("acquisition", RecordCategory.ASSET),
    SESSION("session", RecordCategory.ASSET),
    PROCESSING("processing", RecordCategory.ASSET),
    QUALITY_CONTROL("quality_control", RecordCategory.ASSET);

    private final String value;
    private final RecordCategory category;

    RecordType(String value, RecordCategory category) {
        this.value = value;
        this.category = category;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public RecordCategory getCategory() {
        return category;
    }

    /**
     * Resolve a wire value such as {@code "data_description"}.
     *
     * @throws InvalidRecordTypeException if the value is null or not one of the nine types
     */
    public static RecordType fromValue(String value) {
        if (value != null) {
            String trimmed = value.trim();
            for (RecordType type : values()) {
                if (type.value.equals(trimmed)) {
                    return type;
                }
            }
        }
        throw new InvalidRecordTypeException(value);
    }
}
