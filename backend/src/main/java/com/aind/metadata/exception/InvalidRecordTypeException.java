package com.aind.metadata.exception;

import com.aind.metadata.model.RecordType;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Raised for an unrecognized record_type. Thrown before anything is written.
 */
public class InvalidRecordTypeException extends IllegalArgumentException {

    public InvalidRecordTypeException(String value) {
        super("record_type must be one of: " + validValues() + " (got '" + value + "')");
    }

    private static String validValues() {
        return Arrays.stream(RecordType.values())
                .map(RecordType::getValue)
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
