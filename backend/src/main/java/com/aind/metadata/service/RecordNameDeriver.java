package com.aind.metadata.service;

import com.aind.metadata.model.RecordType;
import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Derives a display name from record data, e.g. "Mus musculus 4528" for a subject.
 */
@Component
public class RecordNameDeriver {

    public Optional<String> derive(RecordType recordType, JsonNode data) {
        if (data == null || !data.isObject()) {
            return Optional.empty();
        }
        switch (recordType) {
            case SUBJECT:
                return text(data, "subject_id").map(id -> text(data.path("species"), "name")
                        .map(species -> species + " " + id)
                        .orElse(id));
            case INSTRUMENT:
                return firstText(data, "instrument_id", "name");
            case RIG:
                return firstText(data, "rig_id", "name");
            case PROCEDURES:
                return text(data, "procedure_type");
            case DATA_DESCRIPTION:
                return text(data, "project_name");
            case SESSION:
                return text(data, "session_start_time").map(start -> "Session " + start);
            case ACQUISITION:
                return text(data, "acquisition_start_time").map(start -> "Acquisition " + start);
            default:
                return Optional.empty();
        }
    }

    private static Optional<String> firstText(JsonNode data, String primary, String fallback) {
        Optional<String> value = text(data, primary);
        return value.isPresent() ? value : text(data, fallback);
    }

    private static Optional<String> text(JsonNode data, String field) {
        JsonNode node = data.get(field);
        if (node == null || node.isNull() || node.isContainerNode()) {
            return Optional.empty();
        }
        String value = node.asText();
        return value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
