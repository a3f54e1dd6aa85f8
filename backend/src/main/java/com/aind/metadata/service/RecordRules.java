package com.aind.metadata.service;

import com.aind.metadata.model.ControlledVocabulary;
import com.aind.metadata.model.RecordType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Per-type validation rules. Field names in issues are relative to the record's data.
 */
public final class RecordRules {

    private static final Pattern SUBJECT_ID = Pattern.compile("^\\d{4,}$");

    private RecordRules() {
    }

    public static Map<RecordType, RecordRule> byType() {
        Map<RecordType, RecordRule> rules = new EnumMap<>(RecordType.class);
        rules.put(RecordType.SUBJECT, RecordRules::subject);
        rules.put(RecordType.DATA_DESCRIPTION, RecordRules::dataDescription);
        rules.put(RecordType.SESSION, ordering("session_start_time", "session_end_time", "Session"));
        rules.put(RecordType.ACQUISITION, ordering("acquisition_start_time", "acquisition_end_time", "Acquisition"));
        rules.put(RecordType.PROCEDURES, RecordRules::procedures);
        return rules;
    }

    static void subject(ObjectNode data, ControlledVocabulary vocabulary, ValidationReport report) {
        JsonNode subjectId = value(data, "subject_id");
        if (subjectId != null) {
            String text = subjectId.asText();
            if (!SUBJECT_ID.matcher(text).matches()) {
                report.warning("subject_id", "Subject ID '" + text + "' should be a numeric string with 4+ digits");
            } else {
                report.valid("subject_id");
            }
        }

        JsonNode sex = value(data, "sex");
        if (sex != null && !vocabulary.getSex().isEmpty()) {
            String text = sex.asText();
            if (!vocabulary.getSex().contains(text)) {
                report.error("sex", "Invalid sex '" + text + "'. Must be one of: " + sorted(vocabulary.getSex()));
            } else {
                report.valid("sex");
            }
        }

        JsonNode species = data.get("species");
        if (species != null && species.isObject()) {
            JsonNode name = value((ObjectNode) species, "name");
            if (name != null && !vocabulary.getSpecies().isEmpty()) {
                if (!vocabulary.getSpecies().contains(name.asText())) {
                    report.warning("species.name", "Unrecognized species '" + name.asText()
                            + "'. Expected one of: " + sorted(vocabulary.getSpecies()));
                } else {
                    report.valid("species.name");
                }
            }
        }
    }

    static void dataDescription(ObjectNode data, ControlledVocabulary vocabulary, ValidationReport report) {
        JsonNode modality = data.get("modality");
        if (modality != null && modality.isArray() && !vocabulary.getModalities().isEmpty()) {
            for (int i = 0; i < modality.size(); i++) {
                JsonNode entry = modality.get(i);
                if (!entry.isObject()) {
                    continue;
                }
                JsonNode abbreviation = value((ObjectNode) entry, "abbreviation");
                if (abbreviation == null) {
                    continue;
                }
                String field = "modality[" + i + "].abbreviation";
                if (!vocabulary.getModalities().contains(abbreviation.asText())) {
                    report.error(field, "Invalid modality '" + abbreviation.asText()
                            + "'. Must be one of: " + sorted(vocabulary.getModalities()));
                } else {
                    report.valid(field);
                }
            }
        }

        JsonNode projectName = value(data, "project_name");
        if (projectName != null && projectName.isTextual()) {
            if (projectName.asText().trim().length() < 2) {
                report.warning("project_name", "Project name is too short");
            } else {
                report.valid("project_name");
            }
        }
    }

    /**
     * End must be strictly after start when both parse; unparseable values skip the check.
     */
    static RecordRule ordering(String startField, String endField, String label) {
        return (data, vocabulary, report) -> {
            JsonNode start = value(data, startField);
            JsonNode end = value(data, endField);
            if (start != null) {
                report.valid(startField);
            }
            if (end != null) {
                report.valid(endField);
            }
            if (start == null || end == null) {
                return;
            }
            Optional<LocalDateTime> startTime = TimestampParser.parse(start.asText());
            Optional<LocalDateTime> endTime = TimestampParser.parse(end.asText());
            if (startTime.isPresent() && endTime.isPresent() && !endTime.get().isAfter(startTime.get())) {
                report.error(endField, label + " end time must be after start time");
            }
        };
    }

    static void procedures(ObjectNode data, ControlledVocabulary vocabulary, ValidationReport report) {
        if (value(data, "protocol_id") != null) {
            report.valid("protocol_id");
        }

        JsonNode coordinates = data.get("coordinates");
        if (coordinates != null && coordinates.isObject()) {
            JsonNode x = value((ObjectNode) coordinates, "x");
            JsonNode y = value((ObjectNode) coordinates, "y");
            if (x != null && y != null) {
                if (toNumber(x).isPresent() && toNumber(y).isPresent()) {
                    report.valid("coordinates");
                } else {
                    report.error("coordinates", "Coordinates must be numeric, got x=" + x.asText() + ", y=" + y.asText());
                }
            }
        }

        JsonNode thickness = value(data, "section_thickness_um");
        if (thickness != null) {
            OptionalDouble number = toNumber(thickness);
            if (number.isEmpty()) {
                report.error("section_thickness_um", "Section thickness must be numeric, got '" + thickness.asText() + "'");
            } else if (number.getAsDouble() <= 0) {
                report.error("section_thickness_um", "Section thickness must be positive");
            } else {
                report.valid("section_thickness_um");
            }
        }

        JsonNode injection = data.get("injection_coordinates");
        if (injection != null && (injection.isObject() || injection.isArray())) {
            boolean allNumeric = true;
            if (injection.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> fields = injection.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> axis = fields.next();
                    allNumeric &= checkCoordinate("injection_coordinates." + axis.getKey(), axis.getValue(), report);
                }
            } else {
                for (int i = 0; i < injection.size(); i++) {
                    allNumeric &= checkCoordinate("injection_coordinates[" + i + "]", injection.get(i), report);
                }
            }
            if (allNumeric) {
                report.valid("injection_coordinates");
            }
        }
    }

    private static boolean checkCoordinate(String field, JsonNode node, ValidationReport report) {
        if (node == null || node.isNull()) {
            return true;
        }
        if (toNumber(node).isEmpty()) {
            report.error(field, "Injection coordinate must be numeric, got '" + node.asText() + "'");
            return false;
        }
        return true;
    }

    /** The field value, or null when it is absent or JSON null. */
    static JsonNode value(ObjectNode data, String field) {
        JsonNode node = data.get(field);
        return node == null || node.isNull() ? null : node;
    }

    static OptionalDouble toNumber(JsonNode node) {
        if (node.isNumber()) {
            return OptionalDouble.of(node.asDouble());
        }
        if (node.isTextual()) {
            try {
                return OptionalDouble.of(Double.parseDouble(node.asText().trim()));
            } catch (NumberFormatException e) {
                return OptionalDouble.empty();
            }
        }
        return OptionalDouble.empty();
    }

    private static String sorted(Collection<String> values) {
        return String.join(", ", new TreeSet<>(values));
    }
}
