package com.aind.metadata.service;

import com.aind.metadata.config.VocabularyConfigLoader;
import com.aind.metadata.model.ControlledVocabulary;
import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.ValidationResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates one record's data against its type: required fields, then the type's rule,
 * then unknown top-level keys. Pure with respect to its inputs and the loaded vocabulary.
 */
@Service
@Slf4j
public class ValidationService {

    private final VocabularyConfigLoader vocabularyLoader;
    private final Map<RecordType, RecordRule> rules = RecordRules.byType();

    public ValidationService(VocabularyConfigLoader vocabularyLoader) {
        this.vocabularyLoader = vocabularyLoader;
    }

    /**
     * @throws com.aind.metadata.exception.InvalidRecordTypeException for an unknown type
     */
    public ValidationResult validate(String recordType, JsonNode data) {
        return validate(RecordType.fromValue(recordType), data);
    }

    public ValidationResult validate(RecordType recordType, JsonNode data) {
        ObjectNode document = data != null && data.isObject()
                ? (ObjectNode) data
                : JsonNodeFactory.instance.objectNode();
        ControlledVocabulary vocabulary = vocabularyLoader.getVocabulary();
        ValidationReport report = new ValidationReport();

        List<String> required = vocabulary.requiredFieldsFor(recordType);
        for (String path : required) {
            if (isPresent(resolve(document, path))) {
                report.valid(path);
            } else {
                report.missing(path);
            }
        }

        RecordRule rule = rules.get(recordType);
        if (rule != null) {
            rule.apply(document, vocabulary, report);
        }

        vocabulary.knownFieldsFor(recordType).ifPresent(known -> flagUnknownFields(recordType, document, known, report));

        ValidationResult result = report.toResult(recordType, required.size());
        log.debug("Validated {}: status={}, completeness={}, errors={}, warnings={}",
                recordType.getValue(), result.getStatus().getValue(), result.getCompletenessScore(),
                result.getErrors().size(), result.getWarnings().size());
        return result;
    }

    private void flagUnknownFields(RecordType recordType, ObjectNode document, Set<String> known, ValidationReport report) {
        Iterator<String> names = document.fieldNames();
        while (names.hasNext()) {
            String key = names.next();
            if (!known.contains(key)) {
                report.warning(key, "Unknown field '" + key + "' is not part of the " + recordType.getValue() + " schema");
            }
        }
    }

    /** Follows a dotted path through nested objects; null when any step is missing. */
    static JsonNode resolve(JsonNode data, String path) {
        JsonNode current = data;
        for (String part : path.split("\\.")) {
            if (current == null || !current.isObject()) {
                return null;
            }
            current = current.get(part);
        }
        return current;
    }

    static boolean isPresent(JsonNode value) {
        if (value == null || value.isNull()) {
            return false;
        }
        if (value.isTextual()) {
            return !value.asText().isEmpty();
        }
        if (value.isArray()) {
            return value.size() > 0;
        }
        return true;
    }
}
