package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Required fields, known-field allowlists and enumerated values, loaded from
 * controlled-vocabulary.json.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ControlledVocabulary {

    @JsonProperty("required_fields")
    private Map<String, List<String>> requiredFields = new LinkedHashMap<>();

    @JsonProperty("known_fields")
    private Map<String, List<String>> knownFields = new LinkedHashMap<>();

    @JsonProperty("modalities")
    private Set<String> modalities = new LinkedHashSet<>();

    @JsonProperty("sex")
    private Set<String> sex = new LinkedHashSet<>();

    @JsonProperty("species")
    private Set<String> species = new LinkedHashSet<>();

    public List<String> requiredFieldsFor(RecordType type) {
        List<String> fields = requiredFields == null ? null : requiredFields.get(type.getValue());
        return fields == null ? Collections.emptyList() : fields;
    }

    /** Empty when no allowlist is configured for the type. */
    public Optional<Set<String>> knownFieldsFor(RecordType type) {
        List<String> fields = knownFields == null ? null : knownFields.get(type.getValue());
        return fields == null ? Optional.empty() : Optional.of(new LinkedHashSet<>(fields));
    }
}
