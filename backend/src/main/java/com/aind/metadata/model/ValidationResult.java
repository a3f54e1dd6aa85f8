package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of validating one record's data. Issues keep detection order.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ValidationResult {

    @JsonProperty("record_type")
    private RecordType recordType;

    private ValidationStatus status;

    @JsonProperty("completeness_score")
    private double completenessScore;

    @Builder.Default
    private List<ValidationIssue> errors = new ArrayList<>();

    @Builder.Default
    private List<ValidationIssue> warnings = new ArrayList<>();

    @Builder.Default
    @JsonProperty("missing_required")
    private List<String> missingRequired = new ArrayList<>();

    @Builder.Default
    @JsonProperty("valid_fields")
    private List<String> validFields = new ArrayList<>();
}
