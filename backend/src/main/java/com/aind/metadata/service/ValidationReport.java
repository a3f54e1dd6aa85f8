package com.aind.metadata.service;

import com.aind.metadata.model.IssueSeverity;
import com.aind.metadata.model.RecordType;
import com.aind.metadata.model.ValidationIssue;
import com.aind.metadata.model.ValidationResult;
import com.aind.metadata.model.ValidationStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Mutable collector used while one validation runs. Issues are kept in detection order.
 */
public class ValidationReport {

    private final List<ValidationIssue> issues = new ArrayList<>();
    private final List<String> missingRequired = new ArrayList<>();
    private final List<String> validFields = new ArrayList<>();

    public void error(String field, String message) {
        issues.add(ValidationIssue.error(field, message));
    }

    public void warning(String field, String message) {
        issues.add(ValidationIssue.warning(field, message));
    }

    public void valid(String field) {
        if (!validFields.contains(field)) {
            validFields.add(field);
        }
    }

    public void missing(String field) {
        missingRequired.add(field);
    }

    public ValidationResult toResult(RecordType recordType, int requiredTotal) {
        List<ValidationIssue> errors = issues.stream()
                .filter(i -> i.getSeverity() == IssueSeverity.ERROR)
                .collect(Collectors.toList());
        List<ValidationIssue> warnings = issues.stream()
                .filter(i -> i.getSeverity() == IssueSeverity.WARNING)
                .collect(Collectors.toList());

        ValidationStatus status;
        if (!errors.isEmpty()) {
            status = ValidationStatus.ERRORS;
        } else if (!warnings.isEmpty() || !missingRequired.isEmpty()) {
            status = ValidationStatus.WARNINGS;
        } else {
            status = ValidationStatus.VALID;
        }

        return ValidationResult.builder()
                .recordType(recordType)
                .status(status)
                .completenessScore(completeness(requiredTotal, missingRequired.size()))
                .errors(errors)
                .warnings(warnings)
                .missingRequired(new ArrayList<>(missingRequired))
                .validFields(new ArrayList<>(validFields))
                .build();
    }

    static double completeness(int requiredTotal, int missing) {
        if (requiredTotal == 0) {
            return 1.0;
        }
        double ratio = (double) (requiredTotal - missing) / requiredTotal;
        return Math.round(ratio * 100.0) / 100.0;
    }
}
