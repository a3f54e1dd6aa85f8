package com.aind.metadata.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ValidationIssue {

    private String field;

    private String message;

    private IssueSeverity severity;

    public static ValidationIssue error(String field, String message) {
        return new ValidationIssue(field, message, IssueSeverity.ERROR);
    }

    public static ValidationIssue warning(String field, String message) {
        return new ValidationIssue(field, message, IssueSeverity.WARNING);
    }
}
