package com.aind.metadata.service;

import com.aind.metadata.model.ValidationIssue;
import com.aind.metadata.model.ValidationResult;
import com.aind.metadata.model.ValidationStatus;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class ValidationSummaryFormatter {

    public static final String PASSED = "VALIDATION PASSED: All fields are valid.";

    public String format(ValidationResult result) {
        if (result.getStatus() == ValidationStatus.VALID && result.getMissingRequired().isEmpty()) {
            return PASSED;
        }

        List<String> lines = new ArrayList<>();
        if (!result.getErrors().isEmpty()) {
            lines.add("VALIDATION ERRORS (must be fixed):");
            for (ValidationIssue error : result.getErrors()) {
                lines.add("  - " + error.getField() + ": " + error.getMessage());
            }
        }
        if (!result.getMissingRequired().isEmpty()) {
            lines.add("MISSING REQUIRED FIELDS: " + String.join(", ", result.getMissingRequired()));
        }
        if (!result.getWarnings().isEmpty()) {
            lines.add("WARNINGS:");
            for (ValidationIssue warning : result.getWarnings()) {
                lines.add("  - " + warning.getField() + ": " + warning.getMessage());
            }
        }
        lines.add("");
        lines.add("You MUST report these issues to the user and suggest how to fix them.");
        return String.join("\n", lines);
    }
}
