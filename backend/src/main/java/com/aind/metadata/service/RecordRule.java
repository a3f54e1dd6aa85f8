package com.aind.metadata.service;

import com.aind.metadata.model.ControlledVocabulary;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Type-specific checks run after the required-field pass.
 */
@FunctionalInterface
public interface RecordRule {

    void apply(ObjectNode data, ControlledVocabulary vocabulary, ValidationReport report);
}
