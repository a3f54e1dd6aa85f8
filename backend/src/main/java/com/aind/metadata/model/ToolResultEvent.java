package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A validation outcome attributed to the capture tool invocation that produced it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ToolResultEvent {

    @JsonProperty("tool_use_id")
    private String toolUseId;

    private ValidationResult validation;
}
