package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CaptureResponse {

    public static final String CREATED = "created";
    public static final String UPDATED = "updated";

    private String action;  // created | updated

    @JsonProperty("record_id")
    private String recordId;

    @JsonProperty("record_type")
    private RecordType recordType;

    private RecordCategory category;

    private String name;

    private String message;

    private ValidationResult validation;

    @JsonProperty("validation_summary")
    private String validationSummary;

    @JsonProperty("registry_lookups")
    private List<RegistryLookupResult> registryLookups;

    @JsonProperty("registry_summary")
    private String registrySummary;
}
