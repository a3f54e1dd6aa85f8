package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegistryLookupResult {

    private Registry registry;

    private String query;

    private boolean found;

    @Builder.Default
    private List<RegistryEntry> results = new ArrayList<>();

    private String url;

    @JsonProperty("status_code")
    private Integer statusCode;

    private String error;

    public static RegistryLookupResult failed(Registry registry, String query, String error) {
        return RegistryLookupResult.builder()
                .registry(registry)
                .query(query)
                .found(false)
                .error(error)
                .build();
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
