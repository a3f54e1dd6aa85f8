package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One registry hit. Gene registries fill {@code geneId/symbol/organism};
 * catalog registries fill {@code catalogNumber/name}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RegistryEntry {

    @JsonProperty("gene_id")
    private String geneId;

    private String symbol;

    @JsonProperty("catalog_number")
    private String catalogNumber;

    private String name;

    private String description;

    private String organism;

    private String url;

    public boolean isGeneShaped() {
        return symbol != null && !symbol.isEmpty();
    }

    public boolean isCatalogShaped() {
        return catalogNumber != null && !catalogNumber.isEmpty();
    }
}
