package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * External biological registries a free-text value can be checked against.
 */
public enum Registry {
    MGI("mgi"),
    NCBI_GENE("ncbi_gene"),
    ADDGENE("addgene");

    private final String value;

    Registry(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /** Label used in the text summaries, e.g. {@code NCBI GENE}. */
    public String displayName() {
        return value.toUpperCase().replace('_', ' ');
    }
}
