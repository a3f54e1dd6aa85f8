package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A record together with the records linked to it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordDetail {

    @JsonUnwrapped
    private MetadataRecord record;

    private List<MetadataRecord> links;
}
