package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Input of a capture: create a record, or merge into {@code recordId} when given.
 * Checked by the capture service rather than bean validation so that tool calls and
 * HTTP calls fail the same way.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CaptureRequest {

    @JsonProperty("session_id")
    private String sessionId;

    @JsonProperty("record_type")
    private String recordType;

    private JsonNode data;

    private String name;

    @JsonProperty("record_id")
    private String recordId;

    @JsonProperty("link_to")
    private String linkTo;
}
