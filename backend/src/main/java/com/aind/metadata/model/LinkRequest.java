package com.aind.metadata.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class LinkRequest {

    @NotBlank(message = "source_id is required")
    @JsonProperty("source_id")
    private String sourceId;

    @NotBlank(message = "target_id is required")
    @JsonProperty("target_id")
    private String targetId;
}
