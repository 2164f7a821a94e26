package com.genbridge.gateway.component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.genbridge.gateway.model.GenerationResult;

import java.util.List;

/**
 * Output of the synchronous image components.
 */
public record ImageResults(
        @JsonProperty(value = "results", required = true)
        @JsonPropertyDescription("URLs of the generated images.")
        List<String> results,

        @JsonProperty("request_id")
        @JsonPropertyDescription("Id of this request, for log correlation.")
        String requestId) {

    public static ImageResults from(GenerationResult result) {
        return new ImageResults(result.artifacts(), result.requestId());
    }
}
