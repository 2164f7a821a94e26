package com.genbridge.gateway.component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Discovery metadata of a {@link GenerationComponent}.
 *
 * @param name         globally unique tool name, e.g. "modelstudio_wan_video_fetch"
 * @param description  text shown to the calling agent
 * @param inputSchema  JSON schema of the input record
 * @param outputSchema JSON schema of the output record
 */
public record ComponentSpec(
        String name,
        String description,
        @JsonProperty("input_schema")  JsonNode inputSchema,
        @JsonProperty("output_schema") JsonNode outputSchema) {

    public ComponentSpec {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Component name must not be blank");
        }
        Objects.requireNonNull(inputSchema, "inputSchema");
        Objects.requireNonNull(outputSchema, "outputSchema");
        inputSchema  = inputSchema.deepCopy();
        outputSchema = outputSchema.deepCopy();
    }

    // schemas are mutable Jackson trees; hand out copies

    @Override
    public JsonNode inputSchema() {
        return inputSchema.deepCopy();
    }

    @Override
    public JsonNode outputSchema() {
        return outputSchema.deepCopy();
    }
}
