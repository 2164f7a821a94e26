package com.genbridge.gateway.component;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.genbridge.gateway.model.TaskStatus;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordSchemasTest {

    record Inner(@JsonProperty("url") String url) {}

    record Sample(
            @JsonProperty(value = "prompt", required = true)
            @JsonPropertyDescription("What to draw.")
            String prompt,
            @JsonProperty("n") Integer n,
            @JsonProperty("watermark") Boolean watermark,
            @JsonProperty("images") List<String> images,
            @JsonProperty("status") TaskStatus status,
            @JsonProperty("inner") Inner inner,
            double ratio) {}

    @Test
    void schemaFor_mapsNamesTypesAndRequired() {
        JsonNode schema = RecordSchemas.schemaFor(Sample.class);

        assertThat(schema.path("type").asText()).isEqualTo("object");
        JsonNode props = schema.path("properties");
        assertThat(props.path("prompt").path("type").asText()).isEqualTo("string");
        assertThat(props.path("prompt").path("description").asText()).isEqualTo("What to draw.");
        assertThat(props.path("n").path("type").asText()).isEqualTo("integer");
        assertThat(props.path("watermark").path("type").asText()).isEqualTo("boolean");
        assertThat(props.path("images").path("type").asText()).isEqualTo("array");
        assertThat(props.path("images").path("items").path("type").asText()).isEqualTo("string");
        assertThat(props.path("status").path("enum").size()).isEqualTo(TaskStatus.values().length);
        assertThat(props.path("inner").path("properties").has("url")).isTrue();
        assertThat(props.path("ratio").path("type").asText()).isEqualTo("number");

        assertThat(schema.path("required").size()).isEqualTo(1);
        assertThat(schema.path("required").get(0).asText()).isEqualTo("prompt");
    }

    @Test
    void schemaFor_nonRecord_isRejected() {
        assertThatThrownBy(() -> RecordSchemas.schemaFor(String.class))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void componentSpec_schemasAreDefensiveCopies() {
        ComponentSpec spec = new ComponentSpec("x", "d",
                RecordSchemas.schemaFor(Sample.class), RecordSchemas.schemaFor(Inner.class));

        ((ObjectNode) spec.inputSchema()).put("type", "tampered");

        assertThat(spec.inputSchema().path("type").asText()).isEqualTo("object");
    }
}
