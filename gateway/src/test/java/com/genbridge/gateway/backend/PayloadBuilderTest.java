package com.genbridge.gateway.backend;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.genbridge.gateway.backend.FieldMapping.content;
import static com.genbridge.gateway.backend.FieldMapping.input;
import static com.genbridge.gateway.backend.FieldMapping.parameter;
import static org.assertj.core.api.Assertions.assertThat;

class PayloadBuilderTest {

    record Request(
            @JsonProperty("prompt")          String prompt,
            @JsonProperty("img_url")         String imageUrl,
            @JsonProperty("images")          List<String> images,
            @JsonProperty("size")            String size,
            @JsonProperty("seed")            Integer seed) {}

    private final PayloadBuilder builder = new PayloadBuilder(new ObjectMapper());

    @Test
    void build_routesFieldsToInputAndParameters() {
        CapabilityProfile profile = CapabilityProfile.builder("t2v")
                .model("wan2.6-t2v")
                .resource("services/aigc/video-generation/video-synthesis")
                .map(input("prompt"), input("img_url", "first_frame_url"), parameter("size"), parameter("seed"))
                .build();

        ProviderRequest req = builder.build(profile, new Request("a cat", "u1", null, "1280*720", 7));

        assertThat(req.model()).isEqualTo("wan2.6-t2v");
        assertThat(req.resource()).isEqualTo("services/aigc/video-generation/video-synthesis");
        assertThat(req.async()).isTrue();
        assertThat(req.input()).containsExactly(Map.entry("prompt", "a cat"), Map.entry("first_frame_url", "u1"));
        assertThat(req.parameters()).containsExactly(Map.entry("size", "1280*720"), Map.entry("seed", 7));
    }

    @Test
    void build_nullFieldsAreOmitted() {
        CapabilityProfile profile = CapabilityProfile.builder("t2v")
                .map(input("prompt"), parameter("size"), parameter("seed"))
                .build();

        ProviderRequest req = builder.build(profile, new Request("a cat", null, null, null, null));

        assertThat(req.parameters()).isEmpty();
        assertThat(req.body()).containsOnlyKeys("model", "input");
    }

    @Test
    void build_transformReturningNull_dropsField() {
        CapabilityProfile profile = CapabilityProfile.builder("t2i")
                .mode(CapabilityProfile.Mode.SYNC)
                .map(parameter("size").transformedBy(s -> "1024*1024".equals(s) ? null : s))
                .build();

        assertThat(builder.build(profile, new Request("x", null, null, "1024*1024", null)).parameters()).isEmpty();
        assertThat(builder.build(profile, new Request("x", null, null, "1280*1280", null)).parameters())
                .containsEntry("size", "1280*1280");
    }

    @Test
    @SuppressWarnings("unchecked")
    void build_messageContent_textFirstThenOneItemPerImage() {
        CapabilityProfile profile = CapabilityProfile.builder("edit")
                .mode(CapabilityProfile.Mode.SYNC)
                .fixedParameter("enable_interleave", false)
                .map(content("prompt", "text"), content("images", "image"), parameter("seed"))
                .build();

        ProviderRequest req = builder.build(profile,
                new Request("make it blue", null, List.of("https://x/1.png", "https://x/2.png"), null, 3));

        assertThat(req.async()).isFalse();
        List<Map<String, Object>> messages = (List<Map<String, Object>>) req.input().get("messages");
        assertThat(messages).hasSize(1);
        assertThat(messages.get(0)).containsEntry("role", "user");
        assertThat((List<Object>) messages.get(0).get("content")).containsExactly(
                Map.of("text", "make it blue"),
                Map.of("image", "https://x/1.png"),
                Map.of("image", "https://x/2.png"));
        assertThat(req.parameters()).containsExactly(Map.entry("enable_interleave", false), Map.entry("seed", 3));
    }
}
