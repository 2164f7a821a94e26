package com.genbridge.gateway.component.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.backend.TransportFamily;
import com.genbridge.gateway.component.ImageResults;
import com.genbridge.gateway.component.InputChecks;
import com.genbridge.gateway.component.SyncGenerationComponent;
import com.genbridge.gateway.model.GenerationResult;
import com.genbridge.gateway.task.AsyncTaskGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import static com.genbridge.gateway.backend.FieldMapping.content;
import static com.genbridge.gateway.backend.FieldMapping.parameter;

/**
 * Text-to-image (wan2.6-t2i) over the multimodal generation endpoint.
 */
@Component
public class ImageGeneration extends SyncGenerationComponent<ImageGeneration.Input, ImageResults> {

    public static final String NAME = "modelstudio_wanx26_image_generation";

    /** Provider default size; sent as absent. */
    static final String DEFAULT_SIZE = "1024*1024";

    private static final String DESCRIPTION = """
            [version: wan2.6] Text-to-image generation (wan2.6-t2i).
            Generates 1 to 4 images from a text prompt and returns their URLs.""";

    public record Input(
            @JsonProperty(value = "prompt", required = true)
            @JsonPropertyDescription("Describes the desired image; detailed and clear works best. Truncated after 800 characters.")
            String prompt,

            @JsonProperty("negative_prompt")
            @JsonPropertyDescription("Content to avoid, e.g. low quality, blur, text. Truncated after 500 characters.")
            String negativePrompt,

            @JsonProperty("size")
            @JsonPropertyDescription("Output resolution, e.g. 1280*1280.")
            String size,

            @JsonProperty("prompt_extend")
            @JsonPropertyDescription("Let the provider rewrite the prompt. Default true.")
            Boolean promptExtend,

            @JsonProperty("n")
            @JsonPropertyDescription("Number of images, 1 to 4. Default 1.")
            Integer n,

            @JsonProperty("seed")
            @JsonPropertyDescription("Random seed for reproducible results.")
            Integer seed,

            @JsonProperty("watermark")
            @JsonPropertyDescription("Add a watermark. Default false.")
            Boolean watermark) {

        public Input {
            InputChecks.requireText(prompt, "prompt");
            if (n == null) n = 1;
        }
    }

    public ImageGeneration(AsyncTaskGateway gateway,
                           @Value("${genbridge.models.text-to-image:wan2.6-t2i}") String model) {
        super(NAME, DESCRIPTION, Input.class, ImageResults.class, gateway,
                CapabilityProfile.builder("wan26_image_generation")
                        .model(model)
                        .resource("services/aigc/multimodal-generation/generation")
                        .mode(CapabilityProfile.Mode.SYNC)
                        .transport(TransportFamily.REST)
                        .map(content("prompt", "text"),
                             parameter("negative_prompt"),
                             parameter("size").transformedBy(size -> DEFAULT_SIZE.equals(size) ? null : size),
                             parameter("n"),
                             parameter("seed"),
                             parameter("watermark"),
                             parameter("prompt_extend"))
                        .build());
    }

    @Override
    protected ImageResults toOutput(GenerationResult result) {
        return ImageResults.from(result);
    }
}
