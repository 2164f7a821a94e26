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

import java.util.List;

import static com.genbridge.gateway.backend.FieldMapping.content;
import static com.genbridge.gateway.backend.FieldMapping.parameter;

/**
 * Reference-image editing (wan2.6-image). The prompt is the first content
 * item, each reference image one more.
 */
@Component
public class ImageEdit extends SyncGenerationComponent<ImageEdit.Input, ImageResults> {

    public static final String NAME = "modelstudio_image_edit_wan26";

    private static final String DESCRIPTION = """
            [version: wan2.6] Image editing (wan2.6-image).
            Edits, restyles or keeps subjects consistent across 1 to 4 input images; returns the edited image URLs.""";

    public record Input(
            @JsonProperty(value = "prompt", required = true)
            @JsonPropertyDescription("Describes the desired result.")
            String prompt,

            @JsonProperty(value = "images", required = true)
            @JsonPropertyDescription("Reference image URLs; at least one is required.")
            List<String> images,

            @JsonProperty("negative_prompt")
            @JsonPropertyDescription("Content to avoid, e.g. low quality, blur, text.")
            String negativePrompt,

            @JsonProperty("size")
            @JsonPropertyDescription("Output resolution. Default 1280*1280.")
            String size,

            @JsonProperty("prompt_extend")
            @JsonPropertyDescription("Let the provider rewrite the prompt. Default true.")
            Boolean promptExtend,

            @JsonProperty("seed")
            @JsonPropertyDescription("Random seed for reproducible results.")
            Integer seed,

            @JsonProperty("watermark")
            @JsonPropertyDescription("Add a watermark. Default false.")
            Boolean watermark,

            @JsonProperty("n")
            @JsonPropertyDescription("Number of images, 1 to 4. Default 1.")
            Integer n) {

        public Input {
            InputChecks.requireText(prompt, "prompt");
            images = InputChecks.requireNonEmpty(images, "images");
            if (n == null) n = 1;
        }
    }

    public ImageEdit(AsyncTaskGateway gateway,
                     @Value("${genbridge.models.image-edit:wan2.6-image}") String model) {
        super(NAME, DESCRIPTION, Input.class, ImageResults.class, gateway,
                CapabilityProfile.builder("wan26_image_edit")
                        .model(model)
                        .resource("services/aigc/multimodal-generation/generation")
                        .mode(CapabilityProfile.Mode.SYNC)
                        .transport(TransportFamily.REST)
                        .fixedParameter("enable_interleave", false)
                        .map(content("prompt", "text"),
                             content("images", "image"),
                             parameter("negative_prompt"),
                             parameter("size"),
                             parameter("seed"),
                             parameter("watermark"),
                             parameter("prompt_extend"),
                             parameter("n"))
                        .build());
    }

    @Override
    protected ImageResults toOutput(GenerationResult result) {
        return ImageResults.from(result);
    }
}
