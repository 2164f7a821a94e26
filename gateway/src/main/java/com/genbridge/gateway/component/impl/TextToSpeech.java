package com.genbridge.gateway.component.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.genbridge.gateway.backend.CapabilityProfile;
import com.genbridge.gateway.backend.TransportFamily;
import com.genbridge.gateway.component.InputChecks;
import com.genbridge.gateway.component.SyncGenerationComponent;
import com.genbridge.gateway.model.GenerationResult;
import com.genbridge.gateway.task.AsyncTaskGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import static com.genbridge.gateway.backend.FieldMapping.input;

/**
 * Speech synthesis (qwen-tts); the reply carries the audio under {@code output.audio.url}.
 */
@Component
public class TextToSpeech extends SyncGenerationComponent<TextToSpeech.Input, SpeechResult> {

    public static final String NAME = "modelstudio_qwen_tts";

    static final String DEFAULT_VOICE = "Cherry";

    private static final String DESCRIPTION = """
            Qwen text-to-speech (qwen-tts). Converts text to natural speech and returns the audio URL.""";

    public record Input(
            @JsonProperty(value = "text", required = true)
            @JsonPropertyDescription("Text to synthesize.")
            String text,

            @JsonProperty("voice")
            @JsonPropertyDescription("Voice name, e.g. Cherry, Serena, Ethan, Chelsie. Default Cherry.")
            String voice) {

        public Input {
            InputChecks.requireText(text, "text");
            if (voice == null || voice.isBlank()) voice = DEFAULT_VOICE;
        }
    }

    public TextToSpeech(AsyncTaskGateway gateway,
                        @Value("${genbridge.models.text-to-speech:qwen-tts}") String model) {
        super(NAME, DESCRIPTION, Input.class, SpeechResult.class, gateway,
                CapabilityProfile.builder("qwen_tts")
                        .model(model)
                        .resource("services/aigc/multimodal-generation/generation")
                        .mode(CapabilityProfile.Mode.SYNC)
                        .transport(TransportFamily.REST)
                        .map(input("text"), input("voice"))
                        .build());
    }

    @Override
    protected SpeechResult toOutput(GenerationResult result) {
        return new SpeechResult(result.primaryArtifact(), result.requestId());
    }
}
