package com.genbridge.gateway.component.impl;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

public record SpeechResult(
        @JsonProperty(value = "audio_url", required = true)
        @JsonPropertyDescription("URL of the synthesized audio file.")
        String audioUrl,

        @JsonProperty("request_id")
        @JsonPropertyDescription("Id of this request, for log correlation.")
        String requestId) {
}
