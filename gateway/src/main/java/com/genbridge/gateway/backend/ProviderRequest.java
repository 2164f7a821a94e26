package com.genbridge.gateway.backend;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Provider payload built from a uniform request.
 *
 * @param model      provider model name, e.g. "wan2.6-t2v"
 * @param resource   path below the provider base URL, e.g. "services/aigc/video-generation/video-synthesis"
 * @param input      capability fields
 * @param parameters optional tuning fields
 * @param async      true when the provider must run the call as a background task
 */
public record ProviderRequest(
        String              model,
        String              resource,
        Map<String, Object> input,
        Map<String, Object> parameters,
        boolean             async) {

    public ProviderRequest {
        input      = Collections.unmodifiableMap(new LinkedHashMap<>(input));
        parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /** Wire body: {@code {model, input, parameters}}; parameters omitted when empty. */
    public Map<String, Object> body() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", input);
        if (!parameters.isEmpty()) {
            body.put("parameters", parameters);
        }
        return body;
    }
}
