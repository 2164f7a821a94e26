package com.genbridge.gateway.backend;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a {@link ProviderRequest} from any request record by walking the
 * capability's {@link FieldMapping} table.
 *
 * The request is first flattened to its JSON field map (so {@code @JsonProperty}
 * names are the uniform field names). Null values, and values a transform maps
 * to null, are left out of the payload entirely.
 */
@Component
public class PayloadBuilder {

    private static final TypeReference<LinkedHashMap<String, Object>> FIELDS = new TypeReference<>() {};

    private final ObjectMapper json;

    public PayloadBuilder(ObjectMapper objectMapper) {
        this.json = objectMapper;
    }

    public ProviderRequest build(CapabilityProfile profile, Object request) {
        Map<String, Object> uniform = request == null ? Map.of() : json.convertValue(request, FIELDS);

        Map<String, Object> input      = new LinkedHashMap<>();
        Map<String, Object> parameters = new LinkedHashMap<>(profile.fixedParameters());
        List<Map<String, Object>> content = new ArrayList<>();

        for (FieldMapping row : profile.mappings()) {
            Object value = uniform.get(row.uniformField());
            if (value == null) continue;
            value = row.transform().apply(value);
            if (value == null) continue;

            switch (row.target()) {
                case INPUT      -> input.put(row.providerField(), value);
                case PARAMETERS -> parameters.put(row.providerField(), value);
                case MESSAGE_CONTENT -> {
                    if (value instanceof Collection<?> items) {
                        for (Object item : items) {
                            if (item != null) content.add(Map.of(row.providerField(), item));
                        }
                    } else {
                        content.add(Map.of(row.providerField(), value));
                    }
                }
            }
        }

        if (!content.isEmpty()) {
            input.put("messages", List.of(Map.of("role", "user", "content", content)));
        }

        return new ProviderRequest(profile.model(), profile.resource(), input, parameters,
                profile.mode() == CapabilityProfile.Mode.ASYNC_TASK);
    }
}
