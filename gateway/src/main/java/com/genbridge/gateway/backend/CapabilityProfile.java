package com.genbridge.gateway.backend;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative description of how one capability talks to its provider.
 *
 * Adding a capability means adding a profile (model, resource, field table),
 * not a new code path: {@link PayloadBuilder} and the gateway are generic.
 *
 * @param label           short name used in logs, metrics and interceptor callbacks
 * @param model           provider model name
 * @param resource        creation path below the provider base URL
 * @param mode            asynchronous task or synchronous-looking call
 * @param transport       which adapter family carries the call
 * @param mappings        payload table, applied in order
 * @param fixedParameters parameters always sent, before mapped ones
 */
public record CapabilityProfile(
        String              label,
        String              model,
        String              resource,
        Mode                mode,
        TransportFamily     transport,
        List<FieldMapping>  mappings,
        Map<String, Object> fixedParameters) {

    public enum Mode { ASYNC_TASK, SYNC }

    public CapabilityProfile {
        Objects.requireNonNull(label, "label");
        Objects.requireNonNull(mode, "mode");
        Objects.requireNonNull(transport, "transport");
        mappings        = List.copyOf(mappings);
        fixedParameters = Collections.unmodifiableMap(new LinkedHashMap<>(fixedParameters));
    }

    public static Builder builder(String label) {
        return new Builder(label);
    }

    public static final class Builder {
        private final String label;
        private String model;
        private String resource;
        private Mode mode = Mode.ASYNC_TASK;
        private TransportFamily transport = TransportFamily.REST;
        private final List<FieldMapping> mappings = new ArrayList<>();
        private final Map<String, Object> fixedParameters = new LinkedHashMap<>();

        private Builder(String label) {
            this.label = label;
        }

        public Builder model(String model)                 { this.model = model; return this; }
        public Builder resource(String resource)           { this.resource = resource; return this; }
        public Builder mode(Mode mode)                     { this.mode = mode; return this; }
        public Builder transport(TransportFamily family)   { this.transport = family; return this; }
        public Builder map(FieldMapping... rows)           { mappings.addAll(List.of(rows)); return this; }

        public Builder fixedParameter(String name, Object value) {
            fixedParameters.put(name, value);
            return this;
        }

        public CapabilityProfile build() {
            return new CapabilityProfile(label, model, resource, mode, transport, mappings, fixedParameters);
        }
    }
}
