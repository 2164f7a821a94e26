package com.genbridge.gateway.model;

import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-call correlation context, passed explicitly through every layer.
 *
 * Nothing here is stored in thread-local or process-wide state, so concurrent
 * calls cannot see each other's request ids or credentials.
 *
 * @param requestId caller-supplied correlation id, may be null
 * @param headers   inbound call headers (case-insensitive), e.g. a per-call API key override
 */
public record InvocationContext(String requestId, Map<String, String> headers) {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    public InvocationContext {
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        headers = Collections.unmodifiableMap(copy);
    }

    public static InvocationContext empty() {
        return new InvocationContext(null, Map.of());
    }

    public static InvocationContext withRequestId(String requestId) {
        return new InvocationContext(requestId, Map.of());
    }

    /** The caller's request id, if one was supplied and is not blank. */
    public Optional<String> callerRequestId() {
        return requestId == null || requestId.isBlank() ? Optional.empty() : Optional.of(requestId);
    }

    public Optional<String> header(String name) {
        String value = headers.get(name);
        return value == null || value.isBlank() ? Optional.empty() : Optional.of(value);
    }
}
