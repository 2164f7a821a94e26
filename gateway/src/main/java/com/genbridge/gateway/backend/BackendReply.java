package com.genbridge.gateway.backend;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Provider-agnostic reduction of one provider reply.
 *
 * Both transport families (typed client objects and raw REST JSON) end up in
 * this shape. The adapter only reports what it saw; deciding whether a reply
 * is acceptable (e.g. zero artifacts under SUCCEEDED) is the gateway's job.
 *
 * @param transportOk false for non-200 replies and replies without an output section
 * @param statusCode  HTTP (or client-reported) status code
 * @param taskId      provider task id, null when absent
 * @param status      raw provider status string, null when absent
 * @param requestId   provider request id, null when absent
 * @param raw         full reply for diagnostics
 * @param artifacts   artifact references in encounter order, possibly empty
 */
public record BackendReply(
        boolean      transportOk,
        int          statusCode,
        String       taskId,
        String       status,
        String       requestId,
        JsonNode     raw,
        List<String> artifacts) {

    public BackendReply {
        artifacts = artifacts == null ? List.of() : List.copyOf(artifacts);
    }

    /** Reply rejected at transport level; only the diagnostic payload is kept. */
    public static BackendReply transportFailure(int statusCode, String requestId, JsonNode raw) {
        return new BackendReply(false, statusCode, null, null, requestId, raw, List.of());
    }

    /** Raw payload rendered for exception messages and logs. */
    public String rawText() {
        return raw == null ? null : raw.toString();
    }
}
