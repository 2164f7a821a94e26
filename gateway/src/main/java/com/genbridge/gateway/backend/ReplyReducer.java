package com.genbridge.gateway.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.genbridge.gateway.backend.client.TaskResponse;
import com.genbridge.gateway.error.ResponseParseException;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reduces a {@link RawReply} of either family to a {@link BackendReply}.
 *
 * Transport rules (both families): status code other than 200, or no
 * {@code output} section (an empty or {@code null} body included), gives
 * {@code transportOk == false}.
 * Shape rules: a 200 body that is not a JSON object, an {@code output} that
 * is not an object, or a non-text {@code task_id}/{@code task_status}/{@code request_id}
 * raises {@link ResponseParseException}.
 */
@Component
public class ReplyReducer {

    private static final int HTTP_OK = 200;

    private final ObjectMapper      json;
    private final ArtifactExtractor artifacts;

    public ReplyReducer(ObjectMapper objectMapper, ArtifactExtractor artifacts) {
        this.json      = objectMapper;
        this.artifacts = artifacts;
    }

    public BackendReply reduce(RawReply reply) {
        if (reply instanceof RawReply.Json rest) {
            return reduceJson(rest);
        }
        if (reply instanceof RawReply.Typed typed) {
            return reduceTyped(typed);
        }
        throw new ResponseParseException("Unsupported reply family " + reply.getClass().getName(), String.valueOf(reply));
    }

    // ------------------------------------------------------------------
    // REST JSON
    // ------------------------------------------------------------------

    private BackendReply reduceJson(RawReply.Json reply) {
        boolean ok = reply.statusCode() == HTTP_OK;
        JsonNode root;
        try {
            root = reply.body() == null || reply.body().isBlank()
                    ? TextNode.valueOf("")
                    : json.readTree(reply.body());
        } catch (JsonProcessingException e) {
            if (!ok) {
                // error pages from gateways in front of the provider are often not JSON
                return BackendReply.transportFailure(reply.statusCode(), null, TextNode.valueOf(reply.body()));
            }
            throw new ResponseParseException("Reply body is not valid JSON", reply.body(), e);
        }

        if (!ok) {
            String requestId = root.isObject() ? optionalText(root, "request_id", root) : null;
            return BackendReply.transportFailure(reply.statusCode(), requestId, root);
        }
        if (isEmpty(root)) {
            // same outcome as a typed reply that bound to no output
            return BackendReply.transportFailure(reply.statusCode(), null, root);
        }
        if (!root.isObject()) {
            throw new ResponseParseException("Reply body is not a JSON object", root.toString());
        }

        String requestId = optionalText(root, "request_id", root);
        JsonNode output = root.get("output");
        if (output == null || output.isNull()) {
            return BackendReply.transportFailure(reply.statusCode(), requestId, root);
        }
        if (!output.isObject()) {
            throw new ResponseParseException("Reply 'output' is not an object", root.toString());
        }

        return new BackendReply(
                true,
                reply.statusCode(),
                optionalText(output, "task_id", root),
                optionalText(output, "task_status", root),
                requestId,
                root,
                artifacts.fromOutput(output));
    }

    private static boolean isEmpty(JsonNode root) {
        return root.isNull() || (root.isTextual() && root.asText().isEmpty());
    }

    /** Text value of {@code node.field}; null when absent, null or blank. */
    private static String optionalText(JsonNode node, String field, JsonNode root) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) return null;
        if (!value.isTextual()) {
            throw new ResponseParseException("Field '" + field + "' is not a string", root.toString());
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    // ------------------------------------------------------------------
    // Typed client objects
    // ------------------------------------------------------------------

    private BackendReply reduceTyped(RawReply.Typed reply) {
        TaskResponse response = reply.response();
        if (response == null) {
            throw new ResponseParseException("Client returned no reply object", null);
        }
        JsonNode raw = json.valueToTree(response);
        TaskResponse.Output output = response.output();
        if (response.statusCode() != HTTP_OK || output == null) {
            return BackendReply.transportFailure(response.statusCode(), blankToNull(response.requestId()), raw);
        }
        return new BackendReply(
                true,
                response.statusCode(),
                blankToNull(output.taskId()),
                blankToNull(output.taskStatus()),
                blankToNull(response.requestId()),
                raw,
                List.copyOf(output.artifactReferences()));
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
