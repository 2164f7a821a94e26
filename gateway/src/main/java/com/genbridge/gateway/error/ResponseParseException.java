package com.genbridge.gateway.error;

/**
 * Reply fields are present but in a shape that cannot be reduced to a
 * {@link com.genbridge.gateway.backend.BackendReply}.
 */
public class ResponseParseException extends GenerationException {

    public ResponseParseException(String message, String rawPayload) {
        super(message, rawPayload);
    }

    public ResponseParseException(String message, String rawPayload, Throwable cause) {
        super(message, rawPayload, cause);
    }

    @Override
    public String category() {
        return "response_parse";
    }
}
