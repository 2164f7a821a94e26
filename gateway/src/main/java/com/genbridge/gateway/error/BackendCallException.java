package com.genbridge.gateway.error;

/**
 * Transport-level failure: non-success status code, I/O error, or a reply
 * missing the minimum required fields (task_id on submit, status on fetch).
 */
public class BackendCallException extends GenerationException {

    private final int statusCode;

    public BackendCallException(String message, int statusCode, String rawPayload) {
        super(message, rawPayload);
        this.statusCode = statusCode;
    }

    public BackendCallException(String message, Throwable cause) {
        super(message, null, cause);
        this.statusCode = -1;
    }

    /** HTTP status observed, or -1 when the call never got a response. */
    public int statusCode() {
        return statusCode;
    }

    @Override
    public String category() {
        return "backend_call";
    }
}
