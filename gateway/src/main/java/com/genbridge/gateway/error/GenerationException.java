package com.genbridge.gateway.error;

/**
 * Base type for every failure a generation call can raise.
 *
 * Unchecked so callers only catch it when they have a recovery strategy.
 * Subtypes are never retried internally; retry is the caller's policy.
 * {@link #rawPayload()} carries enough of the provider reply to debug the
 * failure without re-running the call.
 */
public abstract class GenerationException extends RuntimeException {

    private final String rawPayload;

    protected GenerationException(String message, String rawPayload) {
        super(withPayload(message, rawPayload));
        this.rawPayload = rawPayload;
    }

    protected GenerationException(String message, String rawPayload, Throwable cause) {
        super(withPayload(message, rawPayload), cause);
        this.rawPayload = rawPayload;
    }

    /** Short machine-readable category, e.g. "backend_call". */
    public abstract String category();

    /** Raw provider payload (or transport diagnostic); may be null. */
    public String rawPayload() {
        return rawPayload;
    }

    private static String withPayload(String message, String rawPayload) {
        return rawPayload == null || rawPayload.isBlank() ? message : message + ". Raw payload: " + rawPayload;
    }
}
