package com.genbridge.gateway.task;

import java.time.Duration;

/**
 * What an interceptor sees once a gateway call has finished.
 *
 * @param label     call label, e.g. "wan26_text_to_video.submit"
 * @param requestId correlation id; the caller's id when the call failed before one was resolved
 * @param payload   result summary (handle, outcome or result); null on error
 * @param error     failure, null on success
 * @param elapsed   wall-clock time of the call
 */
public record CallRecord(String label, String requestId, Object payload, Throwable error, Duration elapsed) {

    public boolean failed() {
        return error != null;
    }
}
