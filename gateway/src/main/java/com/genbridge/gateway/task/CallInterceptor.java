package com.genbridge.gateway.task;

/**
 * Around-call hook supplied by the host (tracing, metrics, audit).
 *
 * The gateway invokes it at most once per call, after the outcome is known.
 * Implementations must not block; any exception they throw is logged and
 * dropped so the result path is never affected.
 */
@FunctionalInterface
public interface CallInterceptor {

    CallInterceptor NOOP = record -> {};

    void onComplete(CallRecord record);

    default CallInterceptor andThen(CallInterceptor next) {
        return record -> {
            onComplete(record);
            next.onComplete(record);
        };
    }
}
