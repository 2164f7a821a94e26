package com.genbridge.gateway.task;

import com.genbridge.gateway.error.GenerationException;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Records every gateway call in Micrometer:
 * <pre>
 *   genbridge.call.count{label, outcome="success|configuration|backend_call|terminal_task_failure|response_parse|empty_result|error"}
 *   genbridge.call.duration{label}
 * </pre>
 */
public class MeteredCallInterceptor implements CallInterceptor {

    private final MeterRegistry meterRegistry;

    public MeteredCallInterceptor(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @Override
    public void onComplete(CallRecord record) {
        String outcome;
        if (!record.failed()) {
            outcome = "success";
        } else if (record.error() instanceof GenerationException e) {
            outcome = e.category();
        } else {
            outcome = "error";
        }
        meterRegistry.counter("genbridge.call.count", "label", record.label(), "outcome", outcome).increment();
        meterRegistry.timer("genbridge.call.duration", "label", record.label()).record(record.elapsed());
    }
}
