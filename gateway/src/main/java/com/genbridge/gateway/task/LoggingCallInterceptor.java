package com.genbridge.gateway.task;

import com.genbridge.gateway.error.GenerationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes one log line per finished gateway call.
 *
 * Calls usually finish on an HTTP client thread, so the record's request id
 * is put into the MDC for the duration of the log statement.
 */
public class LoggingCallInterceptor implements CallInterceptor {

    private static final Logger log = LoggerFactory.getLogger(LoggingCallInterceptor.class);

    /** MDC key read by the log pattern. */
    public static final String MDC_REQUEST_ID = "requestId";

    @Override
    public void onComplete(CallRecord record) {
        String previous = MDC.get(MDC_REQUEST_ID);
        if (record.requestId() != null) {
            MDC.put(MDC_REQUEST_ID, record.requestId());
        }
        try {
            write(record);
        } finally {
            if (previous != null) {
                MDC.put(MDC_REQUEST_ID, previous);
            } else {
                MDC.remove(MDC_REQUEST_ID);
            }
        }
    }

    private void write(CallRecord record) {
        if (!record.failed()) {
            log.info("{} ok request_id={} in {} ms: {}",
                    record.label(), record.requestId(), record.elapsed().toMillis(), record.payload());
        } else if (record.error() instanceof GenerationException e) {
            log.warn("{} failed request_id={} in {} ms [{}]: {}",
                    record.label(), record.requestId(), record.elapsed().toMillis(), e.category(), e.getMessage());
        } else {
            log.error("{} failed request_id={} in {} ms",
                    record.label(), record.requestId(), record.elapsed().toMillis(), record.error());
        }
    }
}
