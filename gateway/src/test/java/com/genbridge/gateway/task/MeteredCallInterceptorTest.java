package com.genbridge.gateway.task;

import com.genbridge.gateway.error.EmptyResultException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class MeteredCallInterceptorTest {

    SimpleMeterRegistry registry;
    MeteredCallInterceptor interceptor;

    @BeforeEach
    void setUp() {
        registry    = new SimpleMeterRegistry();
        interceptor = new MeteredCallInterceptor(registry);
    }

    @Test
    void onComplete_success_countsAndTimes() {
        interceptor.onComplete(new CallRecord("t2v.submit", "r1", "handle", null, Duration.ofMillis(120)));

        assertThat(registry.get("genbridge.call.count")
                .tags("label", "t2v.submit", "outcome", "success").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("genbridge.call.duration")
                .tag("label", "t2v.submit").timer().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
    }

    @Test
    void onComplete_generationFailure_taggedWithCategory() {
        interceptor.onComplete(new CallRecord("t2v.fetch", "r1", null,
                new EmptyResultException("t1", "{}"), Duration.ofMillis(5)));

        assertThat(registry.get("genbridge.call.count")
                .tags("label", "t2v.fetch", "outcome", "empty_result").counter().count()).isEqualTo(1.0);
    }

    @Test
    void onComplete_otherFailure_taggedAsError() {
        interceptor.onComplete(new CallRecord("t2v.fetch", null, null,
                new IllegalStateException("boom"), Duration.ZERO));

        assertThat(registry.get("genbridge.call.count")
                .tags("label", "t2v.fetch", "outcome", "error").counter().count()).isEqualTo(1.0);
    }

    @Test
    void andThen_runsBothInterceptorsInOrder() {
        StringBuilder order = new StringBuilder();
        CallInterceptor chain = ((CallInterceptor) r -> order.append("a")).andThen(r -> order.append("b"));

        chain.onComplete(new CallRecord("x", null, null, null, Duration.ZERO));

        assertThat(order).hasToString("ab");
    }
}
