package com.genbridge.gateway.config;

import com.genbridge.gateway.backend.PayloadBuilder;
import com.genbridge.gateway.backend.TransportFamily;
import com.genbridge.gateway.backend.client.ClientLibraryAdapter;
import com.genbridge.gateway.backend.http.DashScopeHttpAdapter;
import com.genbridge.gateway.task.AsyncTaskGateway;
import com.genbridge.gateway.task.CallInterceptor;
import com.genbridge.gateway.task.LoggingCallInterceptor;
import com.genbridge.gateway.task.MeteredCallInterceptor;
import com.genbridge.gateway.task.StatusNormalizer;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Map;

/**
 * Wires the gateway: one shared HTTP client, both adapter families, and the
 * default interceptor chain (log line + Micrometer).
 */
@Configuration
public class GatewayConfig {

    @Bean
    HttpClient providerHttpClient() {
        return HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Bean
    CallInterceptor callInterceptor(MeterRegistry meterRegistry) {
        return new LoggingCallInterceptor().andThen(new MeteredCallInterceptor(meterRegistry));
    }

    @Bean
    AsyncTaskGateway asyncTaskGateway(DashScopeHttpAdapter restAdapter,
                                      ClientLibraryAdapter clientAdapter,
                                      ApiKeyProvider apiKeyProvider,
                                      StatusNormalizer statusNormalizer,
                                      PayloadBuilder payloadBuilder,
                                      CallInterceptor callInterceptor) {
        return new AsyncTaskGateway(
                Map.of(TransportFamily.REST, restAdapter,
                       TransportFamily.CLIENT_LIBRARY, clientAdapter),
                apiKeyProvider, statusNormalizer, payloadBuilder, callInterceptor);
    }
}
