package com.genbridge.gateway.config;

import com.genbridge.gateway.error.ConfigurationException;
import com.genbridge.gateway.model.InvocationContext;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves the DashScope key from the inbound call first, then from
 * configuration ({@code genbridge.dashscope.api-key}, normally bound to the
 * {@code DASHSCOPE_API_KEY} environment variable).
 */
@Component
public class EnvironmentApiKeyProvider implements ApiKeyProvider {

    /** Per-call override, forwarded by hosts that proxy end-user credentials. */
    public static final String API_KEY_HEADER = "X-DashScope-Api-Key";

    private final String configuredKey;

    public EnvironmentApiKeyProvider(@Value("${genbridge.dashscope.api-key:}") String configuredKey) {
        this.configuredKey = configuredKey;
    }

    @Override
    public String apiKey(String provider, InvocationContext ctx) {
        if (!DASHSCOPE.equals(provider)) {
            throw new ConfigurationException("No credentials are configured for provider '" + provider + "'");
        }
        return ctx.header(API_KEY_HEADER)
                .or(() -> Optional.ofNullable(configuredKey).map(String::strip).filter(k -> !k.isEmpty()))
                .orElseThrow(() -> new ConfigurationException("Please set a valid DASHSCOPE_API_KEY"));
    }
}
