package com.genbridge.gateway.config;

import com.genbridge.gateway.error.ConfigurationException;
import com.genbridge.gateway.model.InvocationContext;

/**
 * Credential lookup boundary.
 *
 * Called before any network traffic; a missing or invalid key must fail here
 * so that no provider call is attempted.
 */
@FunctionalInterface
public interface ApiKeyProvider {

    String DASHSCOPE = "dashscope";

    /**
     * @throws ConfigurationException when no usable key is configured for the provider
     */
    String apiKey(String provider, InvocationContext ctx);
}
