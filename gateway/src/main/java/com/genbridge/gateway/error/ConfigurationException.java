package com.genbridge.gateway.error;

/**
 * Missing or invalid credential. Always raised before any network call.
 */
public class ConfigurationException extends GenerationException {

    public ConfigurationException(String message) {
        super(message, null);
    }

    @Override
    public String category() {
        return "configuration";
    }
}
