package com.genbridge.gateway.registry;

/**
 * The JSON body could not be bound to the component's input record
 * (wrong types, missing required fields).
 */
public class InvalidComponentInputException extends RuntimeException {

    public InvalidComponentInputException(String component, String message, Throwable cause) {
        super("Invalid input for '" + component + "': " + message, cause);
    }
}
