package com.genbridge.gateway.registry;

public class ComponentNotFoundException extends RuntimeException {
    public ComponentNotFoundException(String name) {
        super("No component registered with name: '" + name + "'");
    }
}
