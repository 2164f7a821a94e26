package com.genbridge.gateway.registry;

import com.genbridge.gateway.component.ComponentSpec;

import java.util.List;

/**
 * A named group of components advertised together, with usage notes for the agent.
 */
public record CapabilityBundle(String instructions, List<ComponentSpec> components) {

    public CapabilityBundle {
        instructions = instructions == null ? "" : instructions;
        components   = List.copyOf(components);
    }
}
