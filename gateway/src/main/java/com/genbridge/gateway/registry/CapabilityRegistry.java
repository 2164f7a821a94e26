package com.genbridge.gateway.registry;

import com.genbridge.gateway.component.ComponentSpec;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static, ordered catalogue of capability bundles.
 *
 * Built once at startup and never mutated. Component names are unique across
 * all bundles; a duplicate fails construction.
 */
public class CapabilityRegistry {

    private final Map<String, CapabilityBundle> bundles;
    private final Map<String, ComponentSpec>    specsByName = new HashMap<>();

    public CapabilityRegistry(Map<String, CapabilityBundle> bundles) {
        this.bundles = Collections.unmodifiableMap(new LinkedHashMap<>(bundles));
        this.bundles.forEach((bundleName, bundle) -> {
            for (ComponentSpec spec : bundle.components()) {
                if (specsByName.putIfAbsent(spec.name(), spec) != null) {
                    throw new IllegalStateException(
                            "Component '" + spec.name() + "' registered twice (again in bundle '" + bundleName + "')");
                }
            }
        });
    }

    /** All bundles in registration order. */
    public Map<String, CapabilityBundle> bundles() {
        return bundles;
    }

    public Optional<CapabilityBundle> bundle(String name) {
        return Optional.ofNullable(bundles.get(name));
    }

    public Optional<ComponentSpec> componentSpec(String componentName) {
        return Optional.ofNullable(specsByName.get(componentName));
    }

    public List<String> bundleNames() {
        return List.copyOf(bundles.keySet());
    }
}
