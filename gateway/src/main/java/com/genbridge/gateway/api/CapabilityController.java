package com.genbridge.gateway.api;

import com.genbridge.gateway.registry.CapabilityBundle;
import com.genbridge.gateway.registry.CapabilityRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;

/**
 * Discovery API.
 *
 * GET /capabilities           all bundles, in registration order
 * GET /capabilities/{bundle}  one bundle: instructions plus component specs
 */
@RestController
@RequestMapping("/capabilities")
public class CapabilityController {

    private final CapabilityRegistry registry;

    public CapabilityController(CapabilityRegistry registry) {
        this.registry = registry;
    }

    @GetMapping
    public Map<String, CapabilityBundle> list() {
        return registry.bundles();
    }

    @GetMapping("/{bundle}")
    public CapabilityBundle get(@PathVariable String bundle) {
        return registry.bundle(bundle).orElseThrow(() ->
                new ResponseStatusException(HttpStatus.NOT_FOUND, "Bundle not found: " + bundle));
    }
}
