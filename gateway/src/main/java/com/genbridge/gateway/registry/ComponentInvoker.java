package com.genbridge.gateway.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.genbridge.gateway.component.GenerationComponent;
import com.genbridge.gateway.model.InvocationContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs a component by name on an untyped JSON body.
 *
 * All {@link GenerationComponent} beans are collected at startup. The body is
 * bound to the component's input record with Jackson; the record's own
 * constructor checks apply, so a missing required field is an
 * {@link InvalidComponentInputException} before any provider call.
 */
@Component
public class ComponentInvoker {

    private static final Logger log = LoggerFactory.getLogger(ComponentInvoker.class);

    private final Map<String, GenerationComponent<?, ?>> components;
    private final ObjectMapper objectMapper;

    public ComponentInvoker(List<GenerationComponent<?, ?>> allComponents, ObjectMapper objectMapper) {
        Map<String, GenerationComponent<?, ?>> byName = new LinkedHashMap<>();
        for (GenerationComponent<?, ?> component : allComponents) {
            if (byName.putIfAbsent(component.name(), component) != null) {
                throw new IllegalStateException("Duplicate component name: " + component.name());
            }
            log.debug("Component '{}' available", component.name());
        }
        this.components   = Collections.unmodifiableMap(byName);
        this.objectMapper = objectMapper;
    }

    public GenerationComponent<?, ?> get(String name) {
        GenerationComponent<?, ?> component = components.get(name);
        if (component == null) {
            throw new ComponentNotFoundException(name);
        }
        return component;
    }

    public List<String> componentNames() {
        return List.copyOf(components.keySet());
    }

    /**
     * Bind {@code body} and run the named component.
     *
     * @throws ComponentNotFoundException      unknown name
     * @throws InvalidComponentInputException  body does not bind to the input record
     */
    public CompletableFuture<?> invoke(String name, JsonNode body, InvocationContext ctx) {
        return run(get(name), body, ctx);
    }

    private <I, O> CompletableFuture<O> run(GenerationComponent<I, O> component, JsonNode body, InvocationContext ctx) {
        JsonNode tree = body == null || body.isNull() ? objectMapper.createObjectNode() : body;
        I input;
        try {
            input = objectMapper.treeToValue(tree, component.inputType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new InvalidComponentInputException(component.name(), rootMessage(e), e);
        }
        log.info("Invoking component '{}'", component.name());
        return component.run(input, ctx);
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage();
    }
}
