package com.genbridge.gateway.component;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.lang.reflect.Method;
import java.lang.reflect.ParameterizedType;
import java.lang.reflect.RecordComponent;
import java.lang.reflect.Type;
import java.util.Collection;

/**
 * Derives a JSON schema from a record class.
 *
 * Property names and required flags come from {@code @JsonProperty}, property
 * descriptions from {@code @JsonPropertyDescription}, so the schema always
 * matches what Jackson binds. Supported member types: strings, numbers,
 * booleans, enums, collections, nested records; anything else is "object".
 */
public final class RecordSchemas {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private RecordSchemas() {}

    public static ObjectNode schemaFor(Class<?> type) {
        if (!type.isRecord()) {
            throw new IllegalArgumentException(type.getName() + " is not a record");
        }
        ObjectNode schema = NODES.objectNode();
        schema.put("type", "object");
        ObjectNode properties = schema.putObject("properties");
        ArrayNode required = NODES.arrayNode();

        for (RecordComponent rc : type.getRecordComponents()) {
            Method accessor = rc.getAccessor();
            if (accessor.isAnnotationPresent(JsonIgnore.class)) continue;

            JsonProperty prop = accessor.getAnnotation(JsonProperty.class);
            String name = prop != null && !prop.value().isEmpty() ? prop.value() : rc.getName();

            ObjectNode property = typeOf(rc.getGenericType());
            JsonPropertyDescription description = accessor.getAnnotation(JsonPropertyDescription.class);
            if (description != null) {
                property.put("description", description.value());
            }
            properties.set(name, property);
            if (prop != null && prop.required()) {
                required.add(name);
            }
        }
        if (!required.isEmpty()) {
            schema.set("required", required);
        }
        return schema;
    }

    private static ObjectNode typeOf(Type type) {
        if (type instanceof ParameterizedType pt
                && pt.getRawType() instanceof Class<?> raw
                && Collection.class.isAssignableFrom(raw)) {
            ObjectNode array = NODES.objectNode();
            array.put("type", "array");
            array.set("items", typeOf(pt.getActualTypeArguments()[0]));
            return array;
        }
        ObjectNode node = NODES.objectNode();
        if (!(type instanceof Class<?> c)) {
            node.put("type", "object");
            return node;
        }
        if (c == String.class || c == Character.class || c == char.class) {
            node.put("type", "string");
        } else if (c == Integer.class || c == int.class || c == Long.class || c == long.class
                || c == Short.class || c == short.class) {
            node.put("type", "integer");
        } else if (c == Double.class || c == double.class || c == Float.class || c == float.class
                || Number.class.isAssignableFrom(c)) {
            node.put("type", "number");
        } else if (c == Boolean.class || c == boolean.class) {
            node.put("type", "boolean");
        } else if (c.isEnum()) {
            node.put("type", "string");
            ArrayNode values = node.putArray("enum");
            for (Object constant : c.getEnumConstants()) {
                values.add(((Enum<?>) constant).name());
            }
        } else if (c.isRecord()) {
            return schemaFor(c);
        } else if (c.isArray() || Collection.class.isAssignableFrom(c)) {
            node.put("type", "array");
        } else {
            node.put("type", "object");
        }
        return node;
    }
}
