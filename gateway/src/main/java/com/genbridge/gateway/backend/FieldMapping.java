package com.genbridge.gateway.backend;

import java.util.Objects;
import java.util.function.UnaryOperator;

/**
 * One row of a capability's payload table: where a uniform request field
 * lands in the provider payload.
 *
 * @param uniformField   JSON name of the field on the request record
 * @param providerField  name the provider expects
 * @param target         payload section the value is written to
 * @param transform      applied before writing; returning null drops the field
 */
public record FieldMapping(
        String              uniformField,
        String              providerField,
        Target              target,
        UnaryOperator<Object> transform) {

    public enum Target {
        /** {@code input.<providerField>} */
        INPUT,
        /** {@code parameters.<providerField>} */
        PARAMETERS,
        /** one {@code {<providerField>: value}} item of {@code input.messages[0].content}; lists expand to one item each */
        MESSAGE_CONTENT
    }

    public FieldMapping {
        Objects.requireNonNull(uniformField, "uniformField");
        Objects.requireNonNull(providerField, "providerField");
        Objects.requireNonNull(target, "target");
        transform = transform == null ? UnaryOperator.identity() : transform;
    }

    public static FieldMapping input(String field) {
        return new FieldMapping(field, field, Target.INPUT, null);
    }

    public static FieldMapping input(String uniformField, String providerField) {
        return new FieldMapping(uniformField, providerField, Target.INPUT, null);
    }

    public static FieldMapping parameter(String field) {
        return new FieldMapping(field, field, Target.PARAMETERS, null);
    }

    public static FieldMapping content(String uniformField, String contentKey) {
        return new FieldMapping(uniformField, contentKey, Target.MESSAGE_CONTENT, null);
    }

    public FieldMapping transformedBy(UnaryOperator<Object> op) {
        return new FieldMapping(uniformField, providerField, target, op);
    }
}
