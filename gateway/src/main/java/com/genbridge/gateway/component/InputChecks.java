package com.genbridge.gateway.component;

import java.util.List;

/**
 * Required-field checks for input records (called from compact constructors).
 */
public final class InputChecks {

    private InputChecks() {}

    public static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("'" + field + "' is required");
        }
        return value;
    }

    public static <T> List<T> requireNonEmpty(List<T> values, String field) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException("'" + field + "' needs at least one entry");
        }
        return List.copyOf(values);
    }
}
