package com.signalwatch.reference.registry;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;

/** JSON value kinds a record type can demand for a payload field. */
public enum FieldType {
    STRING,
    NUMBER,
    BOOLEAN,
    OBJECT,
    ARRAY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Kind of a decoded JSON value, or {@code null} for JSON null. */
    public static FieldType of(Object value) {
        if (value instanceof CharSequence) return STRING;
        if (value instanceof Number) return NUMBER;
        if (value instanceof Boolean) return BOOLEAN;
        if (value instanceof Map<?, ?>) return OBJECT;
        if (value instanceof Collection<?> || (value != null && value.getClass().isArray())) return ARRAY;
        return value == null ? null : OBJECT;
    }
}
