package com.narrative.sge.api;

/**
 * Declared type of a story variable.
 *
 * The engine keeps one payload per variable slot, tagged with one of these
 * types. Values written through the boxed API are classified by
 * {@link #of(Object)}.
 */
public enum VariableType {
    STRING,
    FLOAT,
    INT,
    BOOL;

    /**
     * Classifies a boxed value. Floating point numbers map to FLOAT, integral
     * numbers to INT, booleans to BOOL and everything else to STRING.
     */
    public static VariableType of(Object value) {
        if (value instanceof Float || value instanceof Double)
            return FLOAT;
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte)
            return INT;
        if (value instanceof Boolean)
            return BOOL;
        return STRING;
    }

    /** Zero value for this type: "", 0f, 0 or false. */
    public Object zero() {
        return switch (this) {
            case STRING -> "";
            case FLOAT -> 0f;
            case INT -> 0;
            case BOOL -> Boolean.FALSE;
        };
    }

    public static VariableType fromString(String text) {
        for (VariableType t : values()) {
            if (t.name().equalsIgnoreCase(text)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown VariableType: " + text);
    }
}
