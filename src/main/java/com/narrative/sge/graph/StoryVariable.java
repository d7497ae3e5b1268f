package com.narrative.sge.graph;

import com.narrative.sge.api.VariableType;
import com.narrative.sge.util.Coercions;

import java.util.Objects;

/**
 * Declaration of a graph variable: name, type and default value.
 *
 * Declarations are never mutated by execution; a run seeds its variable store
 * from them. The default is coerced to the declared type at construction.
 */
public final class StoryVariable {
    private final String name;
    private final VariableType type;
    private final Object defaultValue;
    private final String description;

    public StoryVariable(String name, VariableType type, Object defaultValue, String description) {
        if (name == null || name.isEmpty())
            throw new IllegalArgumentException("Variable name must not be empty");
        this.name = name;
        this.type = Objects.requireNonNull(type, "type");
        this.defaultValue = defaultValue == null ? type.zero() : normalize(name, type, defaultValue);
        this.description = description == null ? "" : description;
    }

    public StoryVariable(String name, VariableType type, Object defaultValue) {
        this(name, type, defaultValue, null);
    }

    public static StoryVariable ofInt(String name, int value) {
        return new StoryVariable(name, VariableType.INT, value);
    }

    public static StoryVariable ofFloat(String name, float value) {
        return new StoryVariable(name, VariableType.FLOAT, value);
    }

    public static StoryVariable ofBool(String name, boolean value) {
        return new StoryVariable(name, VariableType.BOOL, value);
    }

    public static StoryVariable ofString(String name, String value) {
        return new StoryVariable(name, VariableType.STRING, value);
    }

    public String name() {
        return name;
    }

    public VariableType type() {
        return type;
    }

    /** Default value boxed as Integer, Float, Boolean or String. */
    public Object defaultValue() {
        return defaultValue;
    }

    public String description() {
        return description;
    }

    private static Object normalize(String name, VariableType type, Object value) {
        try {
            return switch (type) {
                case INT -> Coercions.toInt(value);
                case FLOAT -> Coercions.toFloat(value);
                case BOOL -> Coercions.toBool(value);
                case STRING -> value.toString();
            };
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new IllegalArgumentException(
                    "Default '" + value + "' of " + type + " variable " + name + " is not convertible", e);
        }
    }

    @Override
    public String toString() {
        return name + ":" + type + "=" + defaultValue;
    }
}
