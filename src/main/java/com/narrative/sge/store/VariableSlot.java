package com.narrative.sge.store;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.api.VariableType;
import com.narrative.sge.util.Coercions;

/**
 * Mutable tagged union holding one variable's payload.
 *
 * Exactly one of the payload fields is meaningful, selected by {@link #type()}.
 * Writing through a typed setter changes the tag, so a slot can move between
 * types without being reallocated.
 *
 * The static {@code ...Of} helpers define the cross-type reads shared with
 * {@link ColumnarVariableStore}.
 */
public final class VariableSlot {
    private VariableType type = VariableType.STRING;
    private int intValue;
    private float floatValue;
    private boolean boolValue;
    private String stringValue = "";

    public VariableType type() {
        return type;
    }

    public void setInt(int value) {
        type = VariableType.INT;
        intValue = value;
        stringValue = null;
    }

    public void setFloat(float value) {
        type = VariableType.FLOAT;
        floatValue = value;
        stringValue = null;
    }

    public void setBool(boolean value) {
        type = VariableType.BOOL;
        boolValue = value;
        stringValue = null;
    }

    public void setString(String value) {
        type = VariableType.STRING;
        stringValue = value == null ? "" : value;
    }

    /** Stores a boxed value, choosing the tag with {@link VariableType#of(Object)}. */
    public void set(Object value) {
        switch (VariableType.of(value)) {
            case INT -> setInt(((Number) value).intValue());
            case FLOAT -> setFloat(((Number) value).floatValue());
            case BOOL -> setBool((Boolean) value);
            case STRING -> setString(value == null ? null : value.toString());
        }
    }

    public Object boxed() {
        return switch (type) {
            case INT -> intValue;
            case FLOAT -> floatValue;
            case BOOL -> boolValue;
            case STRING -> stringValue;
        };
    }

    public int asInt(int defaultValue) {
        return switch (type) {
            case INT -> intValue;
            case FLOAT -> intOf(floatValue);
            case BOOL -> intOf(boolValue);
            case STRING -> intOf(stringValue, defaultValue);
        };
    }

    public float asFloat(float defaultValue) {
        return switch (type) {
            case INT -> intValue;
            case FLOAT -> floatValue;
            case BOOL -> floatOf(boolValue);
            case STRING -> floatOf(stringValue, defaultValue);
        };
    }

    public boolean asBool(boolean defaultValue) {
        return switch (type) {
            case INT -> intValue != 0;
            case FLOAT -> floatValue != 0f;
            case BOOL -> boolValue;
            case STRING -> boolOf(stringValue, defaultValue);
        };
    }

    public String asString() {
        return switch (type) {
            case INT -> Integer.toString(intValue);
            case FLOAT -> Float.toString(floatValue);
            case BOOL -> Boolean.toString(boolValue);
            case STRING -> stringValue;
        };
    }

    public boolean evaluate(ConditionOperator op, Object compareValue) {
        return switch (type) {
            case INT -> ConditionEvaluator.evaluateInt(intValue, op, compareValue);
            case FLOAT -> ConditionEvaluator.evaluateFloat(floatValue, op, compareValue);
            case BOOL -> ConditionEvaluator.evaluateBool(boolValue, op, compareValue);
            case STRING -> ConditionEvaluator.evaluateString(stringValue, op, compareValue);
        };
    }

    @Override
    public String toString() {
        return type + ":" + asString();
    }

    static int intOf(float value) {
        return Math.round(value);
    }

    static int intOf(boolean value) {
        return value ? 1 : 0;
    }

    static int intOf(String value, int defaultValue) {
        try {
            return Coercions.toInt(value);
        } catch (IllegalArgumentException | ArithmeticException e) {
            return defaultValue;
        }
    }

    static float floatOf(boolean value) {
        return value ? 1f : 0f;
    }

    static float floatOf(String value, float defaultValue) {
        try {
            return Coercions.toFloat(value);
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }

    static boolean boolOf(String value, boolean defaultValue) {
        try {
            return Coercions.toBool(value);
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }
}
