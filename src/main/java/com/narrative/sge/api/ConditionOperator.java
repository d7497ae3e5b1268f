package com.narrative.sge.api;

/**
 * Comparison operators available to authored conditions.
 *
 * There is no expression language: a condition is always
 * {@code variable OPERATOR compareValue}. IS_TRUE and IS_FALSE ignore the
 * compare value.
 */
public enum ConditionOperator {
    EQUALS,
    NOT_EQUALS,
    GREATER_THAN,
    LESS_THAN,
    GREATER_OR_EQUAL,
    LESS_OR_EQUAL,
    CONTAINS,
    IS_TRUE,
    IS_FALSE;

    /**
     * Parses an operator name. Accepts both {@code GREATER_THAN} and the
     * authoring-tool spelling {@code GreaterThan}.
     */
    public static ConditionOperator fromString(String text) {
        String normalized = text.replace("_", "");
        for (ConditionOperator op : values()) {
            if (op.name().replace("_", "").equalsIgnoreCase(normalized)) {
                return op;
            }
        }
        throw new IllegalArgumentException("Unknown ConditionOperator: " + text);
    }
}
