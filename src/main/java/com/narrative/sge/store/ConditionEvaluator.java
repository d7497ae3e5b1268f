package com.narrative.sge.store;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.util.Coercions;

import lombok.extern.log4j.Log4j2;

/**
 * Condition semantics, one entry point per stored payload type.
 *
 * Both variable stores route through these methods so that a condition gives
 * the same answer regardless of the storage strategy. Evaluation is
 * fail-closed: a compare value that cannot be coerced to the stored type
 * yields false instead of an error.
 */
@Log4j2
public final class ConditionEvaluator {
    /** Absolute tolerance for EQUALS / NOT_EQUALS on FLOAT variables. */
    public static final double FLOAT_EPSILON = 1e-4;

    private ConditionEvaluator() {
        // Utility class
    }

    public static boolean evaluateInt(int value, ConditionOperator op, Object compareValue) {
        try {
            return switch (op) {
                case EQUALS -> value == Coercions.toDouble(compareValue);
                case NOT_EQUALS -> value != Coercions.toDouble(compareValue);
                case GREATER_THAN -> value > Coercions.toDouble(compareValue);
                case LESS_THAN -> value < Coercions.toDouble(compareValue);
                case GREATER_OR_EQUAL -> value >= Coercions.toDouble(compareValue);
                case LESS_OR_EQUAL -> value <= Coercions.toDouble(compareValue);
                case CONTAINS -> Integer.toString(value).contains(Coercions.toText(compareValue));
                case IS_TRUE -> value != 0;
                case IS_FALSE -> value == 0;
            };
        } catch (IllegalArgumentException e) {
            return mismatch(op, compareValue, e);
        }
    }

    public static boolean evaluateFloat(float value, ConditionOperator op, Object compareValue) {
        try {
            return switch (op) {
                case EQUALS -> Math.abs(value - Coercions.toDouble(compareValue)) < FLOAT_EPSILON;
                case NOT_EQUALS -> Math.abs(value - Coercions.toDouble(compareValue)) >= FLOAT_EPSILON;
                case GREATER_THAN -> value > Coercions.toDouble(compareValue);
                case LESS_THAN -> value < Coercions.toDouble(compareValue);
                case GREATER_OR_EQUAL -> value >= Coercions.toDouble(compareValue);
                case LESS_OR_EQUAL -> value <= Coercions.toDouble(compareValue);
                case CONTAINS -> Float.toString(value).contains(Coercions.toText(compareValue));
                case IS_TRUE -> value != 0f;
                case IS_FALSE -> value == 0f;
            };
        } catch (IllegalArgumentException e) {
            return mismatch(op, compareValue, e);
        }
    }

    public static boolean evaluateBool(boolean value, ConditionOperator op, Object compareValue) {
        try {
            return switch (op) {
                case EQUALS -> value == Coercions.toBool(compareValue);
                case NOT_EQUALS -> value != Coercions.toBool(compareValue);
                case CONTAINS -> Boolean.toString(value).contains(Coercions.toText(compareValue));
                case IS_TRUE -> value;
                case IS_FALSE -> !value;
                // Booleans have no ordering.
                case GREATER_THAN, LESS_THAN, GREATER_OR_EQUAL, LESS_OR_EQUAL -> false;
            };
        } catch (IllegalArgumentException e) {
            return mismatch(op, compareValue, e);
        }
    }

    public static boolean evaluateString(String value, ConditionOperator op, Object compareValue) {
        try {
            return switch (op) {
                case EQUALS -> value.equals(Coercions.toText(compareValue));
                case NOT_EQUALS -> !value.equals(Coercions.toText(compareValue));
                case GREATER_THAN -> Coercions.toDouble(value) > Coercions.toDouble(compareValue);
                case LESS_THAN -> Coercions.toDouble(value) < Coercions.toDouble(compareValue);
                case GREATER_OR_EQUAL -> Coercions.toDouble(value) >= Coercions.toDouble(compareValue);
                case LESS_OR_EQUAL -> Coercions.toDouble(value) <= Coercions.toDouble(compareValue);
                case CONTAINS -> value.contains(Coercions.toText(compareValue));
                case IS_TRUE -> Coercions.toBool(value);
                case IS_FALSE -> !Coercions.toBool(value);
            };
        } catch (IllegalArgumentException e) {
            return mismatch(op, compareValue, e);
        }
    }

    private static boolean mismatch(ConditionOperator op, Object compareValue, IllegalArgumentException e) {
        log.trace("Condition {} against {} failed closed: {}", op, compareValue, e.getMessage());
        return false;
    }
}
