package com.narrative.sge.store;

import static com.narrative.sge.api.ConditionOperator.*;
import static org.junit.Assert.*;

import org.junit.Test;

public class ConditionEvaluatorTest {

    @Test
    public void testIntComparisons() {
        assertTrue(ConditionEvaluator.evaluateInt(5, EQUALS, 5));
        assertTrue(ConditionEvaluator.evaluateInt(5, EQUALS, "5"));
        assertTrue(ConditionEvaluator.evaluateInt(5, EQUALS, 5.0f));
        assertFalse(ConditionEvaluator.evaluateInt(5, EQUALS, 5.5f));
        assertTrue(ConditionEvaluator.evaluateInt(5, GREATER_THAN, 4));
        assertTrue(ConditionEvaluator.evaluateInt(5, LESS_OR_EQUAL, 5));
        assertTrue(ConditionEvaluator.evaluateInt(0, IS_FALSE, null));
        assertTrue(ConditionEvaluator.evaluateInt(120, CONTAINS, "12"));
    }

    @Test
    public void testFloatEqualityUsesTolerance() {
        assertTrue(ConditionEvaluator.evaluateFloat(0.1f + 0.2f, EQUALS, 0.3));
        assertTrue(ConditionEvaluator.evaluateFloat(1.00005f, EQUALS, 1));
        assertFalse(ConditionEvaluator.evaluateFloat(1.001f, EQUALS, 1));
        assertTrue(ConditionEvaluator.evaluateFloat(1.001f, NOT_EQUALS, 1));
    }

    @Test
    public void testBoolHasNoOrdering() {
        assertTrue(ConditionEvaluator.evaluateBool(true, EQUALS, "TRUE"));
        assertTrue(ConditionEvaluator.evaluateBool(true, EQUALS, 1));
        assertFalse(ConditionEvaluator.evaluateBool(true, GREATER_THAN, false));
        assertFalse(ConditionEvaluator.evaluateBool(true, LESS_OR_EQUAL, true));
    }

    @Test
    public void testStringComparisons() {
        assertTrue(ConditionEvaluator.evaluateString("knight", EQUALS, "knight"));
        assertTrue(ConditionEvaluator.evaluateString("knight", CONTAINS, "nig"));
        assertTrue(ConditionEvaluator.evaluateString("10", GREATER_THAN, 9));
        assertTrue(ConditionEvaluator.evaluateString("true", IS_TRUE, null));
        assertFalse(ConditionEvaluator.evaluateString("knight", IS_TRUE, null));
        assertFalse(ConditionEvaluator.evaluateString("knight", IS_FALSE, null));
    }

    @Test
    public void testIncompatibleCompareValuesFailClosed() {
        assertFalse(ConditionEvaluator.evaluateInt(5, EQUALS, "five"));
        assertFalse(ConditionEvaluator.evaluateInt(5, NOT_EQUALS, "five"));
        assertFalse(ConditionEvaluator.evaluateInt(5, GREATER_THAN, null));
        assertFalse(ConditionEvaluator.evaluateFloat(1f, LESS_THAN, new Object()));
        assertFalse(ConditionEvaluator.evaluateBool(true, EQUALS, "yes"));
        assertFalse(ConditionEvaluator.evaluateString("abc", GREATER_THAN, 1));
        assertFalse(ConditionEvaluator.evaluateString("abc", EQUALS, null));
    }
}
