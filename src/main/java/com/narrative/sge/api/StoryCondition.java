package com.narrative.sge.api;

import java.util.Objects;

/**
 * One authored condition: {@code variable operator compareValue}.
 *
 * @param variable     variable name
 * @param operator     comparison operator
 * @param compareValue right-hand side; ignored by IS_TRUE and IS_FALSE
 */
public record StoryCondition(String variable, ConditionOperator operator, Object compareValue) {

    public StoryCondition {
        Objects.requireNonNull(operator, "operator");
    }

    public static StoryCondition isTrue(String variable) {
        return new StoryCondition(variable, ConditionOperator.IS_TRUE, null);
    }

    /** Fail-closed evaluation against {@code store}. */
    public boolean test(VariableStore store) {
        if (variable == null || variable.isEmpty())
            return false;
        return store.evaluate(variable, operator, compareValue);
    }

    @Override
    public String toString() {
        return variable + " " + operator + (compareValue != null ? " " + compareValue : "");
    }
}
