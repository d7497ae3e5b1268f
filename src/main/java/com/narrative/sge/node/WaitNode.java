package com.narrative.sge.node;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.api.NodeResult;
import com.narrative.sge.api.StoryCondition;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.util.Coercions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pauses the story: for a time, until the player advances, until a variable
 * condition holds, or until the next tick (FRAME).
 */
public class WaitNode extends StoryNode {

    public enum WaitType {
        TIME, INPUT, CONDITION, FRAME
    }

    private WaitType waitType = WaitType.TIME;
    private float waitTime = 1f;
    private String conditionVariable;
    private ConditionOperator conditionOperator = ConditionOperator.IS_TRUE;
    private String conditionValue;

    public WaitNode(String id) {
        super(id);
        addInputPort(INPUT_PORT, "Input");
        addOutputPort(NodeResult.DEFAULT_PORT, "Output");
    }

    @Override
    public String typeName() {
        return "Wait";
    }

    @Override
    public String category() {
        return "Flow";
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        return switch (waitType) {
            case TIME -> NodeResult.waitForSeconds(Math.max(0f, waitTime), NodeResult.DEFAULT_PORT);
            case INPUT -> NodeResult.waitForInput();
            case CONDITION -> {
                StoryCondition condition = condition();
                yield NodeResult.waitUntil(() -> condition.test(context.variables()), NodeResult.DEFAULT_PORT);
            }
            case FRAME -> NodeResult.waitForSeconds(0, NodeResult.DEFAULT_PORT);
        };
    }

    /** The configured condition with its compare value parsed as a literal. */
    public StoryCondition condition() {
        Object value = conditionValue == null || conditionValue.isEmpty() ? null
                : Coercions.parseLiteral(conditionValue);
        return new StoryCondition(conditionVariable, conditionOperator, value);
    }

    @Override
    public List<String> validate() {
        List<String> errors = super.validate();
        if (waitType == WaitType.CONDITION && (conditionVariable == null || conditionVariable.isEmpty()))
            errors.add("Condition wait has no variable");
        if (waitType == WaitType.TIME && waitTime < 0f)
            errors.add("Wait time " + waitTime + " is negative");
        return errors;
    }

    @Override
    public List<StoryCondition> authoredConditions() {
        if (waitType != WaitType.CONDITION || conditionVariable == null || conditionVariable.isEmpty())
            return Collections.emptyList();
        return Collections.singletonList(condition());
    }

    @Override
    public List<String> referencedVariables() {
        List<String> names = new ArrayList<>(1);
        if (waitType == WaitType.CONDITION && conditionVariable != null && !conditionVariable.isEmpty())
            names.add(conditionVariable);
        return names;
    }

    public WaitType waitType() {
        return waitType;
    }

    public void setWaitType(WaitType waitType) {
        this.waitType = waitType == null ? WaitType.TIME : waitType;
    }

    /** Seconds, for TIME waits. */
    public float waitTime() {
        return waitTime;
    }

    public void setWaitTime(float waitTime) {
        this.waitTime = waitTime;
    }

    public String conditionVariable() {
        return conditionVariable;
    }

    public void setConditionVariable(String conditionVariable) {
        this.conditionVariable = conditionVariable;
    }

    public ConditionOperator conditionOperator() {
        return conditionOperator;
    }

    public void setConditionOperator(ConditionOperator conditionOperator) {
        this.conditionOperator = conditionOperator == null ? ConditionOperator.IS_TRUE : conditionOperator;
    }

    public String conditionValue() {
        return conditionValue;
    }

    public void setConditionValue(String conditionValue) {
        this.conditionValue = conditionValue;
    }
}
