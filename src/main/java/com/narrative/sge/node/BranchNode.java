package com.narrative.sge.node;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.api.StoryCondition;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Routes through "true" or "false" by combining its conditions with AND or
 * OR. An empty condition list routes through "true". Conditions on absent
 * variables are false.
 */
public class BranchNode extends StoryNode {
    public static final String TRUE_PORT = "true";
    public static final String FALSE_PORT = "false";

    public enum ConditionLogic {
        AND, OR
    }

    private final List<StoryCondition> conditions = new ArrayList<>();
    private ConditionLogic logic = ConditionLogic.AND;

    public BranchNode(String id) {
        super(id);
        addInputPort(INPUT_PORT, "Input");
        addOutputPort(TRUE_PORT, "True");
        addOutputPort(FALSE_PORT, "False");
    }

    @Override
    public String typeName() {
        return "Branch";
    }

    @Override
    public String category() {
        return "Flow";
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        return NodeResult.next(evaluate(context) ? TRUE_PORT : FALSE_PORT);
    }

    public boolean evaluate(ExecutionContext context) {
        if (conditions.isEmpty())
            return true;
        boolean any = false;
        for (StoryCondition c : conditions) {
            boolean r = c.test(context.variables());
            if (logic == ConditionLogic.AND && !r)
                return false;
            any |= r;
        }
        return logic == ConditionLogic.AND || any;
    }

    public BranchNode addCondition(StoryCondition condition) {
        if (condition == null)
            throw new IllegalArgumentException("condition must not be null");
        conditions.add(condition);
        return this;
    }

    public void clearConditions() {
        conditions.clear();
    }

    public List<StoryCondition> conditions() {
        return Collections.unmodifiableList(conditions);
    }

    @Override
    public List<StoryCondition> authoredConditions() {
        return conditions();
    }

    public ConditionLogic logic() {
        return logic;
    }

    public void setLogic(ConditionLogic logic) {
        this.logic = logic == null ? ConditionLogic.AND : logic;
    }

    @Override
    public List<String> validate() {
        List<String> errors = super.validate();
        for (int i = 0; i < conditions.size(); i++) {
            String variable = conditions.get(i).variable();
            if (variable == null || variable.isEmpty())
                errors.add("Condition " + i + " has no variable");
        }
        return errors;
    }

    @Override
    public List<String> referencedVariables() {
        List<String> names = new ArrayList<>(conditions.size());
        for (StoryCondition c : conditions)
            if (c.variable() != null && !c.variable().isEmpty())
                names.add(c.variable());
        return names;
    }
}
