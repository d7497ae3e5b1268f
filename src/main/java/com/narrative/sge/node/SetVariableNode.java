package com.narrative.sge.node;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.api.VariableType;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.util.Coercions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import lombok.extern.log4j.Log4j2;

/**
 * Applies its variable operations in order, then continues.
 *
 * Arithmetic keeps INT when the variable is INT (or absent) and the operand
 * is an integer; otherwise the result is FLOAT. DIVIDE always yields FLOAT
 * and dividing by zero leaves the variable unchanged. RANDOM draws an
 * inclusive integer when both bounds are integers, else a float in
 * [min, max). An operation whose operand cannot be used is skipped.
 */
@Log4j2
public class SetVariableNode extends StoryNode {
    private final List<VariableOperation> operations = new ArrayList<>();

    public SetVariableNode(String id) {
        super(id);
        addInputPort(INPUT_PORT, "Input");
        addOutputPort(NodeResult.DEFAULT_PORT, "Output");
    }

    @Override
    public String typeName() {
        return "SetVariable";
    }

    @Override
    public String category() {
        return "Logic";
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        for (VariableOperation op : operations)
            apply(op, context);
        return NodeResult.next();
    }

    private void apply(VariableOperation op, ExecutionContext context) {
        String name = op.variable();
        if (op.type() == VariableOperation.Type.TOGGLE) {
            context.setVariable(name, !context.getBool(name, false));
            return;
        }
        if (op.type() == VariableOperation.Type.RANDOM) {
            randomize(op, context);
            return;
        }
        Object value = resolveOperand(op.operand(), context);
        if (value == null) {
            log.warn("Skipping {} at {}: operand '{}' has no value", op, this, op.operand());
            return;
        }
        try {
            switch (op.type()) {
                case SET -> context.setVariable(name, value);
                case ADD -> arithmetic(context, name, value, Double::sum);
                case SUBTRACT -> arithmetic(context, name, value, (a, b) -> a - b);
                case MULTIPLY -> arithmetic(context, name, value, (a, b) -> a * b);
                case DIVIDE -> {
                    double divisor = Coercions.toDouble(value);
                    if (divisor == 0d) {
                        log.debug("Division by zero ignored for {} at {}", name, this);
                        return;
                    }
                    context.setVariable(name, (float) (context.getFloat(name, 0f) / divisor));
                }
                case APPEND -> context.setVariable(name, context.getString(name, "") + Coercions.toText(value));
                default -> throw new IllegalStateException("Unhandled operation " + op.type());
            }
        } catch (IllegalArgumentException e) {
            log.warn("Skipping {} at {}: {}", op, this, e.getMessage());
        }
    }

    private interface DoubleOp {
        double apply(double a, double b);
    }

    private static void arithmetic(ExecutionContext context, String name, Object operand, DoubleOp op) {
        double rhs = Coercions.toDouble(operand);
        VariableType current = context.variableType(name);
        boolean intResult = (current == null || current == VariableType.INT)
                && VariableType.of(operand) == VariableType.INT;
        if (intResult) {
            context.setVariable(name, (int) op.apply(context.getInt(name, 0), rhs));
        } else {
            context.setVariable(name, (float) op.apply(context.getFloat(name, 0f), rhs));
        }
    }

    private void randomize(VariableOperation op, ExecutionContext context) {
        String range = op.operand();
        int comma = range == null ? -1 : range.indexOf(',');
        if (comma < 0) {
            log.warn("Skipping {} at {}: expected 'min,max'", op, this);
            return;
        }
        Object min = resolveOperand(range.substring(0, comma).trim(), context);
        Object max = resolveOperand(range.substring(comma + 1).trim(), context);
        Random random = context.random();
        try {
            if (VariableType.of(min) == VariableType.INT && VariableType.of(max) == VariableType.INT) {
                int lo = Coercions.toInt(min);
                int hi = Coercions.toInt(max);
                if (hi < lo) {
                    int t = lo;
                    lo = hi;
                    hi = t;
                }
                context.setVariable(op.variable(), lo + (int) (random.nextDouble() * ((long) hi - lo + 1)));
            } else {
                float lo = Coercions.toFloat(min);
                float hi = Coercions.toFloat(max);
                context.setVariable(op.variable(), lo + random.nextFloat() * (hi - lo));
            }
        } catch (IllegalArgumentException e) {
            log.warn("Skipping {} at {}: {}", op, this, e.getMessage());
        }
    }

    /** "$name" reads a variable; anything else is parsed as a literal. */
    static Object resolveOperand(String operand, ExecutionContext context) {
        if (operand == null)
            return null;
        if (operand.startsWith("$") && operand.length() > 1)
            return context.getVariable(operand.substring(1));
        return Coercions.parseLiteral(operand);
    }

    public SetVariableNode addOperation(VariableOperation operation) {
        if (operation == null)
            throw new IllegalArgumentException("operation must not be null");
        operations.add(operation);
        return this;
    }

    public SetVariableNode addOperation(String variable, VariableOperation.Type type, String operand) {
        return addOperation(new VariableOperation(variable, type, operand));
    }

    public List<VariableOperation> operations() {
        return Collections.unmodifiableList(operations);
    }

    @Override
    public List<String> referencedVariables() {
        List<String> names = new ArrayList<>();
        for (VariableOperation op : operations) {
            String operand = op.operand();
            if (operand != null && operand.startsWith("$") && operand.length() > 1)
                names.add(operand.substring(1));
        }
        return names;
    }
}
