package com.narrative.sge.node;

/**
 * One step of a {@link SetVariableNode}. The operand is a literal
 * ("5", "2.5", "true", "text"), a variable reference ("$gold"), or for RANDOM
 * a "min,max" range.
 */
public record VariableOperation(String variable, Type type, String operand) {

    public enum Type {
        SET, ADD, SUBTRACT, MULTIPLY, DIVIDE, TOGGLE, APPEND, RANDOM;

        public static Type fromString(String s) {
            for (Type t : values())
                if (t.name().equalsIgnoreCase(s))
                    return t;
            throw new IllegalArgumentException("Unknown variable operation: " + s);
        }
    }

    public VariableOperation {
        if (variable == null || variable.isEmpty())
            throw new IllegalArgumentException("Operation needs a variable name");
        if (type == null)
            throw new IllegalArgumentException("Operation needs a type");
    }

    @Override
    public String toString() {
        return variable + " " + type + (operand != null ? " " + operand : "");
    }
}
