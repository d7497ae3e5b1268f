package com.narrative.sge.node;

/**
 * One option of a {@link ChoiceNode}. Its id doubles as the id of the output
 * port the option leads through.
 */
public final class Choice {
    private final String id;
    private String text;
    private String localizedKey = "";
    private String conditionVariable;
    private String setVariable;
    private Object setValue;

    public Choice(String id, String text) {
        if (id == null || id.isEmpty())
            throw new IllegalArgumentException("Choice id must not be empty");
        this.id = id;
        this.text = text == null ? "" : text;
    }

    public String id() {
        return id;
    }

    public String text() {
        return text;
    }

    public void setText(String text) {
        this.text = text == null ? "" : text;
    }

    public String localizedKey() {
        return localizedKey;
    }

    public void setLocalizedKey(String localizedKey) {
        this.localizedKey = localizedKey;
    }

    /** Boolean variable gating availability; null or empty means always available. */
    public String conditionVariable() {
        return conditionVariable;
    }

    public Choice setConditionVariable(String conditionVariable) {
        this.conditionVariable = conditionVariable;
        return this;
    }

    /** Variable assigned {@link #setValue()} when this option is selected. */
    public String setVariable() {
        return setVariable;
    }

    public Object setValue() {
        return setValue;
    }

    public Choice setsVariable(String variable, Object value) {
        this.setVariable = variable;
        this.setValue = value;
        return this;
    }

    @Override
    public String toString() {
        return "Choice[" + id + ": " + text + "]";
    }
}
