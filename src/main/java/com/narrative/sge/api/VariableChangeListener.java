package com.narrative.sge.api;

/** Notified after a variable has been written. */
@FunctionalInterface
public interface VariableChangeListener {
    /**
     * @param name     variable name
     * @param oldValue previous boxed value, or null if the variable was absent
     * @param newValue value now stored
     */
    void onVariableChanged(String name, Object oldValue, Object newValue);
}
