package com.narrative.sge.api;

import java.util.Map;

/**
 * Storage strategy for the live variables of one run.
 *
 * Two implementations exist: an associative store with one tagged slot per
 * name, and a typed columnar store keyed by name hash. Both must give the
 * same observable results for the operations below, given names whose hash
 * codes do not collide.
 *
 * Typed getters coerce across types (an INT read as a float, a STRING "true"
 * read as a bool) and fall back to the supplied default when the variable is
 * absent or the coercion fails.
 */
public interface VariableStore {

    boolean contains(String name);

    /** Declared type of the stored value, or null if absent. */
    VariableType typeOf(String name);

    /** Boxed current value, or null if absent. */
    Object get(String name);

    /**
     * Stores a boxed value, classifying it with {@link VariableType#of(Object)}.
     *
     * @return the previous boxed value, or null
     */
    Object put(String name, Object value);

    void putInt(String name, int value);

    void putFloat(String name, float value);

    void putBool(String name, boolean value);

    void putString(String name, String value);

    int getInt(String name, int defaultValue);

    float getFloat(String name, float defaultValue);

    boolean getBool(String name, boolean defaultValue);

    String getString(String name, String defaultValue);

    /** Fail-closed condition evaluation; absent variables yield false. */
    boolean evaluate(String name, ConditionOperator op, Object compareValue);

    boolean remove(String name);

    int size();

    void clear();

    /** Flat copy of every variable as name to boxed value. */
    Map<String, Object> snapshot();
}
