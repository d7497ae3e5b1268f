package com.narrative.sge.store;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.api.VariableStore;
import com.narrative.sge.api.VariableType;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Associative variable store: one {@link VariableSlot} per name.
 *
 * Names share a single key space, so writing a name with a different type
 * retags the existing slot. Iteration (and therefore {@link #snapshot()})
 * follows first-insertion order.
 */
public final class MapVariableStore implements VariableStore {
    private final Map<String, VariableSlot> slots = new LinkedHashMap<>();

    @Override
    public boolean contains(String name) {
        return slots.containsKey(name);
    }

    @Override
    public VariableType typeOf(String name) {
        VariableSlot slot = slots.get(name);
        return slot == null ? null : slot.type();
    }

    @Override
    public Object get(String name) {
        VariableSlot slot = slots.get(name);
        return slot == null ? null : slot.boxed();
    }

    @Override
    public Object put(String name, Object value) {
        VariableSlot slot = slots.get(name);
        Object previous = slot == null ? null : slot.boxed();
        slot(name).set(value);
        return previous;
    }

    @Override
    public void putInt(String name, int value) {
        slot(name).setInt(value);
    }

    @Override
    public void putFloat(String name, float value) {
        slot(name).setFloat(value);
    }

    @Override
    public void putBool(String name, boolean value) {
        slot(name).setBool(value);
    }

    @Override
    public void putString(String name, String value) {
        slot(name).setString(value);
    }

    @Override
    public int getInt(String name, int defaultValue) {
        VariableSlot slot = slots.get(name);
        return slot == null ? defaultValue : slot.asInt(defaultValue);
    }

    @Override
    public float getFloat(String name, float defaultValue) {
        VariableSlot slot = slots.get(name);
        return slot == null ? defaultValue : slot.asFloat(defaultValue);
    }

    @Override
    public boolean getBool(String name, boolean defaultValue) {
        VariableSlot slot = slots.get(name);
        return slot == null ? defaultValue : slot.asBool(defaultValue);
    }

    @Override
    public String getString(String name, String defaultValue) {
        VariableSlot slot = slots.get(name);
        return slot == null ? defaultValue : slot.asString();
    }

    @Override
    public boolean evaluate(String name, ConditionOperator op, Object compareValue) {
        VariableSlot slot = slots.get(name);
        return slot != null && slot.evaluate(op, compareValue);
    }

    @Override
    public boolean remove(String name) {
        return slots.remove(name) != null;
    }

    @Override
    public int size() {
        return slots.size();
    }

    @Override
    public void clear() {
        slots.clear();
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> copy = new LinkedHashMap<>(slots.size() * 2);
        for (var entry : slots.entrySet())
            copy.put(entry.getKey(), entry.getValue().boxed());
        return copy;
    }

    private VariableSlot slot(String name) {
        if (name == null)
            throw new IllegalArgumentException("Variable name must not be null");
        return slots.computeIfAbsent(name, k -> new VariableSlot());
    }
}
