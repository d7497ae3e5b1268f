package com.narrative.sge.store;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.api.VariableStore;
import com.narrative.sge.api.VariableType;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Columnar variable store: one open-addressed table per variable type.
 *
 * Each column maps {@code String.hashCode()} of a variable name to a slot in a
 * primitive array (float[], int[], boolean[]) or a String[]. Reads and writes
 * of a variable in its own type touch only int and primitive arrays, so the hot
 * path never boxes.
 *
 * Invariants:
 * - A name lives in at most one column; writing it in one column evicts it
 * from the other three.
 * - Keys are hash codes, not names. Two different names with the same hash
 * code share a slot and overwrite each other. This is an accepted risk of the
 * layout; the map store has no such limitation.
 *
 * Probing is linear. Deleted slots become tombstones and are dropped on the
 * next resize.
 */
public final class ColumnarVariableStore implements VariableStore {
    private static final int DEFAULT_CAPACITY = 16;

    private final Column floats;
    private final Column ints;
    private final Column bools;
    private final Column strings;
    private final Column[] columns;

    public ColumnarVariableStore() {
        this(DEFAULT_CAPACITY);
    }

    public ColumnarVariableStore(int initialCapacity) {
        int capacity = Integer.highestOneBit(Math.max(8, initialCapacity - 1) << 1);
        floats = new Column(VariableType.FLOAT, capacity);
        ints = new Column(VariableType.INT, capacity);
        bools = new Column(VariableType.BOOL, capacity);
        strings = new Column(VariableType.STRING, capacity);
        columns = new Column[] { floats, ints, bools, strings };
    }

    @Override
    public boolean contains(String name) {
        return typeOf(name) != null;
    }

    @Override
    public VariableType typeOf(String name) {
        if (name == null)
            return null;
        int hash = name.hashCode();
        for (Column c : columns)
            if (c.find(hash) >= 0)
                return c.type;
        return null;
    }

    @Override
    public Object get(String name) {
        if (name == null)
            return null;
        int hash = name.hashCode();
        int i;
        if ((i = floats.find(hash)) >= 0)
            return floats.floatValues[i];
        if ((i = ints.find(hash)) >= 0)
            return ints.intValues[i];
        if ((i = bools.find(hash)) >= 0)
            return bools.boolValues[i];
        if ((i = strings.find(hash)) >= 0)
            return strings.stringValues[i];
        return null;
    }

    @Override
    public Object put(String name, Object value) {
        Object previous = get(name);
        switch (VariableType.of(value)) {
            case INT -> putInt(name, ((Number) value).intValue());
            case FLOAT -> putFloat(name, ((Number) value).floatValue());
            case BOOL -> putBool(name, (Boolean) value);
            case STRING -> putString(name, value == null ? null : value.toString());
        }
        return previous;
    }

    @Override
    public void putInt(String name, int value) {
        int i = claim(ints, name);
        ints.intValues[i] = value;
    }

    @Override
    public void putFloat(String name, float value) {
        int i = claim(floats, name);
        floats.floatValues[i] = value;
    }

    @Override
    public void putBool(String name, boolean value) {
        int i = claim(bools, name);
        bools.boolValues[i] = value;
    }

    @Override
    public void putString(String name, String value) {
        int i = claim(strings, name);
        strings.stringValues[i] = value == null ? "" : value;
    }

    @Override
    public int getInt(String name, int defaultValue) {
        if (name == null)
            return defaultValue;
        int hash = name.hashCode();
        int i;
        if ((i = ints.find(hash)) >= 0)
            return ints.intValues[i];
        if ((i = floats.find(hash)) >= 0)
            return VariableSlot.intOf(floats.floatValues[i]);
        if ((i = bools.find(hash)) >= 0)
            return VariableSlot.intOf(bools.boolValues[i]);
        if ((i = strings.find(hash)) >= 0)
            return VariableSlot.intOf(strings.stringValues[i], defaultValue);
        return defaultValue;
    }

    @Override
    public float getFloat(String name, float defaultValue) {
        if (name == null)
            return defaultValue;
        int hash = name.hashCode();
        int i;
        if ((i = floats.find(hash)) >= 0)
            return floats.floatValues[i];
        if ((i = ints.find(hash)) >= 0)
            return ints.intValues[i];
        if ((i = bools.find(hash)) >= 0)
            return VariableSlot.floatOf(bools.boolValues[i]);
        if ((i = strings.find(hash)) >= 0)
            return VariableSlot.floatOf(strings.stringValues[i], defaultValue);
        return defaultValue;
    }

    @Override
    public boolean getBool(String name, boolean defaultValue) {
        if (name == null)
            return defaultValue;
        int hash = name.hashCode();
        int i;
        if ((i = bools.find(hash)) >= 0)
            return bools.boolValues[i];
        if ((i = ints.find(hash)) >= 0)
            return ints.intValues[i] != 0;
        if ((i = floats.find(hash)) >= 0)
            return floats.floatValues[i] != 0f;
        if ((i = strings.find(hash)) >= 0)
            return VariableSlot.boolOf(strings.stringValues[i], defaultValue);
        return defaultValue;
    }

    @Override
    public String getString(String name, String defaultValue) {
        if (name == null)
            return defaultValue;
        int hash = name.hashCode();
        int i;
        if ((i = strings.find(hash)) >= 0)
            return strings.stringValues[i];
        if ((i = ints.find(hash)) >= 0)
            return Integer.toString(ints.intValues[i]);
        if ((i = floats.find(hash)) >= 0)
            return Float.toString(floats.floatValues[i]);
        if ((i = bools.find(hash)) >= 0)
            return Boolean.toString(bools.boolValues[i]);
        return defaultValue;
    }

    @Override
    public boolean evaluate(String name, ConditionOperator op, Object compareValue) {
        if (name == null)
            return false;
        int hash = name.hashCode();
        int i;
        if ((i = floats.find(hash)) >= 0)
            return ConditionEvaluator.evaluateFloat(floats.floatValues[i], op, compareValue);
        if ((i = ints.find(hash)) >= 0)
            return ConditionEvaluator.evaluateInt(ints.intValues[i], op, compareValue);
        if ((i = bools.find(hash)) >= 0)
            return ConditionEvaluator.evaluateBool(bools.boolValues[i], op, compareValue);
        if ((i = strings.find(hash)) >= 0)
            return ConditionEvaluator.evaluateString(strings.stringValues[i], op, compareValue);
        return false;
    }

    @Override
    public boolean remove(String name) {
        if (name == null)
            return false;
        int hash = name.hashCode();
        boolean removed = false;
        for (Column c : columns)
            removed |= c.remove(hash);
        return removed;
    }

    @Override
    public int size() {
        int n = 0;
        for (Column c : columns)
            n += c.size;
        return n;
    }

    @Override
    public void clear() {
        for (Column c : columns)
            c.clear();
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> copy = new LinkedHashMap<>(size() * 2);
        for (Column c : columns) {
            for (int i = 0; i < c.state.length; i++) {
                if (c.state[i] != Column.USED)
                    continue;
                copy.put(c.names[i], switch (c.type) {
                    case FLOAT -> c.floatValues[i];
                    case INT -> c.intValues[i];
                    case BOOL -> c.boolValues[i];
                    case STRING -> c.stringValues[i];
                });
            }
        }
        return copy;
    }

    /**
     * Evicts {@code name} from every other column and returns its slot in
     * {@code target}. The insert may reallocate the target's arrays, so read
     * the value array only after this returns.
     */
    private int claim(Column target, String name) {
        if (name == null)
            throw new IllegalArgumentException("Variable name must not be null");
        int hash = name.hashCode();
        for (Column c : columns)
            if (c != target)
                c.remove(hash);
        return target.insert(hash, name);
    }

    /** One open-addressed table; only the value array of its own type is allocated. */
    private static final class Column {
        static final byte EMPTY = 0;
        static final byte USED = 1;
        static final byte DELETED = 2;

        final VariableType type;
        int[] keys;
        byte[] state;
        String[] names;
        float[] floatValues;
        int[] intValues;
        boolean[] boolValues;
        String[] stringValues;
        int size;
        int tombstones;

        Column(VariableType type, int capacity) {
            this.type = type;
            allocate(capacity);
        }

        private void allocate(int capacity) {
            keys = new int[capacity];
            state = new byte[capacity];
            names = new String[capacity];
            switch (type) {
                case FLOAT -> floatValues = new float[capacity];
                case INT -> intValues = new int[capacity];
                case BOOL -> boolValues = new boolean[capacity];
                case STRING -> stringValues = new String[capacity];
            }
            size = 0;
            tombstones = 0;
        }

        int find(int hash) {
            int mask = keys.length - 1;
            int i = mix(hash) & mask;
            for (int probes = 0; probes < keys.length; probes++) {
                byte s = state[i];
                if (s == EMPTY)
                    return -1;
                if (s == USED && keys[i] == hash)
                    return i;
                i = (i + 1) & mask;
            }
            return -1;
        }

        int insert(int hash, String name) {
            int existing = find(hash);
            if (existing >= 0) {
                names[existing] = name;
                return existing;
            }
            if ((size + tombstones + 1) * 2 > keys.length)
                resize(size * 2 + 2 > keys.length ? keys.length << 1 : keys.length);
            int mask = keys.length - 1;
            int i = mix(hash) & mask;
            while (state[i] == USED)
                i = (i + 1) & mask;
            if (state[i] == DELETED)
                tombstones--;
            state[i] = USED;
            keys[i] = hash;
            names[i] = name;
            size++;
            return i;
        }

        boolean remove(int hash) {
            int i = find(hash);
            if (i < 0)
                return false;
            state[i] = DELETED;
            names[i] = null;
            if (stringValues != null)
                stringValues[i] = null;
            size--;
            tombstones++;
            return true;
        }

        void clear() {
            Arrays.fill(state, EMPTY);
            Arrays.fill(names, null);
            if (stringValues != null)
                Arrays.fill(stringValues, null);
            size = 0;
            tombstones = 0;
        }

        private void resize(int capacity) {
            int[] oldKeys = keys;
            byte[] oldState = state;
            String[] oldNames = names;
            float[] oldFloats = floatValues;
            int[] oldInts = intValues;
            boolean[] oldBools = boolValues;
            String[] oldStrings = stringValues;

            allocate(capacity);
            for (int j = 0; j < oldKeys.length; j++) {
                if (oldState[j] != USED)
                    continue;
                int i = insert(oldKeys[j], oldNames[j]);
                switch (type) {
                    case FLOAT -> floatValues[i] = oldFloats[j];
                    case INT -> intValues[i] = oldInts[j];
                    case BOOL -> boolValues[i] = oldBools[j];
                    case STRING -> stringValues[i] = oldStrings[j];
                }
            }
        }

        private static int mix(int hash) {
            return hash ^ (hash >>> 16);
        }
    }
}
