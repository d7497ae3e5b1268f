package com.narrative.sge.store;

import static org.junit.Assert.*;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.api.VariableStore;
import com.narrative.sge.api.VariableType;

import java.util.Random;

import org.junit.Test;

/** Drives both store strategies with the same operations and compares every observable result. */
public class VariableStoreEquivalenceTest {

    private static final String[] NAMES = { "gold", "hp", "name", "flag", "ratio", "quest_stage", "door_open",
            "npc_mood", "x", "y" };
    private static final Object[] VALUES = { 0, 1, -7, 42, 2.5f, 0f, 1e-5f, true, false, "", "12", "3.5",
            "true", "FALSE", "dragon", 100L, 3.0d };

    @Test
    public void testRandomOperationsAgree() {
        VariableStore map = new MapVariableStore();
        VariableStore columnar = new ColumnarVariableStore(4);
        Random rnd = new Random(1234);

        for (int step = 0; step < 5_000; step++) {
            String name = NAMES[rnd.nextInt(NAMES.length)];
            switch (rnd.nextInt(6)) {
                case 0, 1 -> {
                    Object v = VALUES[rnd.nextInt(VALUES.length)];
                    assertEquals("put " + name + "=" + v, map.put(name, v), columnar.put(name, v));
                }
                case 2 -> assertEquals(map.remove(name), columnar.remove(name));
                case 3 -> {
                    int i = rnd.nextInt(100);
                    map.putInt(name, i);
                    columnar.putInt(name, i);
                }
                case 4 -> {
                    boolean b = rnd.nextBoolean();
                    map.putBool(name, b);
                    columnar.putBool(name, b);
                }
                default -> {
                    ConditionOperator op = ConditionOperator.values()[rnd.nextInt(ConditionOperator.values().length)];
                    Object cmp = VALUES[rnd.nextInt(VALUES.length)];
                    assertEquals(name + " " + op + " " + cmp, map.evaluate(name, op, cmp),
                            columnar.evaluate(name, op, cmp));
                }
            }
            assertSameView(map, columnar, name);
        }
        assertEquals(map.snapshot(), columnar.snapshot());
    }

    private static void assertSameView(VariableStore a, VariableStore b, String name) {
        assertEquals(a.size(), b.size());
        assertEquals(a.contains(name), b.contains(name));
        assertEquals(a.typeOf(name), b.typeOf(name));
        assertEquals(a.get(name), b.get(name));
        assertEquals(a.getInt(name, -99), b.getInt(name, -99));
        assertEquals(a.getFloat(name, -99f), b.getFloat(name, -99f), 0f);
        assertEquals(a.getBool(name, true), b.getBool(name, true));
        assertEquals(a.getString(name, "none"), b.getString(name, "none"));
    }

    @Test
    public void testCrossTypeReads() {
        for (VariableStore s : new VariableStore[] { new MapVariableStore(), new ColumnarVariableStore() }) {
            s.putFloat("f", 2.6f);
            s.putString("n", "17");
            s.putString("w", "word");
            s.putBool("b", true);

            assertEquals(3, s.getInt("f", 0));
            assertEquals(17, s.getInt("n", 0));
            assertEquals(5, s.getInt("w", 5));
            assertEquals(1f, s.getFloat("b", 0f), 0f);
            assertTrue(s.getBool("f", false));
            assertEquals("true", s.getString("b", null));
            assertEquals(VariableType.STRING, s.typeOf("n"));
        }
    }

    @Test
    public void testRetypingReplacesValue() {
        for (VariableStore s : new VariableStore[] { new MapVariableStore(), new ColumnarVariableStore() }) {
            s.putInt("v", 3);
            Object previous = s.put("v", "three");

            assertEquals(3, previous);
            assertEquals(VariableType.STRING, s.typeOf("v"));
            assertEquals(1, s.size());
            assertEquals("three", s.get("v"));
        }
    }
}
