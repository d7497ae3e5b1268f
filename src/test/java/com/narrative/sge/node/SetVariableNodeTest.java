package com.narrative.sge.node;

import static com.narrative.sge.node.VariableOperation.Type.*;
import static org.junit.Assert.*;

import com.narrative.sge.api.VariableType;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.store.MapVariableStore;

import java.util.List;
import java.util.Random;

import org.junit.Before;
import org.junit.Test;

public class SetVariableNodeTest {
    private SetVariableNode node;
    private ExecutionContext ctx;

    @Before
    public void setUp() {
        node = new SetVariableNode("set");
        ctx = new ExecutionContext(null, new MapVariableStore(), new Random(3));
    }

    @Test
    public void testSetParsesLiterals() {
        node.addOperation("gold", SET, "10")
                .addOperation("ratio", SET, "0.5")
                .addOperation("met", SET, "true")
                .addOperation("title", SET, "Sir");
        node.execute(ctx);

        assertEquals(10, ctx.getVariable("gold"));
        assertEquals(0.5f, ctx.getVariable("ratio"));
        assertEquals(true, ctx.getVariable("met"));
        assertEquals("Sir", ctx.getVariable("title"));
    }

    @Test
    public void testIntArithmeticStaysInt() {
        ctx.setVariable("gold", 10);
        node.addOperation("gold", ADD, "5")
                .addOperation("gold", SUBTRACT, "3")
                .addOperation("gold", MULTIPLY, "2");
        node.execute(ctx);

        assertEquals(24, ctx.getVariable("gold"));
        assertEquals(VariableType.INT, ctx.variableType("gold"));
    }

    @Test
    public void testMissingVariableCountsAsZero() {
        node.addOperation("kills", ADD, "1");
        node.execute(ctx);
        assertEquals(1, ctx.getVariable("kills"));
    }

    @Test
    public void testFractionalOperandPromotesToFloat() {
        ctx.setVariable("hp", 10);
        node.addOperation("hp", MULTIPLY, "1.5");
        node.execute(ctx);

        assertEquals(VariableType.FLOAT, ctx.variableType("hp"));
        assertEquals(15f, ctx.getFloat("hp", 0f), 1e-6f);
    }

    @Test
    public void testDivide() {
        ctx.setVariable("hp", 9);
        node.addOperation("hp", DIVIDE, "2");
        node.execute(ctx);
        assertEquals(4.5f, ctx.getFloat("hp", 0f), 1e-6f);
        assertEquals(VariableType.FLOAT, ctx.variableType("hp"));
    }

    @Test
    public void testDivideByZeroLeavesValue() {
        ctx.setVariable("hp", 9);
        node.addOperation("hp", DIVIDE, "0");
        node.execute(ctx);
        assertEquals(9, ctx.getVariable("hp"));
    }

    @Test
    public void testToggleAndAppend() {
        ctx.setVariable("door", true);
        ctx.setVariable("log", "a");
        node.addOperation("door", TOGGLE, null)
                .addOperation("fresh", TOGGLE, null)
                .addOperation("log", APPEND, "b")
                .addOperation("log", APPEND, "7");
        node.execute(ctx);

        assertEquals(false, ctx.getVariable("door"));
        assertEquals(true, ctx.getVariable("fresh"));
        assertEquals("ab7", ctx.getVariable("log"));
    }

    @Test
    public void testVariableReferenceOperand() {
        ctx.setVariable("bonus", 4);
        ctx.setVariable("gold", 1);
        node.addOperation("gold", ADD, "$bonus").addOperation("copy", SET, "$gold");
        node.execute(ctx);

        assertEquals(5, ctx.getVariable("gold"));
        assertEquals(5, ctx.getVariable("copy"));
        assertEquals(List.of("bonus", "gold"), node.referencedVariables());
    }

    @Test
    public void testUnusableOperandIsSkipped() {
        ctx.setVariable("gold", 3);
        node.addOperation("gold", ADD, "lots")
                .addOperation("gold", SET, "$nothing")
                .addOperation("gold", ADD, "1");
        node.execute(ctx);
        assertEquals(4, ctx.getVariable("gold"));
    }

    @Test
    public void testRandomIntIsInclusive() {
        node.addOperation("roll", RANDOM, "6,1");
        boolean sawLow = false;
        boolean sawHigh = false;
        for (int i = 0; i < 500; i++) {
            node.execute(ctx);
            int roll = ctx.getInt("roll", -1);
            assertTrue("roll " + roll, roll >= 1 && roll <= 6);
            sawLow |= roll == 1;
            sawHigh |= roll == 6;
        }
        assertTrue(sawLow && sawHigh);
        assertEquals(VariableType.INT, ctx.variableType("roll"));
    }

    @Test
    public void testRandomFloatRange() {
        ctx.setVariable("max", 2.0f);
        node.addOperation("chance", RANDOM, "0.5, $max");
        for (int i = 0; i < 200; i++) {
            node.execute(ctx);
            float v = ctx.getFloat("chance", -1f);
            assertTrue("value " + v, v >= 0.5f && v < 2.0f);
        }
        assertEquals(VariableType.FLOAT, ctx.variableType("chance"));
    }

    @Test
    public void testRandomWithoutRangeIsSkipped() {
        node.addOperation("roll", RANDOM, "6");
        node.execute(ctx);
        assertFalse(ctx.hasVariable("roll"));
    }

    @Test
    public void testOperationTypeNames() {
        assertEquals(SUBTRACT, VariableOperation.Type.fromString("subtract"));
        try {
            new VariableOperation("", SET, "1");
            fail("Expected empty variable to be rejected");
        } catch (IllegalArgumentException expected) {
            // ok
        }
    }
}
