package com.narrative.sge.io;

import static org.junit.Assert.*;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.node.SetVariableNode;
import com.narrative.sge.node.WaitNode;

import java.util.ArrayList;
import java.util.Map;

import org.junit.Before;
import org.junit.Test;

public class NodeRegistryTest {
    private NodeRegistry registry;

    /** Node type defined outside the engine, as a host game would. */
    static class QuestNode extends StoryNode {
        final String questId;

        QuestNode(String id, String questId) {
            super(id);
            this.questId = questId;
            addInputPort(INPUT_PORT, "Input");
            addOutputPort(NodeResult.DEFAULT_PORT, "Output");
        }

        @Override
        public String typeName() {
            return "Quest";
        }

        @Override
        public String category() {
            return "Game";
        }

        @Override
        public NodeResult execute(ExecutionContext context) {
            context.setVariable("quest", questId);
            return NodeResult.next();
        }
    }

    @Before
    public void setUp() {
        registry = new NodeRegistry();
    }

    @Test
    public void testBuiltInsAreRegistered() {
        assertEquals(NodeType.values().length, registry.typeNames().size());
        assertTrue(registry.isRegistered("SetVariable"));
        assertTrue(registry.isRegistered("set_variable"));
        assertTrue(registry.isRegistered("CUTSCENE"));
        assertEquals(SetVariableNode.class, registry.getMetadata("setvariable").nodeClass());
        assertFalse(registry.isRegistered("Camera"));
        assertNull(registry.getMetadata(null));
    }

    @Test
    public void testCreateAppliesProperties() {
        StoryNode node = registry.create("Wait", "w", Map.of("waitType", "condition", "conditionVariable", "ready"));
        WaitNode wait = (WaitNode) node;
        assertEquals("w", wait.id());
        assertEquals(WaitNode.WaitType.CONDITION, wait.waitType());
        assertEquals("ready", wait.conditionVariable());
    }

    @Test
    public void testCreateWithNullProperties() {
        assertEquals(1f, ((WaitNode) registry.create("wait", "w", null)).waitTime(), 0f);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownType() {
        registry.create("Camera", "c", Map.of());
    }

    @Test
    public void testCustomFactoryThroughCompiler() {
        StoryGraphCompiler compiler = new StoryGraphCompiler(registry)
                .registerFactory("Quest", QuestNode.class,
                        (id, props) -> new QuestNode(id, StoryGraphCompiler.getString(props, "questId", "")));

        GraphDefinition.GraphInfo info = new GraphDefinition.GraphInfo();
        info.setId("q");
        info.setNodes(new ArrayList<>());
        GraphDefinition.NodeDef nd = new GraphDefinition.NodeDef();
        nd.setId("quest");
        nd.setType("quest");
        nd.setProperties(Map.of("questId", "dragon"));
        info.getNodes().add(nd);
        GraphDefinition def = new GraphDefinition();
        def.setGraph(info);

        StoryGraph graph = compiler.compile(def);
        assertEquals("dragon", ((QuestNode) graph.getNode("quest")).questId);
        assertTrue(registry.typeNames().contains("Quest"));
    }

    @Test
    public void testRegisterReplacesExisting() {
        registry.registerFactory("wait", WaitNode.class, (id, props) -> {
            WaitNode w = new WaitNode(id);
            w.setWaitTime(9f);
            return w;
        });
        assertEquals(9f, ((WaitNode) registry.create("Wait", "w", Map.of())).waitTime(), 0f);
        assertEquals(NodeType.values().length, registry.typeNames().size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testRegisterNeedsFactory() {
        registry.registerFactory("Quest", QuestNode.class, null);
    }
}
