package com.narrative.sge.engine;

import static org.junit.Assert.*;

import com.narrative.sge.graph.StoryConnection;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.graph.StoryPort;
import com.narrative.sge.node.ChoiceNode;
import com.narrative.sge.node.EndNode;
import com.narrative.sge.node.StartNode;

import org.junit.Test;

public class GraphLookupCacheTest {

    @Test
    public void testCacheAgreesWithGraph() {
        StoryGraph g = TestGraphs.threeChoices();
        GraphLookupCache cache = GraphLookupCache.build(g);

        assertEquals(g.nodes().size(), cache.nodeCount());
        assertEquals(g.connections().size(), cache.connectionCount());
        for (StoryNode n : g.nodes()) {
            assertSame(g.getNode(n.id()), cache.getNode(n.id()));
            for (StoryPort p : n.outputPorts()) {
                assertSame(g.getConnectionFromPort(n.id(), p.id()), cache.getConnectionFromPort(n.id(), p.id()));
                assertSame(g.getConnectedNode(n.id(), p.id()), cache.getConnectedNode(n.id(), p.id()));
            }
            assertEquals(g.getConnectionsFromNode(n.id()), cache.getConnectionsFromNode(n.id()));
            assertEquals(g.getConnectionsToNode(n.id()), cache.getConnectionsToNode(n.id()));
        }
        for (StoryConnection c : g.connections())
            assertSame(c, cache.getConnection(c.id()));
        assertSame(g.getStartNode(), cache.getStartNode());
    }

    @Test
    public void testAgreementOnLargeGraph() {
        // Enough ports to force probing in the port table.
        StoryGraph g = new StoryGraph("big", "Big");
        g.addNode(new StartNode("start"));
        ChoiceNode hub = new ChoiceNode("hub");
        g.addNode(hub);
        g.connect("start", "output", "hub", "input");
        for (int i = 0; i < 200; i++) {
            hub.addChoice("option " + i);
            g.addNode(new EndNode("end" + i));
            g.connect("hub", "choice_" + i, "end" + i, "input");
        }
        GraphLookupCache cache = GraphLookupCache.build(g);

        for (int i = 0; i < 200; i++)
            assertEquals("end" + i, cache.getConnectedNode("hub", "choice_" + i).id());
        assertNull(cache.getConnectedNode("hub", "choice_200"));
    }

    @Test
    public void testMissesReturnNullOrEmpty() {
        GraphLookupCache cache = GraphLookupCache.build(TestGraphs.linear());

        assertNull(cache.getNode("nope"));
        assertNull(cache.getNode(null));
        assertNull(cache.getConnection("nope"));
        assertNull(cache.getConnectionFromPort("start", "nope"));
        assertNull(cache.getConnectedNode("end", "output"));
        assertTrue(cache.getConnectionsFromNode("nope").isEmpty());
        assertTrue(cache.getConnectionsToNode("start").isEmpty());
    }

    @Test
    public void testNodesOfType() {
        GraphLookupCache cache = GraphLookupCache.build(TestGraphs.threeChoices());

        assertEquals(3, cache.getNodesOfType(EndNode.class).size());
        assertEquals(1, cache.getNodesOfType(ChoiceNode.class).size());
        assertEquals(5, cache.getNodesOfType(StoryNode.class).size());
    }

    @Test
    public void testStaleAfterEditAndRebuild() {
        StoryGraph g = TestGraphs.linear();
        GraphLookupCache cache = GraphLookupCache.build(g);
        assertFalse(cache.isStale());

        g.addNode(new EndNode("late"));
        assertTrue(cache.isStale());
        assertNull(cache.getNode("late"));

        GraphLookupCache fresh = cache.rebuild();
        assertFalse(fresh.isStale());
        assertNotNull(fresh.getNode("late"));
    }

    @Test
    public void testCachedListsAreReadOnly() {
        GraphLookupCache cache = GraphLookupCache.build(TestGraphs.linear());
        try {
            cache.getConnectionsFromNode("start").clear();
            fail("Expected an unmodifiable list");
        } catch (UnsupportedOperationException expected) {
            assertEquals(1, cache.getConnectionsFromNode("start").size());
        }
    }
}
