package com.narrative.sge.util;

import static org.junit.Assert.*;

import com.narrative.sge.api.TraversalListener;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.node.DialogueNode;

import java.util.ArrayList;
import java.util.List;

import org.junit.Before;
import org.junit.Test;

public class CompositeTraversalListenerTest {
    private CompositeTraversalListener composite;
    private List<String> calls;

    @Before
    public void setUp() {
        composite = new CompositeTraversalListener();
        calls = new ArrayList<>();
    }

    @Test
    public void testFansOutInRegistrationOrder() {
        composite.add(recorder("a"));
        composite.add(recorder("b"));

        StoryGraph graph = new StoryGraph("g", "G");
        composite.onStoryStart(graph);
        composite.onNodeEnter(new DialogueNode("d"));
        composite.onStoryEnd(graph, true);

        assertEquals(List.of("a:start", "b:start", "a:enter:d", "b:enter:d", "a:end:true", "b:end:true"), calls);
    }

    @Test
    public void testThrowingListenerDoesNotStopOthers() {
        composite.add(new TraversalListener() {
            @Override
            public void onNodeEnter(StoryNode node) {
                throw new IllegalStateException("listener bug");
            }
        });
        composite.add(recorder("ok"));

        composite.onNodeEnter(new DialogueNode("d"));

        assertEquals(List.of("ok:enter:d"), calls);
    }

    @Test
    public void testRemoveDuringCallback() {
        TraversalListener[] self = new TraversalListener[1];
        self[0] = new TraversalListener() {
            @Override
            public void onError(String message) {
                calls.add("once:" + message);
                composite.remove(self[0]);
            }
        };
        composite.add(self[0]);
        composite.add(recorder("b"));

        composite.onError("x");
        composite.onError("y");

        assertEquals(List.of("once:x", "b:error:x", "b:error:y"), calls);
        assertEquals(1, composite.size());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNullListenerRejected() {
        composite.add(null);
    }

    private TraversalListener recorder(String tag) {
        return new TraversalListener() {
            @Override
            public void onStoryStart(StoryGraph graph) {
                calls.add(tag + ":start");
            }

            @Override
            public void onNodeEnter(StoryNode node) {
                calls.add(tag + ":enter:" + node.id());
            }

            @Override
            public void onStoryEnd(StoryGraph graph, boolean success) {
                calls.add(tag + ":end:" + success);
            }

            @Override
            public void onError(String message) {
                calls.add(tag + ":error:" + message);
            }
        };
    }
}
