package com.narrative.sge.api;

import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;

/**
 * Lifecycle callbacks of a traversal run.
 *
 * This is the boundary with the presentation layer: a dialogue box subscribes
 * to node entry, reads the node's display data, and calls back into the engine
 * to resume input suspensions. Callbacks are invoked on the thread that drives
 * the engine (the thread calling {@code play} or {@code tick}), so they must
 * not block.
 *
 * Every method has an empty default so subscribers override only what they
 * need.
 */
public interface TraversalListener {

    /** A run has started on {@code graph}. */
    default void onStoryStart(StoryGraph graph) {
    }

    /** {@code node} became the current node and its enter hook has run. */
    default void onNodeEnter(StoryNode node) {
    }

    /** {@code node}'s exit hook has run. */
    default void onNodeExit(StoryNode node) {
    }

    /**
     * The run finished.
     *
     * @param success true when the run reached an End node or the context was
     *                marked complete; false for stops and dead ends.
     */
    default void onStoryEnd(StoryGraph graph, boolean success) {
    }

    /**
     * A runtime input error occurred (missing start node, unknown jump target,
     * unresolved graph, invalid selection). The host keeps running.
     */
    default void onError(String message) {
    }
}
