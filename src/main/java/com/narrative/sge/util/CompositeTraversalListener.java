package com.narrative.sge.util;

import com.narrative.sge.api.TraversalListener;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Fans {@link TraversalListener} callbacks out to every registered listener.
 *
 * Iteration works on an array snapshot, so listeners may register or remove
 * listeners from inside a callback. A listener that throws is logged through
 * an {@link ErrorRateLimiter} and the remaining listeners still run.
 */
public class CompositeTraversalListener implements TraversalListener {
    private static final Logger log = LogManager.getLogger(CompositeTraversalListener.class);

    private final ErrorRateLimiter errors = new ErrorRateLimiter(log, 1_000);
    private volatile TraversalListener[] listeners = new TraversalListener[0];

    public synchronized void add(TraversalListener listener) {
        if (listener == null)
            throw new IllegalArgumentException("Listener must not be null");
        TraversalListener[] old = listeners;
        TraversalListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        listeners = next;
    }

    public synchronized boolean remove(TraversalListener listener) {
        TraversalListener[] old = listeners;
        for (int i = 0; i < old.length; i++) {
            if (old[i] == listener) {
                TraversalListener[] next = new TraversalListener[old.length - 1];
                System.arraycopy(old, 0, next, 0, i);
                System.arraycopy(old, i + 1, next, i, old.length - i - 1);
                listeners = next;
                return true;
            }
        }
        return false;
    }

    public int size() {
        return listeners.length;
    }

    @Override
    public void onStoryStart(StoryGraph graph) {
        for (TraversalListener l : listeners) {
            try {
                l.onStoryStart(graph);
            } catch (RuntimeException e) {
                errors.log("Listener failed in onStoryStart", e);
            }
        }
    }

    @Override
    public void onNodeEnter(StoryNode node) {
        for (TraversalListener l : listeners) {
            try {
                l.onNodeEnter(node);
            } catch (RuntimeException e) {
                errors.log("Listener failed in onNodeEnter(" + node.id() + ")", e);
            }
        }
    }

    @Override
    public void onNodeExit(StoryNode node) {
        for (TraversalListener l : listeners) {
            try {
                l.onNodeExit(node);
            } catch (RuntimeException e) {
                errors.log("Listener failed in onNodeExit(" + node.id() + ")", e);
            }
        }
    }

    @Override
    public void onStoryEnd(StoryGraph graph, boolean success) {
        for (TraversalListener l : listeners) {
            try {
                l.onStoryEnd(graph, success);
            } catch (RuntimeException e) {
                errors.log("Listener failed in onStoryEnd", e);
            }
        }
    }

    @Override
    public void onError(String message) {
        for (TraversalListener l : listeners) {
            try {
                l.onError(message);
            } catch (RuntimeException e) {
                errors.log("Listener failed in onError", e);
            }
        }
    }
}
