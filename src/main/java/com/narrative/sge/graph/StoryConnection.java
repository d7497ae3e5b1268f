package com.narrative.sge.graph;

import java.util.Objects;
import java.util.UUID;

/**
 * Directed edge from an output port to an input port. Immutable.
 */
public final class StoryConnection {
    private final String id;
    private final String outputNodeId;
    private final String outputPortId;
    private final String inputNodeId;
    private final String inputPortId;

    public StoryConnection(String id, String outputNodeId, String outputPortId, String inputNodeId,
            String inputPortId) {
        this.id = id == null ? UUID.randomUUID().toString() : id;
        this.outputNodeId = Objects.requireNonNull(outputNodeId, "outputNodeId");
        this.outputPortId = Objects.requireNonNull(outputPortId, "outputPortId");
        this.inputNodeId = Objects.requireNonNull(inputNodeId, "inputNodeId");
        this.inputPortId = Objects.requireNonNull(inputPortId, "inputPortId");
    }

    public StoryConnection(String outputNodeId, String outputPortId, String inputNodeId, String inputPortId) {
        this(null, outputNodeId, outputPortId, inputNodeId, inputPortId);
    }

    public String id() {
        return id;
    }

    public String outputNodeId() {
        return outputNodeId;
    }

    public String outputPortId() {
        return outputPortId;
    }

    public String inputNodeId() {
        return inputNodeId;
    }

    public String inputPortId() {
        return inputPortId;
    }

    /** True if this connection has the same endpoints as the given four-tuple. */
    public boolean links(String outNode, String outPort, String inNode, String inPort) {
        return outputNodeId.equals(outNode) && outputPortId.equals(outPort)
                && inputNodeId.equals(inNode) && inputPortId.equals(inPort);
    }

    public boolean touches(String nodeId) {
        return outputNodeId.equals(nodeId) || inputNodeId.equals(nodeId);
    }

    @Override
    public String toString() {
        return outputNodeId + "." + outputPortId + " -> " + inputNodeId + "." + inputPortId;
    }
}
