package com.narrative.sge.graph;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.api.StoryCondition;
import com.narrative.sge.api.VariableType;
import com.narrative.sge.util.Coercions;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Authoring model of one story: nodes, connections and variable declarations.
 *
 * Mutations validate eagerly and throw {@link IllegalArgumentException}, so a
 * graph built through this API never holds a connection to a missing port.
 * Queries are linear scans; the traversal engine reads through a
 * {@code GraphLookupCache} instead.
 *
 * Every structural mutation increments {@link #structureVersion()}. A cache
 * records the version it was built from and reports itself stale once the
 * graph moves on.
 *
 * Cycles are allowed. Not thread-safe: mutate a graph only while no run is
 * walking it.
 */
public final class StoryGraph {
    private final String id;
    private String name;
    private String description = "";
    private float viewOffsetX;
    private float viewOffsetY;
    private float viewScale = 1f;

    private final List<StoryNode> nodes = new ArrayList<>();
    private final List<StoryConnection> connections = new ArrayList<>();
    private final List<StoryVariable> variables = new ArrayList<>();
    private long structureVersion;

    public StoryGraph(String id, String name) {
        this.id = id == null || id.isEmpty() ? UUID.randomUUID().toString() : id;
        this.name = name == null ? this.id : name;
    }

    // ---- Nodes ----

    public StoryNode addNode(StoryNode node) {
        if (node == null)
            throw new IllegalArgumentException("Node must not be null");
        if (getNode(node.id()) != null)
            throw new IllegalArgumentException("Duplicate node id: " + node.id());
        nodes.add(node);
        structureVersion++;
        return node;
    }

    /** Removes the node and every connection touching it. */
    public boolean removeNode(StoryNode node) {
        return node != null && removeNode(node.id());
    }

    public boolean removeNode(String nodeId) {
        StoryNode node = getNode(nodeId);
        if (node == null)
            return false;
        connections.removeIf(c -> c.touches(nodeId));
        nodes.remove(node);
        structureVersion++;
        return true;
    }

    public StoryNode getNode(String nodeId) {
        for (StoryNode n : nodes)
            if (n.id().equals(nodeId))
                return n;
        return null;
    }

    public <T extends StoryNode> List<T> getNodesOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (StoryNode n : nodes)
            if (type.isInstance(n))
                result.add(type.cast(n));
        return result;
    }

    /** First entry point node in insertion order, or null. */
    public StoryNode getStartNode() {
        for (StoryNode n : nodes)
            if (n.isStart())
                return n;
        return null;
    }

    public List<StoryNode> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    // ---- Connections ----

    public StoryConnection connect(StoryNode outNode, String outPort, StoryNode inNode, String inPort) {
        if (outNode == null || inNode == null)
            throw new IllegalArgumentException("Cannot connect a null node");
        return connect(outNode.id(), outPort, inNode.id(), inPort);
    }

    /**
     * Connects an output port to an input port.
     *
     * @throws IllegalArgumentException if a node or port is missing, a port
     *                                  has the wrong direction, the connection
     *                                  already exists, or a SINGLE port is
     *                                  already in use
     */
    public StoryConnection connect(String outNodeId, String outPortId, String inNodeId, String inPortId) {
        StoryNode out = requireNode(outNodeId);
        StoryNode in = requireNode(inNodeId);

        StoryPort outPort = out.getOutputPort(outPortId);
        if (outPort == null)
            throw new IllegalArgumentException(
                    "Node " + outNodeId + " has no output port '" + outPortId + "'" + inputHint(out, outPortId));
        StoryPort inPort = in.getInputPort(inPortId);
        if (inPort == null)
            throw new IllegalArgumentException(
                    "Node " + inNodeId + " has no input port '" + inPortId + "'" + outputHint(in, inPortId));

        for (StoryConnection c : connections)
            if (c.links(outNodeId, outPortId, inNodeId, inPortId))
                throw new IllegalArgumentException("Already connected: " + c);
        if (outPort.capacity() == PortCapacity.SINGLE && getConnectionFromPort(outNodeId, outPortId) != null)
            throw new IllegalArgumentException("Output port " + outNodeId + "." + outPortId + " is already connected");
        if (inPort.capacity() == PortCapacity.SINGLE && !getConnectionsToPort(inNodeId, inPortId).isEmpty())
            throw new IllegalArgumentException("Input port " + inNodeId + "." + inPortId + " is already connected");

        StoryConnection connection = new StoryConnection(outNodeId, outPortId, inNodeId, inPortId);
        connections.add(connection);
        structureVersion++;
        return connection;
    }

    private StoryNode requireNode(String nodeId) {
        StoryNode node = getNode(nodeId);
        if (node == null)
            throw new IllegalArgumentException("Unknown node: " + nodeId);
        return node;
    }

    private static String inputHint(StoryNode node, String portId) {
        return node.getInputPort(portId) != null ? " (it is an input port)" : "";
    }

    private static String outputHint(StoryNode node, String portId) {
        return node.getOutputPort(portId) != null ? " (it is an output port)" : "";
    }

    public boolean removeConnection(StoryConnection connection) {
        return connection != null && removeConnection(connection.id());
    }

    public boolean removeConnection(String connectionId) {
        boolean removed = connections.removeIf(c -> c.id().equals(connectionId));
        if (removed)
            structureVersion++;
        return removed;
    }

    public StoryConnection getConnection(String connectionId) {
        for (StoryConnection c : connections)
            if (c.id().equals(connectionId))
                return c;
        return null;
    }

    public List<StoryConnection> getConnectionsFromNode(String nodeId) {
        List<StoryConnection> result = new ArrayList<>();
        for (StoryConnection c : connections)
            if (c.outputNodeId().equals(nodeId))
                result.add(c);
        return result;
    }

    public List<StoryConnection> getConnectionsToNode(String nodeId) {
        List<StoryConnection> result = new ArrayList<>();
        for (StoryConnection c : connections)
            if (c.inputNodeId().equals(nodeId))
                result.add(c);
        return result;
    }

    private List<StoryConnection> getConnectionsToPort(String nodeId, String portId) {
        List<StoryConnection> result = new ArrayList<>();
        for (StoryConnection c : connections)
            if (c.inputNodeId().equals(nodeId) && c.inputPortId().equals(portId))
                result.add(c);
        return result;
    }

    public StoryConnection getConnectionFromPort(String nodeId, String portId) {
        for (StoryConnection c : connections)
            if (c.outputNodeId().equals(nodeId) && c.outputPortId().equals(portId))
                return c;
        return null;
    }

    /** Node reached by following {@code nodeId.portId}, or null. */
    public StoryNode getConnectedNode(String nodeId, String portId) {
        StoryConnection c = getConnectionFromPort(nodeId, portId);
        return c == null ? null : getNode(c.inputNodeId());
    }

    public List<StoryConnection> connections() {
        return Collections.unmodifiableList(connections);
    }

    // ---- Variables ----

    public StoryVariable addVariable(StoryVariable variable) {
        if (variable == null)
            throw new IllegalArgumentException("Variable must not be null");
        if (getVariable(variable.name()) != null)
            throw new IllegalArgumentException("Duplicate variable name: " + variable.name());
        variables.add(variable);
        structureVersion++;
        return variable;
    }

    public boolean removeVariable(String variableName) {
        boolean removed = variables.removeIf(v -> v.name().equals(variableName));
        if (removed)
            structureVersion++;
        return removed;
    }

    public StoryVariable getVariable(String variableName) {
        for (StoryVariable v : variables)
            if (v.name().equals(variableName))
                return v;
        return null;
    }

    public List<StoryVariable> variables() {
        return Collections.unmodifiableList(variables);
    }

    // ---- Validation ----

    /**
     * Collects structural problems. Never throws; an empty list means the
     * graph can be played.
     */
    public List<String> validate() {
        List<String> errors = new ArrayList<>();

        int starts = 0;
        for (StoryNode n : nodes)
            if (n.isStart())
                starts++;
        if (starts == 0)
            errors.add("Graph has no Start node");
        else if (starts > 1)
            errors.add("Graph has " + starts + " Start nodes; expected exactly one");

        Set<String> names = new HashSet<>();
        for (StoryVariable v : variables)
            if (!names.add(v.name()))
                errors.add("Duplicate variable name: " + v.name());

        for (StoryConnection c : connections) {
            StoryNode out = getNode(c.outputNodeId());
            StoryNode in = getNode(c.inputNodeId());
            if (out == null)
                errors.add("Connection " + c.id() + " references missing output node " + c.outputNodeId());
            else if (out.getOutputPort(c.outputPortId()) == null)
                errors.add("Connection " + c.id() + " references missing output port " + c.outputNodeId() + "."
                        + c.outputPortId());
            if (in == null)
                errors.add("Connection " + c.id() + " references missing input node " + c.inputNodeId());
            else if (in.getInputPort(c.inputPortId()) == null)
                errors.add("Connection " + c.id() + " references missing input port " + c.inputNodeId() + "."
                        + c.inputPortId());
        }

        for (StoryNode n : nodes) {
            try {
                for (String e : n.validate())
                    errors.add(n.name() + " (" + n.id() + "): " + e);
                for (String var : n.referencedVariables())
                    if (var != null && !var.isEmpty() && !names.contains(var))
                        errors.add(n.name() + " (" + n.id() + "): references undeclared variable '" + var + "'");
                for (StoryCondition c : n.authoredConditions()) {
                    StoryVariable declared = getVariable(c.variable());
                    if (declared != null && !canHold(c, declared.type()))
                        errors.add(n.name() + " (" + n.id() + "): condition '" + c + "' can never hold for "
                                + declared.type() + " variable " + declared.name());
                }
            } catch (RuntimeException e) {
                errors.add(n.name() + " (" + n.id() + "): validation failed: " + e);
            }
        }
        return errors;
    }

    /**
     * Whether {@code condition} can ever be true for a variable of the given
     * type. Run-time evaluation of the same mismatch silently yields false.
     */
    static boolean canHold(StoryCondition condition, VariableType type) {
        ConditionOperator op = condition.operator();
        if (op == ConditionOperator.IS_TRUE || op == ConditionOperator.IS_FALSE || op == ConditionOperator.CONTAINS)
            return true;
        boolean ordering = op != ConditionOperator.EQUALS && op != ConditionOperator.NOT_EQUALS;
        Object value = condition.compareValue();
        try {
            switch (type) {
                case BOOL -> {
                    if (ordering)
                        return false;
                    Coercions.toBool(value);
                }
                case STRING -> {
                    if (ordering)
                        Coercions.toDouble(value);
                    else
                        Coercions.toText(value);
                }
                default -> Coercions.toDouble(value);
            }
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    /** Removes every node, connection and variable. */
    public void clear() {
        nodes.clear();
        connections.clear();
        variables.clear();
        structureVersion++;
    }

    // ---- Metadata ----

    public long structureVersion() {
        return structureVersion;
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String description() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description == null ? "" : description;
    }

    public float viewOffsetX() {
        return viewOffsetX;
    }

    public float viewOffsetY() {
        return viewOffsetY;
    }

    public void setViewOffset(float x, float y) {
        this.viewOffsetX = x;
        this.viewOffsetY = y;
    }

    public float viewScale() {
        return viewScale;
    }

    public void setViewScale(float viewScale) {
        this.viewScale = viewScale;
    }

    @Override
    public String toString() {
        return "StoryGraph[" + name + " #" + id + ", nodes=" + nodes.size() + ", connections=" + connections.size()
                + "]";
    }
}
