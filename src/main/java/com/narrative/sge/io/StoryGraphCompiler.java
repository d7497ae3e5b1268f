package com.narrative.sge.io;

import com.narrative.sge.api.VariableType;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.graph.StoryVariable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Compiles a {@link GraphDefinition} into a {@link StoryGraph}.
 *
 * Variables are declared first, then nodes are built through the
 * {@link NodeRegistry}, then connections are made. Authoring errors in the
 * definition (unknown node types, duplicate ids, connections to missing
 * nodes or ports) surface as {@link IllegalArgumentException}s naming the
 * offending element. Semantic problems such as a missing start node are left
 * to {@link StoryGraph#validate()}.
 */
@Log4j2
public final class StoryGraphCompiler {
    private final NodeRegistry registry;

    public StoryGraphCompiler() {
        this(new NodeRegistry());
    }

    public StoryGraphCompiler(NodeRegistry registry) {
        this.registry = registry;
    }

    public NodeRegistry registry() {
        return registry;
    }

    /**
     * Registers a factory for a custom node type.
     */
    public StoryGraphCompiler registerFactory(String typeName, Class<? extends StoryNode> nodeClass,
            NodeFactory factory) {
        registry.registerFactory(typeName, nodeClass, factory);
        return this;
    }

    /**
     * Compiles the definition into a graph.
     *
     * @param def The graph definition.
     * @return A new graph; nothing is shared with {@code def}.
     */
    public StoryGraph compile(GraphDefinition def) {
        if (def == null || def.getGraph() == null)
            throw new IllegalArgumentException("Definition has no graph section");
        GraphDefinition.GraphInfo info = def.getGraph();
        StoryGraph graph = new StoryGraph(info.getId(), info.getName());
        if (info.getDescription() != null)
            graph.setDescription(info.getDescription());

        // 1. Variables
        for (GraphDefinition.VariableDef vd : orEmpty(info.getVariables())) {
            if (vd.getName() == null || vd.getName().isEmpty())
                throw new IllegalArgumentException("Variable without a name in graph " + graph.id());
            VariableType type = vd.getType() != null ? VariableType.fromString(vd.getType())
                    : VariableType.of(vd.getValue());
            graph.addVariable(new StoryVariable(vd.getName(), type, vd.getValue(), vd.getDescription()));
        }

        // 2. Nodes
        for (GraphDefinition.NodeDef nd : orEmpty(info.getNodes())) {
            StoryNode node;
            try {
                node = registry.create(nd.getType(), nd.getId(),
                        nd.getProperties() != null ? nd.getProperties() : Collections.emptyMap());
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Node " + nd.getId() + ": " + e.getMessage(), e);
            }
            if (nd.getName() != null)
                node.setName(nd.getName());
            if (nd.getDescription() != null)
                node.setDescription(nd.getDescription());
            node.setPosition(nd.getX(), nd.getY());
            node.setBreakpoint(nd.isBreakpoint());
            graph.addNode(node);
        }

        // 3. Connections
        for (GraphDefinition.ConnectionDef cd : orEmpty(info.getConnections())) {
            String fromPort = cd.getFromPort() != null ? cd.getFromPort() : "output";
            String toPort = cd.getToPort() != null ? cd.getToPort() : StoryNode.INPUT_PORT;
            graph.connect(cd.getFrom(), fromPort, cd.getTo(), toPort);
        }

        log.debug("Compiled graph {} with {} nodes, {} connections, {} variables", graph.id(),
                graph.nodes().size(), graph.connections().size(), graph.variables().size());
        return graph;
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : Collections.emptyList();
    }

    public static String getString(Map<String, Object> props, String key, String def) {
        Object v = props.get(key);
        return v == null ? def : v.toString();
    }

    public static double getDouble(Map<String, Object> props, String key, double def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.doubleValue() : Double.parseDouble(v.toString());
    }

    public static float getFloat(Map<String, Object> props, String key, float def) {
        return (float) getDouble(props, key, def);
    }

    public static int getInt(Map<String, Object> props, String key, int def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Number n ? n.intValue() : Integer.parseInt(v.toString());
    }

    public static boolean getBool(Map<String, Object> props, String key, boolean def) {
        Object v = props.get(key);
        if (v == null)
            return def;
        return v instanceof Boolean b ? b : Boolean.parseBoolean(v.toString());
    }

    /** Reads a list of objects, e.g. the choices of a choice node. Non-object entries are rejected. */
    @SuppressWarnings("unchecked")
    public static List<Map<String, Object>> getList(Map<String, Object> props, String key) {
        Object v = props.get(key);
        if (v == null)
            return Collections.emptyList();
        if (!(v instanceof List<?> list))
            throw new IllegalArgumentException("Property '" + key + "' must be a list");
        List<Map<String, Object>> out = new ArrayList<>(list.size());
        for (Object o : list) {
            if (!(o instanceof Map<?, ?>))
                throw new IllegalArgumentException("Entries of '" + key + "' must be objects");
            out.add((Map<String, Object>) o);
        }
        return out;
    }

    /** Factory for creating story nodes from definition properties. */
    @FunctionalInterface
    public interface NodeFactory {
        StoryNode create(String id, Map<String, Object> properties);
    }
}
