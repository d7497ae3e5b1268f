package com.narrative.sge.io;

import com.narrative.sge.graph.StoryNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Registry mapping node type names to their factories. Built-in
 * {@link NodeType}s are registered on construction; hosts add their own node
 * variants with {@link #registerFactory(String, Class, StoryGraphCompiler.NodeFactory)}.
 *
 * Type names are matched ignoring case and underscores, so "SetVariable",
 * "set_variable" and "SET_VARIABLE" name the same type.
 */
public final class NodeRegistry {

    /** The node class a type produces and its factory. */
    public record NodeMetadata(String typeName, Class<? extends StoryNode> nodeClass,
            StoryGraphCompiler.NodeFactory factory) {
    }

    private final Map<String, NodeMetadata> registry = new LinkedHashMap<>();

    public NodeRegistry() {
        registerBuiltIns();
    }

    private void registerBuiltIns() {
        for (NodeType type : NodeType.values())
            registerFactory(type.name(), type.getNodeClass(), type.getFactory());
    }

    /** Registers or replaces the factory for {@code typeName}. */
    public NodeRegistry registerFactory(String typeName, Class<? extends StoryNode> nodeClass,
            StoryGraphCompiler.NodeFactory factory) {
        if (typeName == null || typeName.isEmpty())
            throw new IllegalArgumentException("Type name must not be empty");
        if (factory == null)
            throw new IllegalArgumentException("No factory given for type " + typeName);
        registry.put(key(typeName), new NodeMetadata(typeName, nodeClass, factory));
        return this;
    }

    public NodeMetadata getMetadata(String typeName) {
        return typeName == null ? null : registry.get(key(typeName));
    }

    public boolean isRegistered(String typeName) {
        return getMetadata(typeName) != null;
    }

    /**
     * Builds a node of the named type.
     *
     * @throws IllegalArgumentException if the type is unknown
     */
    public StoryNode create(String typeName, String id, Map<String, Object> properties) {
        NodeMetadata meta = getMetadata(typeName);
        if (meta == null)
            throw new IllegalArgumentException("Unknown node type: " + typeName);
        return meta.factory().create(id, properties != null ? properties : Collections.emptyMap());
    }

    public Set<String> typeNames() {
        Set<String> names = new LinkedHashSet<>();
        for (NodeMetadata m : registry.values())
            names.add(m.typeName());
        return names;
    }

    private static String key(String typeName) {
        return typeName.replace("_", "").toLowerCase(Locale.ROOT);
    }
}
