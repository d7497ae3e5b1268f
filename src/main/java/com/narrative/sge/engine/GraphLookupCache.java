package com.narrative.sge.engine;

import com.narrative.sge.graph.StoryConnection;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Immutable O(1) index over a {@link StoryGraph}.
 *
 * The graph model answers queries by scanning its lists. The traversal engine
 * resolves "which node follows this port" on every step, so it reads through
 * this cache instead.
 *
 * Data layout:
 * - nodes / connections: flat arrays copied from the graph at build time.
 * - nodeIndex / connectionIndex: id to array index.
 * - portKeys / portValues: open-addressed table from the combined 64-bit key
 * (node id hash in the high word, port id hash in the low word) to the
 * connection index. Hash equality is only a candidate match; a slot is
 * accepted once the connection's actual node and port ids compare equal, so
 * colliding ids cannot return the wrong edge.
 * - outgoing / incoming: per-node connection lists, built once.
 * - startNode: resolved once.
 *
 * The cache is a snapshot. It does not follow later graph edits; callers check
 * {@link #isStale()} and {@link #rebuild()} after structural changes. Being
 * immutable, one cache may be shared by any number of engines.
 */
@Log4j2
public final class GraphLookupCache {
    private static final List<StoryConnection> NONE = Collections.emptyList();

    private final StoryGraph graph;
    private final long builtVersion;

    private final StoryNode[] nodes;
    private final StoryConnection[] connections;
    private final Map<String, Integer> nodeIndex;
    private final Map<String, Integer> connectionIndex;

    // Open-addressed port index. portValues[i] == -1 marks an empty slot.
    private final long[] portKeys;
    private final int[] portValues;

    private final List<List<StoryConnection>> outgoing;
    private final List<List<StoryConnection>> incoming;
    private final StoryNode startNode;

    private GraphLookupCache(StoryGraph graph) {
        this.graph = graph;
        this.builtVersion = graph.structureVersion();

        List<StoryNode> nodeList = graph.nodes();
        List<StoryConnection> connectionList = graph.connections();
        int n = nodeList.size();
        int m = connectionList.size();

        nodes = nodeList.toArray(new StoryNode[0]);
        connections = connectionList.toArray(new StoryConnection[0]);

        nodeIndex = new HashMap<>(n * 2);
        for (int i = 0; i < n; i++)
            nodeIndex.put(nodes[i].id(), i);

        connectionIndex = new HashMap<>(m * 2);
        List<List<StoryConnection>> out = new ArrayList<>(n);
        List<List<StoryConnection>> in = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            out.add(new ArrayList<>(2));
            in.add(new ArrayList<>(2));
        }

        int capacity = Integer.highestOneBit(Math.max(4, m) * 4 - 1);
        portKeys = new long[capacity];
        portValues = new int[capacity];
        Arrays.fill(portValues, -1);

        for (int ci = 0; ci < m; ci++) {
            StoryConnection c = connections[ci];
            connectionIndex.put(c.id(), ci);

            Integer from = nodeIndex.get(c.outputNodeId());
            Integer to = nodeIndex.get(c.inputNodeId());
            if (from == null || to == null) {
                log.warn("Skipping dangling connection {} in graph {}", c, graph.id());
                continue;
            }
            out.get(from).add(c);
            in.get(to).add(c);
            insertPort(c, ci);
        }

        outgoing = freeze(out);
        incoming = freeze(in);
        startNode = graph.getStartNode();
        log.debug("Built lookup cache for graph {} (nodes={}, connections={}, version={})",
                graph.id(), n, m, builtVersion);
    }

    public static GraphLookupCache build(StoryGraph graph) {
        if (graph == null)
            throw new IllegalArgumentException("Graph must not be null");
        return new GraphLookupCache(graph);
    }

    /** Builds a fresh cache over the same graph. */
    public GraphLookupCache rebuild() {
        return new GraphLookupCache(graph);
    }

    /** True once the graph has been structurally modified after this cache was built. */
    public boolean isStale() {
        return graph.structureVersion() != builtVersion;
    }

    public StoryGraph graph() {
        return graph;
    }

    public long builtVersion() {
        return builtVersion;
    }

    public StoryNode getNode(String nodeId) {
        if (nodeId == null)
            return null;
        Integer i = nodeIndex.get(nodeId);
        return i == null ? null : nodes[i];
    }

    public StoryConnection getConnection(String connectionId) {
        if (connectionId == null)
            return null;
        Integer i = connectionIndex.get(connectionId);
        return i == null ? null : connections[i];
    }

    public StoryConnection getConnectionFromPort(String nodeId, String portId) {
        if (nodeId == null || portId == null)
            return null;
        long key = portKey(nodeId, portId);
        int mask = portKeys.length - 1;
        int slot = spread(key) & mask;
        while (portValues[slot] != -1) {
            if (portKeys[slot] == key) {
                StoryConnection c = connections[portValues[slot]];
                if (c.outputNodeId().equals(nodeId) && c.outputPortId().equals(portId))
                    return c;
            }
            slot = (slot + 1) & mask;
        }
        return null;
    }

    /** Node at the far end of {@code nodeId.portId}, or null for a dead end. */
    public StoryNode getConnectedNode(String nodeId, String portId) {
        StoryConnection c = getConnectionFromPort(nodeId, portId);
        return c == null ? null : getNode(c.inputNodeId());
    }

    public List<StoryConnection> getConnectionsFromNode(String nodeId) {
        Integer i = nodeId == null ? null : nodeIndex.get(nodeId);
        return i == null ? NONE : outgoing.get(i);
    }

    public List<StoryConnection> getConnectionsToNode(String nodeId) {
        Integer i = nodeId == null ? null : nodeIndex.get(nodeId);
        return i == null ? NONE : incoming.get(i);
    }

    public StoryNode getStartNode() {
        return startNode;
    }

    public <T extends StoryNode> List<T> getNodesOfType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (StoryNode node : nodes)
            if (type.isInstance(node))
                result.add(type.cast(node));
        return result;
    }

    public int nodeCount() {
        return nodes.length;
    }

    public int connectionCount() {
        return connections.length;
    }

    private void insertPort(StoryConnection c, int connectionIdx) {
        long key = portKey(c.outputNodeId(), c.outputPortId());
        int mask = portKeys.length - 1;
        int slot = spread(key) & mask;
        while (portValues[slot] != -1) {
            // First edge from a port wins, matching the graph's own scan order.
            if (portKeys[slot] == key && sameOutput(connections[portValues[slot]], c))
                return;
            slot = (slot + 1) & mask;
        }
        portKeys[slot] = key;
        portValues[slot] = connectionIdx;
    }

    private static boolean sameOutput(StoryConnection a, StoryConnection b) {
        return a.outputNodeId().equals(b.outputNodeId()) && a.outputPortId().equals(b.outputPortId());
    }

    static long portKey(String nodeId, String portId) {
        return ((long) nodeId.hashCode() << 32) | (portId.hashCode() & 0xFFFFFFFFL);
    }

    private static int spread(long key) {
        long h = key * 0x9E3779B97F4A7C15L;
        return (int) (h ^ (h >>> 32));
    }

    private static List<List<StoryConnection>> freeze(List<List<StoryConnection>> lists) {
        List<List<StoryConnection>> frozen = new ArrayList<>(lists.size());
        for (List<StoryConnection> l : lists)
            frozen.add(l.isEmpty() ? NONE : Collections.unmodifiableList(l));
        return Collections.unmodifiableList(frozen);
    }
}
