package com.narrative.sge.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Persistable state of a run: the graph, the node the run was at, and a flat
 * copy of the variable store. Temp data and history are run scoped and not
 * included.
 *
 * @param graphId       id of the graph the run was walking
 * @param currentNodeId node to resume at, or null to restart from the Start node
 * @param variables     variable name to boxed value
 */
public record StorySnapshot(String graphId, String currentNodeId, Map<String, Object> variables) {

    public StorySnapshot {
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
    }
}
