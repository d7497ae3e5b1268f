package com.narrative.sge.io;

import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import lombok.Data;

/**
 * POJO representation of an authored story graph.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public final class GraphDefinition {
    private GraphInfo graph;

    /** Graph metadata plus its variables, nodes and connections. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class GraphInfo {
        private String id, name, description, version;
        private List<VariableDef> variables;
        private List<NodeDef> nodes;
        private List<ConnectionDef> connections;
    }

    /** A declared variable. {@code type} is one of int, float, bool, string. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class VariableDef {
        private String name, type, description;
        private Object value;
    }

    /** Definition of a single node; {@code properties} are read by the type's factory. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class NodeDef {
        private String id, type, name, description;
        private float x, y;
        private boolean breakpoint;
        private Map<String, Object> properties;
    }

    /** An edge from an output port to an input port. */
    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    public static final class ConnectionDef {
        private String id, from, fromPort, to, toPort;
    }
}
