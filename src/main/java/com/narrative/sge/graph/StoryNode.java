package com.narrative.sge.graph;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.api.StoryCondition;
import com.narrative.sge.engine.ExecutionContext;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Base class for every node in a story graph.
 *
 * A node holds authored configuration only: its id, display data, ports and
 * variant specific settings. Everything that changes while a run walks the
 * graph lives in the {@link ExecutionContext}, so a single node instance can be
 * executed by any number of concurrent runs.
 *
 * Lifecycle per visit, driven by the traversal engine:
 * 1. {@link #onEnter(ExecutionContext)}
 * 2. {@link #execute(ExecutionContext)}, which returns a {@link NodeResult}
 * 3. if the result suspended the run, {@link #resumePort} picks the port to
 * follow once the suspension resolves
 * 4. {@link #onExit(ExecutionContext)}
 *
 * Subclasses declare their ports from their constructors with
 * {@link #addInputPort} and {@link #addOutputPort}.
 */
public abstract class StoryNode {
    public static final String INPUT_PORT = "input";

    private final String id;
    private String name;
    private String description = "";
    private float x;
    private float y;
    private boolean breakpoint;
    private final List<StoryPort> inputPorts = new ArrayList<>();
    private final List<StoryPort> outputPorts = new ArrayList<>();

    protected StoryNode(String id) {
        this.id = id == null || id.isEmpty() ? UUID.randomUUID().toString() : id;
        this.name = typeName();
    }

    /** Variant name, e.g. "Dialogue". Used as the default display name. */
    public abstract String typeName();

    /** Grouping used by authoring tools, e.g. "Flow" or "Logic". */
    public abstract String category();

    public abstract NodeResult execute(ExecutionContext context);

    public void onEnter(ExecutionContext context) {
    }

    public void onExit(ExecutionContext context) {
    }

    /**
     * Output port to follow when a suspension produced by this node resolves.
     * The default keeps the port named by the result.
     */
    public String resumePort(ExecutionContext context, String port) {
        return port;
    }

    /** Configuration errors of this node; empty when valid. Never throws. */
    public List<String> validate() {
        return new ArrayList<>();
    }

    /** Variables read by this node's conditions, checked against graph declarations. */
    public List<String> referencedVariables() {
        return Collections.emptyList();
    }

    /** Conditions this node evaluates at run time, type-checked by {@link StoryGraph#validate()}. */
    public List<StoryCondition> authoredConditions() {
        return Collections.emptyList();
    }

    /** True for entry point nodes. */
    public boolean isStart() {
        return false;
    }

    protected final StoryPort addInputPort(String portId, String portName) {
        return addPort(inputPorts, StoryPort.input(portId, portName));
    }

    protected final StoryPort addOutputPort(String portId, String portName) {
        return addPort(outputPorts, StoryPort.output(portId, portName));
    }

    /** Drops every output port; used by variants whose outputs follow their configuration. */
    protected final void clearOutputPorts() {
        outputPorts.clear();
    }

    private static StoryPort addPort(List<StoryPort> ports, StoryPort port) {
        for (StoryPort p : ports)
            if (p.id().equals(port.id()))
                throw new IllegalArgumentException("Duplicate port id: " + port.id());
        ports.add(port);
        return port;
    }

    public StoryPort getInputPort(String portId) {
        return find(inputPorts, portId);
    }

    public StoryPort getOutputPort(String portId) {
        return find(outputPorts, portId);
    }

    private static StoryPort find(List<StoryPort> ports, String portId) {
        for (StoryPort p : ports)
            if (p.id().equals(portId))
                return p;
        return null;
    }

    public List<StoryPort> inputPorts() {
        return Collections.unmodifiableList(inputPorts);
    }

    public List<StoryPort> outputPorts() {
        return Collections.unmodifiableList(outputPorts);
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

    public float x() {
        return x;
    }

    public float y() {
        return y;
    }

    public void setPosition(float x, float y) {
        this.x = x;
        this.y = y;
    }

    public boolean isBreakpoint() {
        return breakpoint;
    }

    public void setBreakpoint(boolean breakpoint) {
        this.breakpoint = breakpoint;
    }

    @Override
    public String toString() {
        return typeName() + "[" + name + " #" + id + "]";
    }
}
