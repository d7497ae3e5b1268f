package com.narrative.sge.engine;

import com.narrative.sge.api.ConditionOperator;
import com.narrative.sge.api.StoryEvent;
import com.narrative.sge.api.VariableChangeListener;
import com.narrative.sge.api.VariableStore;
import com.narrative.sge.api.VariableType;
import com.narrative.sge.graph.StoryGraph;
import com.narrative.sge.graph.StoryNode;
import com.narrative.sge.graph.StoryVariable;
import com.narrative.sge.store.MapVariableStore;
import com.narrative.sge.util.Coercions;

import java.util.ArrayDeque;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Random;
import java.util.function.Consumer;

import lombok.extern.log4j.Log4j2;

/**
 * Mutable state of a single traversal run.
 *
 * A context owns:
 * - the live variables, seeded from the graph's declarations, in a
 * {@link VariableStore} chosen by the engine configuration,
 * - scratch (temp) data, which the engine clears every time a node is entered,
 * - the navigation history, a stack of previously current node ids,
 * - the current node plus the paused and complete flags,
 * - a {@link Random} for shuffles and random operations,
 * - the sink that receives {@link StoryEvent}s raised by nodes.
 *
 * Contexts are not shared between runs and are not thread-safe. Nodes receive
 * the context of the run walking them and must keep all per-run state here.
 *
 * Variable reads are forgiving: a missing variable or a failed coercion yields
 * the caller's default, and conditions fail closed.
 */
@Log4j2
public class ExecutionContext {
    private final StoryGraph graph;
    private final VariableStore variables;
    private final Map<String, Object> tempData = new HashMap<>();
    private final ArrayDeque<String> history = new ArrayDeque<>();
    private final Random random;

    private StoryNode currentNode;
    private boolean paused;
    private boolean complete;

    private VariableChangeListener[] variableListeners = new VariableChangeListener[0];
    @SuppressWarnings("unchecked")
    private Consumer<StoryNode>[] nodeListeners = new Consumer[0];
    private Consumer<StoryEvent> eventSink = e -> log.debug("Unhandled story event {}", e.name());

    public ExecutionContext(StoryGraph graph) {
        this(graph, new MapVariableStore(), new Random());
    }

    public ExecutionContext(StoryGraph graph, VariableStore variables, Random random) {
        this.graph = graph;
        this.variables = variables;
        this.random = random;
        seedVariables();
    }

    private void seedVariables() {
        if (graph == null)
            return;
        for (StoryVariable v : graph.variables())
            variables.put(v.name(), v.defaultValue());
    }

    public StoryGraph graph() {
        return graph;
    }

    public VariableStore variables() {
        return variables;
    }

    public Random random() {
        return random;
    }

    // ---- Variables ----

    /**
     * Writes a variable and notifies variable listeners with the previous value
     * (null when the variable did not exist).
     */
    public void setVariable(String name, Object value) {
        Object oldValue = variables.put(name, value);
        fireVariableChanged(name, oldValue, variables.get(name));
    }

    public Object getVariable(String name) {
        return variables.get(name);
    }

    /**
     * Reads a variable coerced to the type of {@code defaultValue}. Returns the
     * default if the variable is absent or cannot be converted.
     */
    @SuppressWarnings("unchecked")
    public <T> T getVariable(String name, T defaultValue) {
        if (defaultValue == null)
            return (T) variables.get(name);
        return getVariable(name, (Class<T>) defaultValue.getClass(), defaultValue);
    }

    public <T> T getVariable(String name, Class<T> type, T defaultValue) {
        Object value = variables.get(name);
        if (value == null)
            return defaultValue;
        try {
            return Coercions.coerce(value, type);
        } catch (IllegalArgumentException | ArithmeticException e) {
            log.trace("Variable {}={} not convertible to {}, using default", name, value, type.getSimpleName());
            return defaultValue;
        }
    }

    public int getInt(String name, int defaultValue) {
        return variables.getInt(name, defaultValue);
    }

    public float getFloat(String name, float defaultValue) {
        return variables.getFloat(name, defaultValue);
    }

    public boolean getBool(String name, boolean defaultValue) {
        return variables.getBool(name, defaultValue);
    }

    public String getString(String name, String defaultValue) {
        return variables.getString(name, defaultValue);
    }

    public boolean hasVariable(String name) {
        return variables.contains(name);
    }

    public VariableType variableType(String name) {
        return variables.typeOf(name);
    }

    /**
     * Adds {@code amount} to a numeric variable. INT variables stay INT when
     * the amount is integral; anything else is stored as FLOAT. A missing
     * variable counts as zero.
     */
    public void incrementVariable(String name, double amount) {
        VariableType type = variables.typeOf(name);
        if ((type == null || type == VariableType.INT) && amount == Math.rint(amount))
            setVariable(name, variables.getInt(name, 0) + (int) amount);
        else
            setVariable(name, (float) (variables.getFloat(name, 0f) + amount));
    }

    /** Fail-closed: false for absent variables and incompatible compare values. */
    public boolean evaluateCondition(String name, ConditionOperator op, Object compareValue) {
        if (name == null || op == null)
            return false;
        return variables.evaluate(name, op, compareValue);
    }

    public void addVariableListener(VariableChangeListener listener) {
        VariableChangeListener[] old = variableListeners;
        VariableChangeListener[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        variableListeners = next;
    }

    private void fireVariableChanged(String name, Object oldValue, Object newValue) {
        for (VariableChangeListener l : variableListeners) {
            try {
                l.onVariableChanged(name, oldValue, newValue);
            } catch (RuntimeException e) {
                log.warn("Variable listener failed for {}", name, e);
            }
        }
    }

    // ---- Temp data ----

    public void setTempData(String key, Object value) {
        tempData.put(key, value);
    }

    /**
     * Reads scratch data. Returns the default if the key is absent or holds a
     * value of another type.
     */
    @SuppressWarnings("unchecked")
    public <T> T getTempData(String key, T defaultValue) {
        Object value = tempData.get(key);
        if (value == null)
            return defaultValue;
        if (defaultValue != null && !defaultValue.getClass().isInstance(value))
            return defaultValue;
        return (T) value;
    }

    public boolean hasTempData(String key) {
        return tempData.containsKey(key);
    }

    public void removeTempData(String key) {
        tempData.remove(key);
    }

    public void clearTempData() {
        tempData.clear();
    }

    // ---- Navigation ----

    public StoryNode currentNode() {
        return currentNode;
    }

    /** Pushes the previous current node onto the history and notifies node listeners. */
    public void setCurrentNode(StoryNode node) {
        if (currentNode != null)
            history.push(currentNode.id());
        currentNode = node;
        for (Consumer<StoryNode> l : nodeListeners) {
            try {
                l.accept(node);
            } catch (RuntimeException e) {
                log.warn("Node listener failed for {}", node, e);
            }
        }
    }

    public void addNodeListener(Consumer<StoryNode> listener) {
        Consumer<StoryNode>[] old = nodeListeners;
        Consumer<StoryNode>[] next = Arrays.copyOf(old, old.length + 1);
        next[old.length] = listener;
        nodeListeners = next;
    }

    public void pushHistory(String nodeId) {
        history.push(nodeId);
    }

    /** @return the most recent node id, or null when the history is empty */
    public String popHistory() {
        return history.poll();
    }

    public String peekHistory() {
        return history.peek();
    }

    public void clearHistory() {
        history.clear();
    }

    public int historySize() {
        return history.size();
    }

    // ---- Events ----

    public void setEventSink(Consumer<StoryEvent> sink) {
        this.eventSink = sink;
    }

    public void raiseEvent(StoryEvent event) {
        eventSink.accept(event);
    }

    // ---- Flags ----

    public boolean isPaused() {
        return paused;
    }

    void setPaused(boolean paused) {
        this.paused = paused;
    }

    public boolean isComplete() {
        return complete;
    }

    public void markComplete() {
        complete = true;
    }

    // ---- Persistence ----

    /** Flat copy of the variable store. */
    public Map<String, Object> saveState() {
        return variables.snapshot();
    }

    /** Replaces the variable store contents with {@code state}. */
    public void loadState(Map<String, Object> state) {
        variables.clear();
        if (state != null)
            for (var entry : state.entrySet())
                variables.put(entry.getKey(), entry.getValue());
    }

    /** Clears all run state and re-seeds variables from the graph declarations. */
    public void reset() {
        variables.clear();
        tempData.clear();
        history.clear();
        currentNode = null;
        paused = false;
        complete = false;
        seedVariables();
    }
}
