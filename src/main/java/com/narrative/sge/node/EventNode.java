package com.narrative.sge.node;

import com.narrative.sge.api.NodeResult;
import com.narrative.sge.api.StoryEvent;
import com.narrative.sge.engine.ExecutionContext;
import com.narrative.sge.graph.StoryNode;

import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raises a named story event. Parameter values starting with {@code $} are
 * replaced by the current value of the named variable.
 *
 * With {@code waitForCompletion} the node waits until the host calls
 * {@link #complete(ExecutionContext)}; a positive timeout leaves through
 * "timeout" instead.
 */
public class EventNode extends StoryNode {
    public static final String TIMEOUT_PORT = "timeout";
    public static final String COMPLETE_KEY = "eventComplete";

    private String eventName = "";
    private String eventCategory = "";
    private final Map<String, String> parameters = new LinkedHashMap<>();
    private boolean waitForCompletion;
    private float timeout;

    public EventNode(String id) {
        super(id);
        addInputPort(INPUT_PORT, "Input");
        addOutputPort(NodeResult.DEFAULT_PORT, "Output");
        addOutputPort(TIMEOUT_PORT, "On Timeout");
    }

    @Override
    public String typeName() {
        return "Event";
    }

    @Override
    public String category() {
        return "Events";
    }

    @Override
    public NodeResult execute(ExecutionContext context) {
        context.raiseEvent(buildEvent(context));
        if (!waitForCompletion)
            return NodeResult.next();
        if (timeout > 0)
            return NodeResult.waitUntil(() -> context.getTempData(COMPLETE_KEY, Boolean.FALSE),
                    NodeResult.DEFAULT_PORT, Duration.ofNanos((long) (timeout * 1_000_000_000L)), TIMEOUT_PORT);
        return NodeResult.waitUntil(() -> context.getTempData(COMPLETE_KEY, Boolean.FALSE), NodeResult.DEFAULT_PORT);
    }

    /** The event this node raises, with variable references resolved. */
    public StoryEvent buildEvent(ExecutionContext context) {
        Map<String, Object> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : parameters.entrySet())
            resolved.put(e.getKey(), resolveValue(e.getValue(), context));
        return new StoryEvent(eventName, eventCategory, id(), resolved);
    }

    private static Object resolveValue(String value, ExecutionContext context) {
        if (value != null && value.length() > 1 && value.startsWith("$"))
            return context.getVariable(value.substring(1));
        return value;
    }

    /** Signals that the host finished handling the event. */
    public void complete(ExecutionContext context) {
        context.setTempData(COMPLETE_KEY, Boolean.TRUE);
    }

    public EventNode addParameter(String name, Object value) {
        parameters.put(name, value == null ? null : value.toString());
        return this;
    }

    public Map<String, String> parameters() {
        return Collections.unmodifiableMap(parameters);
    }

    @Override
    public List<String> validate() {
        List<String> errors = super.validate();
        if (eventName == null || eventName.isEmpty())
            errors.add("Event node has no event name");
        return errors;
    }

    public String eventName() {
        return eventName;
    }

    public void setEventName(String eventName) {
        this.eventName = eventName;
    }

    public String eventCategory() {
        return eventCategory;
    }

    public void setEventCategory(String eventCategory) {
        this.eventCategory = eventCategory;
    }

    public boolean isWaitForCompletion() {
        return waitForCompletion;
    }

    public void setWaitForCompletion(boolean waitForCompletion) {
        this.waitForCompletion = waitForCompletion;
    }

    /** Seconds to wait for completion before leaving through "timeout"; zero waits forever. */
    public float timeout() {
        return timeout;
    }

    public void setTimeout(float timeout) {
        this.timeout = timeout;
    }
}
