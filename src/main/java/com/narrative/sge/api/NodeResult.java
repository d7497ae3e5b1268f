package com.narrative.sge.api;

import java.time.Duration;
import java.util.Objects;
import java.util.function.BooleanSupplier;

/**
 * Outcome of {@code StoryNode.execute(context)}.
 *
 * A result is a small immutable record telling the traversal engine how to
 * proceed: which suspension (if any) to enter and which output port to follow
 * once it resumes. Instances are created through the static factories; the
 * engine copies what it needs into its own suspension record, so a result may
 * be discarded as soon as it has been applied.
 */
public final class NodeResult {
    /** Port followed when a node does not name one. */
    public static final String DEFAULT_PORT = "output";

    private static final NodeResult END = new NodeResult(NodeResultType.END, null, Duration.ZERO, null, null, null);

    private final NodeResultType type;
    private final String portId;
    private final Duration waitTime;
    private final BooleanSupplier condition;
    private final Duration timeout;
    private final String timeoutPortId;

    private NodeResult(NodeResultType type, String portId, Duration waitTime, BooleanSupplier condition,
            Duration timeout, String timeoutPortId) {
        this.type = type;
        this.portId = portId;
        this.waitTime = waitTime;
        this.condition = condition;
        this.timeout = timeout;
        this.timeoutPortId = timeoutPortId;
    }

    public static NodeResult next() {
        return next(DEFAULT_PORT);
    }

    /** Continue immediately through the given output port. */
    public static NodeResult next(String portId) {
        return new NodeResult(NodeResultType.CONTINUE, portId, Duration.ZERO, null, null, null);
    }

    /** Suspend for {@code time}, then follow {@code portId}. */
    public static NodeResult waitFor(Duration time, String portId) {
        Objects.requireNonNull(time, "time");
        if (time.isNegative())
            throw new IllegalArgumentException("Wait time must not be negative: " + time);
        return new NodeResult(NodeResultType.WAIT, portId, time, null, null, null);
    }

    public static NodeResult waitForSeconds(double seconds, String portId) {
        return waitFor(Duration.ofNanos((long) (Math.max(0.0, seconds) * 1_000_000_000L)), portId);
    }

    /** Suspend until {@code condition} returns true. */
    public static NodeResult waitUntil(BooleanSupplier condition, String portId) {
        Objects.requireNonNull(condition, "condition");
        return new NodeResult(NodeResultType.WAIT_FOR_CONDITION, portId, Duration.ZERO, condition, null, null);
    }

    /**
     * Suspend until {@code condition} returns true, or follow
     * {@code timeoutPortId} once {@code timeout} has elapsed.
     */
    public static NodeResult waitUntil(BooleanSupplier condition, String portId, Duration timeout,
            String timeoutPortId) {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(timeout, "timeout");
        return new NodeResult(NodeResultType.WAIT_FOR_CONDITION, portId, Duration.ZERO, condition, timeout,
                timeoutPortId);
    }

    public static NodeResult waitForInput() {
        return waitForInput(DEFAULT_PORT);
    }

    public static NodeResult waitForInput(String portId) {
        return new NodeResult(NodeResultType.WAIT_FOR_INPUT, portId, Duration.ZERO, null, null, null);
    }

    public static NodeResult end() {
        return END;
    }

    public NodeResultType type() {
        return type;
    }

    /** Output port to follow; {@code null} only for END. */
    public String portId() {
        return portId;
    }

    public Duration waitTime() {
        return waitTime;
    }

    public BooleanSupplier condition() {
        return condition;
    }

    /** Condition timeout, or {@code null} to wait indefinitely. */
    public Duration timeout() {
        return timeout;
    }

    public String timeoutPortId() {
        return timeoutPortId;
    }

    @Override
    public String toString() {
        return "NodeResult[" + type + (portId != null ? " -> " + portId : "") + "]";
    }
}
