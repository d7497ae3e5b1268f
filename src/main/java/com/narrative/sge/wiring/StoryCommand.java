package com.narrative.sge.wiring;

/**
 * A mutable command slot in the Disruptor ring buffer.
 *
 * Instances are pre-allocated when the ring buffer is built and reused for
 * every command, so posting input from a presentation thread allocates
 * nothing beyond the strings it carries.
 *
 * Fields:
 * - type: what to do; see {@link Type}.
 * - runId: the target run, or null for the session's current run.
 * - index: presented choice index for SELECT_CHOICE.
 * - target: port id for SELECT_PORT, node id for JUMP.
 */
public final class StoryCommand {

    public enum Type {
        TICK, SEND_INPUT, SELECT_CHOICE, SELECT_PORT, PAUSE, RESUME, STOP, JUMP
    }

    private Type type;
    private String runId;
    private int index = -1;
    private String target;
    private long sequenceId;

    public void set(Type type, String runId, int index, String target, long seqId) {
        this.type = type;
        this.runId = runId;
        this.index = index;
        this.target = target;
        this.sequenceId = seqId;
    }

    public Type type() {
        return type;
    }

    public String runId() {
        return runId;
    }

    public int index() {
        return index;
    }

    public String target() {
        return target;
    }

    public long sequenceId() {
        return sequenceId;
    }

    public void clear() {
        type = null;
        runId = null;
        index = -1;
        target = null;
        sequenceId = 0;
    }

    @Override
    public String toString() {
        return "StoryCommand[" + type + " run=" + runId + " index=" + index + " target=" + target + "]";
    }
}
