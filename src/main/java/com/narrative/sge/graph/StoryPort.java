package com.narrative.sge.graph;

import java.util.Objects;

/**
 * A named connection point on a node.
 *
 * Port ids are unique among the owning node's ports of the same direction.
 * Input ports default to {@link PortCapacity#MULTI} (many predecessors may
 * converge), output ports to {@link PortCapacity#SINGLE} (an output leads to
 * exactly one successor).
 */
public final class StoryPort {
    private final String id;
    private final String name;
    private final PortDirection direction;
    private final PortCapacity capacity;

    public StoryPort(String id, String name, PortDirection direction, PortCapacity capacity) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.direction = Objects.requireNonNull(direction, "direction");
        this.capacity = Objects.requireNonNull(capacity, "capacity");
    }

    public static StoryPort input(String id, String name) {
        return new StoryPort(id, name, PortDirection.INPUT, PortCapacity.MULTI);
    }

    public static StoryPort output(String id, String name) {
        return new StoryPort(id, name, PortDirection.OUTPUT, PortCapacity.SINGLE);
    }

    public String id() {
        return id;
    }

    public String name() {
        return name;
    }

    public PortDirection direction() {
        return direction;
    }

    public PortCapacity capacity() {
        return capacity;
    }

    @Override
    public String toString() {
        return direction + ":" + id;
    }
}
