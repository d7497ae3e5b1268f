package com.narrative.sge.graph;

/** How many connections a port accepts. */
public enum PortCapacity {
    SINGLE,
    MULTI
}
