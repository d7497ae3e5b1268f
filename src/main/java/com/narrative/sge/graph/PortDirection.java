package com.narrative.sge.graph;

public enum PortDirection {
    INPUT,
    OUTPUT
}
