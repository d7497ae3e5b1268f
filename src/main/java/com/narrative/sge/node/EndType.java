package com.narrative.sge.node;

/** How a story ends. Informational; every End node completes its run successfully. */
public enum EndType {
    COMPLETE,
    FAILED,
    CHECKPOINT,
    TRANSITION
}
