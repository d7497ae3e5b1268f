package com.narrative.sge.api;

/** What the traversal engine should do after a node has executed. */
public enum NodeResultType {
    /** Follow the chosen output port immediately. */
    CONTINUE,
    /** Suspend for a fixed duration, then follow the port. */
    WAIT,
    /** Suspend until a predicate holds, polled once per tick. */
    WAIT_FOR_CONDITION,
    /** Suspend until the host sends input or selects a choice or port. */
    WAIT_FOR_INPUT,
    /** Finish the run successfully. */
    END
}
