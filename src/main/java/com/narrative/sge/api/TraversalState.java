package com.narrative.sge.api;

/**
 * States of a single traversal run.
 *
 * IDLE is initial and COMPLETE is terminal. The three WAITING states and
 * PAUSED are suspensions; RUNNING means the engine has work it can do on the
 * next tick without any external signal.
 */
public enum TraversalState {
    IDLE,
    RUNNING,
    PAUSED,
    WAITING,
    WAITING_FOR_CONDITION,
    WAITING_FOR_INPUT,
    COMPLETE;

    public boolean isSuspended() {
        return this == PAUSED || this == WAITING || this == WAITING_FOR_CONDITION || this == WAITING_FOR_INPUT;
    }

    public boolean isActive() {
        return this != IDLE && this != COMPLETE;
    }
}
