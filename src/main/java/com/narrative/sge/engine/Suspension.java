package com.narrative.sge.engine;

import com.narrative.sge.api.TraversalState;

import java.util.function.BooleanSupplier;

/**
 * A pending suspension of a run.
 *
 * @param kind        WAITING, WAITING_FOR_CONDITION or WAITING_FOR_INPUT
 * @param port        output port followed when the suspension resolves normally
 * @param deadline    clock time (nanos) of the wait end or timeout;
 *                    {@link #NO_DEADLINE} when there is none
 * @param condition   predicate polled each tick, WAITING_FOR_CONDITION only
 * @param timeoutPort port followed when the deadline passes first
 * @param generation  run generation that created the suspension
 */
record Suspension(TraversalState kind, String port, long deadline, BooleanSupplier condition, String timeoutPort,
        long generation) {

    static final long NO_DEADLINE = Long.MAX_VALUE;

    boolean hasDeadline() {
        return deadline != NO_DEADLINE;
    }

    boolean expired(long now) {
        return hasDeadline() && now - deadline >= 0;
    }

    /** Same suspension with the deadline moved by {@code nanos}, e.g. after a pause. */
    Suspension postpone(long nanos) {
        if (!hasDeadline())
            return this;
        return new Suspension(kind, port, deadline + nanos, condition, timeoutPort, generation);
    }
}
