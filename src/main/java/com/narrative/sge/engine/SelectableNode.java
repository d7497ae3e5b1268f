package com.narrative.sge.engine;

import java.time.Duration;

/**
 * A node that suspends for a player selection among presented options.
 *
 * Presented indexes refer to the options as shown to the player, after
 * filtering and shuffling. Implementations map them back to their declared
 * options and return the output port to follow.
 */
public interface SelectableNode {

    /** Number of options presented in the current visit. */
    int presentedCount(ExecutionContext context);

    /**
     * Applies the selection of the presented option at {@code presentedIndex}.
     *
     * @return the output port to follow, or null if the index is out of range
     */
    String select(ExecutionContext context, int presentedIndex);

    /** Time after which {@link #selectFallback} applies; zero disables it. */
    Duration selectionTimeout();

    /**
     * Applies the fallback selection after a timeout.
     *
     * @return the output port to follow, or null if nothing can be selected
     */
    String selectFallback(ExecutionContext context);
}
