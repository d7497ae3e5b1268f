package com.narrative.sge.engine;

import java.util.Random;
import java.util.function.LongSupplier;

import lombok.Builder;
import lombok.Getter;

/**
 * Settings of a {@link TraversalEngine}.
 *
 * <pre>
 * EngineConfig config = EngineConfig.builder()
 *         .debugMode(true)
 *         .storeKind(StoreKind.COLUMNAR)
 *         .randomSeed(42L)
 *         .build();
 * </pre>
 */
@Getter
@Builder(toBuilder = true)
public final class EngineConfig {
    /** Honour node breakpoints and log every node entry at info. */
    @Builder.Default
    private final boolean debugMode = false;

    /** Node executions per tick before the engine yields to the next tick. */
    @Builder.Default
    private final int maxStepsPerTick = 10_000;

    @Builder.Default
    private final StoreKind storeKind = StoreKind.MAP;

    /** Seed for shuffles and random operations; null seeds from entropy. */
    @Builder.Default
    private final Long randomSeed = null;

    /** Monotonic nanosecond clock used for waits and timeouts. */
    @Builder.Default
    private final LongSupplier clock = System::nanoTime;

    public static EngineConfig defaults() {
        return builder().build();
    }

    Random newRandom() {
        return randomSeed == null ? new Random() : new Random(randomSeed);
    }
}
