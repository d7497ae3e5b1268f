package com.narrative.sge.util;

import org.apache.logging.log4j.Logger;

import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Limits the rate of error logging.
 *
 * Used where a misbehaving callback could otherwise flood the log once per
 * tick. At most one entry is written per interval; the entry carries the
 * number of failures suppressed since the previous one.
 */
public class ErrorRateLimiter {
    private final Logger logger;
    private final long minIntervalNanos;
    private final LongSupplier clock;
    private final AtomicLong lastLogTime;
    private final AtomicLong suppressed = new AtomicLong();

    public ErrorRateLimiter(Logger logger, long minIntervalMillis) {
        this(logger, minIntervalMillis, System::nanoTime);
    }

    public ErrorRateLimiter(Logger logger, long minIntervalMillis, LongSupplier clock) {
        this.logger = logger;
        this.minIntervalNanos = minIntervalMillis * 1_000_000;
        this.clock = clock;
        this.lastLogTime = new AtomicLong(clock.getAsLong() - minIntervalNanos - 1);
    }

    /** @return true if the entry was written, false if it was throttled */
    public boolean log(String message, Throwable t) {
        long now = clock.getAsLong();
        long last = lastLogTime.get();
        // Only one thread may log per interval.
        if (now - last > minIntervalNanos && lastLogTime.compareAndSet(last, now)) {
            long dropped = suppressed.getAndSet(0);
            if (dropped > 0)
                logger.error("{} ({} similar errors suppressed)", message, dropped, t);
            else
                logger.error(message, t);
            return true;
        }
        suppressed.incrementAndGet();
        return false;
    }

    public long suppressedCount() {
        return suppressed.get();
    }
}
