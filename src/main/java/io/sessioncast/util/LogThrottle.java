package io.sessioncast.util;

import java.util.function.LongSupplier;

/**
 * Lets one log line through per interval; counts the ones it held back.
 */
public final class LogThrottle {
    private final long intervalMs;
    private final LongSupplier clock;
    private long lastEmitMs = Long.MIN_VALUE;
    private long suppressed;

    public LogThrottle(long intervalMs, LongSupplier clock) {
        if (intervalMs <= 0L) {
            throw new IllegalArgumentException("intervalMs must be positive");
        }
        this.intervalMs = intervalMs;
        this.clock = clock;
    }

    /**
     * @return number of suppressed lines since the last emit plus one when the caller should log
     *         now, or {@code 0} when the line should be dropped
     */
    public synchronized long tryAcquire() {
        long now = clock.getAsLong();
        if (lastEmitMs != Long.MIN_VALUE && now - lastEmitMs < intervalMs) {
            suppressed++;
            return 0L;
        }
        lastEmitMs = now;
        long out = suppressed + 1L;
        suppressed = 0L;
        return out;
    }
}
