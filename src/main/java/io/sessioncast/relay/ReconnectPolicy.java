package io.sessioncast.relay;

/**
 * Backoff and circuit-breaker constants shared by every relay link.
 */
public final class ReconnectPolicy {
    public static final int MAX_RECONNECT_ATTEMPTS = 5;
    public static final long BASE_RECONNECT_DELAY_MS = 2_000L;
    public static final long MAX_RECONNECT_DELAY_MS = 60_000L;
    public static final long CIRCUIT_BREAKER_DURATION_MS = 120_000L;
    public static final double JITTER_RATIO = 0.5d;

    private ReconnectPolicy() {
    }

    /**
     * {@code min(base * 2^(attempt-1), max)} for attempts starting at 1.
     */
    public static long baseDelayMs(int attempt) {
        if (attempt < 1) {
            throw new IllegalArgumentException("attempt must be >= 1: " + attempt);
        }
        long delay = BASE_RECONNECT_DELAY_MS;
        for (int i = 1; i < attempt; i++) {
            if (delay >= MAX_RECONNECT_DELAY_MS / 2L) {
                return MAX_RECONNECT_DELAY_MS;
            }
            delay *= 2L;
        }
        return Math.min(delay, MAX_RECONNECT_DELAY_MS);
    }

    /**
     * Adds {@code jitterUnit * 0.5 * delay} to the base delay, {@code jitterUnit} in {@code [0, 1)}.
     */
    public static long jitteredDelayMs(int attempt, double jitterUnit) {
        long delay = baseDelayMs(attempt);
        double unit = Math.max(0d, Math.min(jitterUnit, Math.nextDown(1d)));
        return (long) Math.floor(delay + unit * delay * JITTER_RATIO);
    }
}
