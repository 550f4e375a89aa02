package io.sessioncast.relay;

public record ReconnectDecision(Kind kind, int attempt, long delayMs) {
    public enum Kind {
        /** Connect once after {@code delayMs}. */
        ATTEMPT,
        /** Breaker just tripped; check again after the full cooldown. */
        CIRCUIT_OPENED,
        /** Breaker still open; check again after the remaining interval. */
        CIRCUIT_WAIT,
        NONE
    }

    static ReconnectDecision attempt(int attempt, long delayMs) {
        return new ReconnectDecision(Kind.ATTEMPT, attempt, delayMs);
    }

    static ReconnectDecision circuitOpened(long delayMs) {
        return new ReconnectDecision(Kind.CIRCUIT_OPENED, 0, delayMs);
    }

    static ReconnectDecision circuitWait(long delayMs) {
        return new ReconnectDecision(Kind.CIRCUIT_WAIT, 0, delayMs);
    }

    static ReconnectDecision none() {
        return new ReconnectDecision(Kind.NONE, 0, 0L);
    }
}
