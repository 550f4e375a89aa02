package io.sessioncast.relay;

/**
 * Connection bookkeeping owned by exactly one link.
 *
 * <p>While the circuit is open the attempt counter stays at zero and no attempt is planned before
 * {@link #circuitResetAtMs()}. Once destroyed, nothing leaves that state.
 */
public final class LinkState {
    private boolean connected;
    private int reconnectAttempts;
    private boolean circuitOpen;
    private long circuitResetAtMs;
    private boolean destroyed;

    public void markConnected() {
        if (destroyed) {
            return;
        }
        connected = true;
        reconnectAttempts = 0;
        circuitOpen = false;
    }

    public void markDisconnected() {
        connected = false;
    }

    public void markDestroyed() {
        destroyed = true;
        connected = false;
    }

    /**
     * Plans the next step after an unexpected close or a fired circuit check.
     */
    public ReconnectDecision nextReconnect(long nowMs, double jitterUnit) {
        if (destroyed) {
            return ReconnectDecision.none();
        }
        if (circuitOpen) {
            if (nowMs < circuitResetAtMs) {
                return ReconnectDecision.circuitWait(circuitResetAtMs - nowMs);
            }
            circuitOpen = false;
            reconnectAttempts = 0;
        }

        reconnectAttempts++;
        if (reconnectAttempts > ReconnectPolicy.MAX_RECONNECT_ATTEMPTS) {
            circuitOpen = true;
            circuitResetAtMs = nowMs + ReconnectPolicy.CIRCUIT_BREAKER_DURATION_MS;
            reconnectAttempts = 0;
            return ReconnectDecision.circuitOpened(ReconnectPolicy.CIRCUIT_BREAKER_DURATION_MS);
        }
        return ReconnectDecision.attempt(
                reconnectAttempts,
                ReconnectPolicy.jitteredDelayMs(reconnectAttempts, jitterUnit)
        );
    }

    public boolean connected() {
        return connected;
    }

    public int reconnectAttempts() {
        return reconnectAttempts;
    }

    public boolean circuitOpen() {
        return circuitOpen;
    }

    public long circuitResetAtMs() {
        return circuitResetAtMs;
    }

    public boolean destroyed() {
        return destroyed;
    }
}
