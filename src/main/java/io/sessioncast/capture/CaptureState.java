package io.sessioncast.capture;

/**
 * What one session last sent and when. Owned by a single {@link CaptureScheduler}.
 */
final class CaptureState {
    static final long FORCE_SEND_INTERVAL_MS = 10_000L;
    static final long ACTIVE_THRESHOLD_MS = 2_000L;
    static final long ACTIVE_INTERVAL_MS = 50L;
    static final long IDLE_INTERVAL_MS = 200L;

    private String lastScreenContent;
    private long lastChangeAtMs;
    private long lastForceSendAtMs;

    boolean changed(String snapshot) {
        return lastScreenContent == null || !lastScreenContent.equals(snapshot);
    }

    /**
     * Send on change, on the first snapshot, or once the last send is older than the force interval.
     */
    boolean shouldSend(String snapshot, long nowMs) {
        return changed(snapshot) || nowMs - lastForceSendAtMs > FORCE_SEND_INTERVAL_MS;
    }

    void recordSend(String snapshot, long nowMs) {
        if (changed(snapshot)) {
            lastChangeAtMs = nowMs;
        }
        lastScreenContent = snapshot;
        lastForceSendAtMs = nowMs;
    }

    long nextDelayMs(long nowMs) {
        boolean active = lastScreenContent != null && nowMs - lastChangeAtMs < ACTIVE_THRESHOLD_MS;
        return active ? ACTIVE_INTERVAL_MS : IDLE_INTERVAL_MS;
    }

    String lastScreenContent() {
        return lastScreenContent;
    }

    long lastChangeAtMs() {
        return lastChangeAtMs;
    }

    long lastForceSendAtMs() {
        return lastForceSendAtMs;
    }
}
