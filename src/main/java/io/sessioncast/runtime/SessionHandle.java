package io.sessioncast.runtime;

/**
 * What the orchestrator holds for one tracked session.
 */
public interface SessionHandle {
    void start();

    /**
     * Idempotent.
     */
    void stop();
}
