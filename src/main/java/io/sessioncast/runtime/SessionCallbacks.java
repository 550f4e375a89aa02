package io.sessioncast.runtime;

import io.sessioncast.model.LimitExceededNotice;

/**
 * Requests a session handler escalates to the orchestrator.
 */
public interface SessionCallbacks {
    void onCreateSessionRequested(String requestedName);

    void onKillRequested(String sessionName);

    void onLimitExceeded(String sessionName, LimitExceededNotice notice);
}
