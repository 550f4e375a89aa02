package io.sessioncast.relay;

import io.sessioncast.model.LimitExceededNotice;
import io.sessioncast.model.RelayMessage;

/**
 * Typed events of a {@link RelayLink}. Every method runs on the link's event loop.
 */
public interface RelayLinkListener {
    default void onConnected() {
    }

    default void onDisconnected(int code, String reason) {
    }

    default void onKeys(String keys) {
    }

    default void onResize(int cols, int rows) {
    }

    default void onCreateSessionRequested(String sessionName) {
    }

    /**
     * The link destroys itself right after this returns.
     */
    default void onKillSessionRequested() {
    }

    default void onProtocolError(RelayProtocolException error) {
    }

    default void onTransportError(Throwable error) {
    }

    /**
     * Terminal condition: the link is already destroyed and will never reconnect.
     */
    default void onLimitExceeded(LimitExceededNotice notice) {
    }

    default void onMessage(RelayMessage message) {
    }
}
