package io.sessioncast.relay;

/**
 * Socket events. Implementations may be invoked from transport threads.
 */
public interface TransportListener {
    void onOpen(RelayConnection connection);

    void onText(String frame);

    void onClosed(int code, String reason);

    void onError(Throwable error);
}
