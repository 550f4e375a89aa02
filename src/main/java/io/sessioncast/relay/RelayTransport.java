package io.sessioncast.relay;

import java.net.URI;

public interface RelayTransport {
    /**
     * Starts an asynchronous connection attempt. The outcome arrives on {@code listener}: either
     * {@link TransportListener#onOpen(RelayConnection)}, or {@link TransportListener#onError(Throwable)}
     * followed by {@link TransportListener#onClosed(int, String)} when the attempt fails.
     */
    void open(URI uri, TransportListener listener);
}
