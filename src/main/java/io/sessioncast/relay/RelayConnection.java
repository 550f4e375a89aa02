package io.sessioncast.relay;

public interface RelayConnection {
    boolean isOpen();

    /**
     * Queues one text frame behind earlier frames on this connection without blocking.
     *
     * @return {@code false} when the connection is not open
     */
    boolean sendText(String frame);

    void close();
}
