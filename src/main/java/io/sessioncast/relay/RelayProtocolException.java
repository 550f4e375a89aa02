package io.sessioncast.relay;

public final class RelayProtocolException extends Exception {
    public RelayProtocolException(String message) {
        super(message);
    }

    public RelayProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
