package io.sessioncast.api;

public final class ApiException extends RuntimeException {
    private final int status;

    public ApiException(String message) {
        this(message, 0, null);
    }

    public ApiException(String message, int status, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * HTTP status, or {@code 0} when no response was received.
     */
    public int status() {
        return status;
    }
}
