package io.sessioncast.model;

public record SessionIdentity(String machineId, String localSessionName) {
    public static final String SEPARATOR = "/";

    public SessionIdentity {
        if (machineId == null || machineId.isBlank()) {
            throw new IllegalArgumentException("machineId cannot be empty");
        }
        if (localSessionName == null || localSessionName.isEmpty()) {
            throw new IllegalArgumentException("session name cannot be empty");
        }
    }

    /**
     * Globally unique id used by the relay as routing key.
     */
    public String sessionId() {
        return machineId + SEPARATOR + localSessionName;
    }

    @Override
    public String toString() {
        return sessionId();
    }
}
