package io.sessioncast.runtime;

@FunctionalInterface
public interface SessionHandleFactory {
    SessionHandle create(String sessionName, SessionCallbacks callbacks);
}
