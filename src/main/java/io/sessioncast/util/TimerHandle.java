package io.sessioncast.util;

@FunctionalInterface
public interface TimerHandle {
    TimerHandle NONE = () -> {
    };

    /**
     * Cancels the pending task. Has no effect once the task ran or was already cancelled.
     */
    void cancel();
}
