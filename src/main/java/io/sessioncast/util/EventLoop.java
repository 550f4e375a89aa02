package io.sessioncast.util;

/**
 * Single logical thread that owns every link, capture and orchestrator state change.
 *
 * <p>Components are confined to the loop: their public methods are called from loop tasks only,
 * and callbacks arriving on other threads (socket events, worker completions) are re-posted with
 * {@link #execute(Runnable)}. Tasks run in submission order.
 */
public interface EventLoop {
    void execute(Runnable task);

    TimerHandle schedule(Runnable task, long delayMs);

    long nowMs();
}
