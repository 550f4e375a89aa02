package io.sessioncast.util;

import java.util.PriorityQueue;

/**
 * Deterministic {@link EventLoop} on virtual time. Nothing runs until the test advances the clock.
 */
public final class ManualEventLoop implements EventLoop {
    private final PriorityQueue<Task> queue = new PriorityQueue<>((a, b) -> {
        int byTime = Long.compare(a.dueAtMs, b.dueAtMs);
        return byTime != 0 ? byTime : Long.compare(a.seq, b.seq);
    });
    private long nowMs;
    private long seq;

    public ManualEventLoop() {
        this(0L);
    }

    public ManualEventLoop(long startMs) {
        this.nowMs = startMs;
    }

    @Override
    public void execute(Runnable task) {
        queue.add(new Task(nowMs, seq++, task));
    }

    @Override
    public TimerHandle schedule(Runnable task, long delayMs) {
        Task scheduled = new Task(nowMs + Math.max(0L, delayMs), seq++, task);
        queue.add(scheduled);
        return () -> scheduled.cancelled = true;
    }

    @Override
    public long nowMs() {
        return nowMs;
    }

    /**
     * Runs everything due at the current instant, including tasks those tasks post.
     */
    public void runPending() {
        advance(0L);
    }

    public void advance(long deltaMs) {
        long target = nowMs + deltaMs;
        while (!queue.isEmpty() && queue.peek().dueAtMs <= target) {
            Task next = queue.poll();
            nowMs = Math.max(nowMs, next.dueAtMs);
            if (!next.cancelled) {
                next.runnable.run();
            }
        }
        nowMs = target;
    }

    public int pendingTasks() {
        int count = 0;
        for (Task task : queue) {
            if (!task.cancelled) {
                count++;
            }
        }
        return count;
    }

    private static final class Task {
        private final long dueAtMs;
        private final long seq;
        private final Runnable runnable;
        private boolean cancelled;

        private Task(long dueAtMs, long seq, Runnable runnable) {
            this.dueAtMs = dueAtMs;
            this.seq = seq;
            this.runnable = runnable;
        }
    }
}
