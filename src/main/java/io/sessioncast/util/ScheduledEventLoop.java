package io.sessioncast.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

public final class ScheduledEventLoop implements EventLoop, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ScheduledEventLoop.class);

    private final ScheduledExecutorService executor;
    private volatile Thread loopThread;

    public ScheduledEventLoop(String threadName) {
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, threadName);
            loopThread = thread;
            return thread;
        });
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public TimerHandle schedule(Runnable task, long delayMs) {
        ScheduledFuture<?> future = executor.schedule(guarded(task), Math.max(0L, delayMs), TimeUnit.MILLISECONDS);
        return () -> future.cancel(false);
    }

    @Override
    public long nowMs() {
        return System.currentTimeMillis();
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    /**
     * Runs {@code task} on the loop and waits for its result. Runs inline when already on the loop.
     */
    public <T> T call(Callable<T> task, long timeoutMs) throws Exception {
        if (inLoop()) {
            return task.call();
        }
        Future<T> future = executor.submit(task);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            throw e;
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOGGER.error("Event loop task failed", e);
            }
        };
    }
}
