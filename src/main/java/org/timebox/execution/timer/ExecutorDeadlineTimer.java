package org.timebox.execution.timer;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * {@link DeadlineTimer} tracking time on its own single daemon thread, for callers running without Vert.x.
 * Keeps the resolution of the requested unit.
 */
public class ExecutorDeadlineTimer implements DeadlineTimer, AutoCloseable {

    private final ScheduledThreadPoolExecutor executor;

    public ExecutorDeadlineTimer(String threadName) {
        Objects.requireNonNull(threadName);

        executor = new ScheduledThreadPoolExecutor(1, runnable -> {
            final Thread thread = Executors.defaultThreadFactory().newThread(runnable);
            thread.setName(threadName);
            thread.setDaemon(true);
            return thread;
        });
        executor.setRemoveOnCancelPolicy(true);
    }

    @Override
    public TimerHandle register(long time, TimeUnit unit, Runnable onFire) {
        final ExecutorTimerHandle handle = new ExecutorTimerHandle(Objects.requireNonNull(onFire));
        handle.scheduled = executor.schedule(handle::fire, time, unit);
        return handle;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    private static class ExecutorTimerHandle extends OneShotTimerHandle {

        private volatile ScheduledFuture<?> scheduled;

        ExecutorTimerHandle(Runnable onFire) {
            super(onFire);
        }

        @Override
        protected void release() {
            final ScheduledFuture<?> future = scheduled;
            if (future != null) {
                future.cancel(false);
            }
        }
    }
}
