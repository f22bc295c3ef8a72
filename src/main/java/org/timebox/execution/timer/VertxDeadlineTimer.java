package org.timebox.execution.timer;

import io.vertx.core.Vertx;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * {@link DeadlineTimer} backed by Vert.x timers.
 * <p>
 * Vert.x timers have millisecond resolution, so delays are rounded up to whole milliseconds.
 * Callbacks are delivered on the event loop of the context that registered them.
 */
public class VertxDeadlineTimer implements DeadlineTimer {

    private final Vertx vertx;

    public VertxDeadlineTimer(Vertx vertx) {
        this.vertx = Objects.requireNonNull(vertx);
    }

    @Override
    public TimerHandle register(long time, TimeUnit unit, Runnable onFire) {
        final VertxTimerHandle handle = new VertxTimerHandle(Objects.requireNonNull(onFire));
        handle.timerId = vertx.setTimer(toDelayMillis(time, unit), timerId -> handle.fire());
        return handle;
    }

    static long toDelayMillis(long time, TimeUnit unit) {
        final long millis = unit.toMillis(time);
        if (millis == Long.MAX_VALUE) {
            // saturated conversion, nothing left to round up
            return millis;
        }
        final long roundedUp = unit.convert(millis, TimeUnit.MILLISECONDS) < time ? millis + 1 : millis;
        return Math.max(roundedUp, 1L);
    }

    private class VertxTimerHandle extends OneShotTimerHandle {

        private volatile long timerId;

        VertxTimerHandle(Runnable onFire) {
            super(onFire);
        }

        @Override
        protected void release() {
            vertx.cancelTimer(timerId);
        }
    }
}
