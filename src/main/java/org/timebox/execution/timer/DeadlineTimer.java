package org.timebox.execution.timer;

import java.util.concurrent.TimeUnit;

/**
 * Time source that fires a one-shot callback after a delay.
 */
public interface DeadlineTimer {

    /**
     * Schedules a single invocation of {@code onFire} no earlier than {@code time} after this call.
     * <p>
     * Implementations may deliver the callback on any thread.
     *
     * @param time positive delay
     * @param unit unit of the delay
     * @param onFire callback to run when the delay elapses
     * @return handle allowing to suppress the pending invocation
     */
    TimerHandle register(long time, TimeUnit unit, Runnable onFire);
}
