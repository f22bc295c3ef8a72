package org.timebox.execution.timer;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link TimerHandle} settling the race between its fire and its disposal: whichever comes first wins,
 * the other one does nothing.
 */
abstract class OneShotTimerHandle implements TimerHandle {

    private final AtomicBoolean spent = new AtomicBoolean();

    private final Runnable onFire;

    OneShotTimerHandle(Runnable onFire) {
        this.onFire = onFire;
    }

    void fire() {
        if (spent.compareAndSet(false, true)) {
            onFire.run();
        }
    }

    @Override
    public void dispose() {
        if (spent.compareAndSet(false, true)) {
            release();
        }
    }

    /**
     * Cancels underlying scheduled callback.
     */
    protected abstract void release();
}
