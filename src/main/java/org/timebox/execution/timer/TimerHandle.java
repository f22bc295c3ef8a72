package org.timebox.execution.timer;

/**
 * Registration of a callback in {@link DeadlineTimer}.
 */
@FunctionalInterface
public interface TimerHandle {

    /**
     * Releases the registration. Suppresses the callback if it has not fired yet, does nothing otherwise.
     * Safe to call more than once and from any thread, never blocks.
     */
    void dispose();
}
