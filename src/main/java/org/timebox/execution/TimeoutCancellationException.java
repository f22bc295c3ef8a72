package org.timebox.execution;

import org.timebox.execution.scope.CancellationScope;

import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Signals that a deadline elapsed before the bounded work completed.
 * <p>
 * Remembers the bounded task whose deadline fired. Two signals with the same budget raised by different
 * invocations are never considered the same, see {@link #isRaisedBy(CancellationScope)}.
 */
@SuppressWarnings("serial")
public class TimeoutCancellationException extends CancellationException {

    private final transient CancellationScope task;

    /**
     * Creates signal not owned by any bounded task.
     */
    public TimeoutCancellationException(String message) {
        this(message, null);
    }

    TimeoutCancellationException(String message, CancellationScope task) {
        super(message);
        this.task = task;
    }

    static TimeoutCancellationException of(long time, TimeUnit unit, CancellationScope task) {
        return new TimeoutCancellationException("Timed out waiting for %d %s".formatted(time, unit), task);
    }

    /**
     * Tells whether this signal was raised by the deadline of the given scope. Compares identity.
     */
    public boolean isRaisedBy(CancellationScope scope) {
        return task != null && task == scope;
    }
}
