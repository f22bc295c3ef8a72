package org.timebox.execution;

import org.timebox.execution.scope.CancellationScope;
import org.timebox.metric.Metrics;

import java.util.concurrent.TimeUnit;

/**
 * Re-raises every failure to the caller, its own timeout included.
 */
class ThrowingBoundedTask<T> extends BoundedTask<T, T> {

    static final String VARIANT = "raising";

    ThrowingBoundedTask(CancellationScope parent, long time, TimeUnit unit, Metrics metrics) {
        super(parent, time, unit, metrics);
    }

    @Override
    protected void afterCompletion(T value, Throwable failure) {
        if (failure != null) {
            continuation.tryFail(failure);
        } else {
            continuation.tryComplete(value);
        }
    }

    @Override
    protected String variant() {
        return VARIANT;
    }
}
