package org.timebox.execution;

import org.timebox.execution.scope.CancellationScope;
import org.timebox.metric.Metrics;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Turns a timeout raised by this very task into an empty result. Any other failure, a timeout of an
 * enclosing deadline included, is re-raised.
 */
class OptionalBoundedTask<T> extends BoundedTask<T, Optional<T>> {

    static final String VARIANT = "optional";

    OptionalBoundedTask(CancellationScope parent, long time, TimeUnit unit, Metrics metrics) {
        super(parent, time, unit, metrics);
    }

    @Override
    protected void afterCompletion(T value, Throwable failure) {
        if (failure == null) {
            continuation.tryComplete(Optional.ofNullable(value));
        } else if (isOwnTimeout(failure)) {
            continuation.tryComplete(Optional.empty());
        } else {
            continuation.tryFail(failure);
        }
    }

    @Override
    protected String variant() {
        return VARIANT;
    }
}
