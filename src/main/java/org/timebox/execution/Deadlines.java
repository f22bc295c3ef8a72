package org.timebox.execution;

import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.timebox.execution.scope.CancellationScope;
import org.timebox.execution.timer.DeadlineTimer;
import org.timebox.execution.timer.TimerHandle;
import org.timebox.metric.MetricName;
import org.timebox.metric.Metrics;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs asynchronous work with a time budget.
 * <p>
 * The work is started inline in a new child scope of the given parent. When the budget elapses before the work
 * completes, the scope is cancelled with a {@link TimeoutCancellationException} which fails the work at its
 * next suspension point.
 * <p>
 * <b>The deadline has the last word.</b> Once it has fired, the invocation ends with the timeout even if the
 * work catches the {@link TimeoutCancellationException} and returns a value or fails differently: the raising
 * variant still fails with the timeout and the optional variant still returns an empty result. The same holds
 * for a cancellation coming from the parent scope, which is passed to the caller unchanged.
 */
public class Deadlines {

    private final DeadlineTimer deadlineTimer;
    private final Metrics metrics;

    public Deadlines(DeadlineTimer deadlineTimer, Metrics metrics) {
        this.deadlineTimer = Objects.requireNonNull(deadlineTimer);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * Runs the work in a child scope of {@code parent} and fails with {@link TimeoutCancellationException} if the
     * deadline elapses first. Otherwise returns the work's result or fails with its error.
     *
     * @throws IllegalArgumentException if {@code time} is negative
     */
    public <T> Future<T> runWithDeadline(CancellationScope parent, long time, TimeUnit unit, DeadlineWork<T> work) {
        validate(parent, time, unit, work);

        if (time == 0) {
            metrics.updateDeadlineMetric(MetricName.deadline_immediate_timeout, ThrowingBoundedTask.VARIANT);
            return Future.failedFuture(new TimeoutCancellationException("Timed out immediately"));
        }

        return new ThrowingBoundedTask<T>(parent, time, unit, metrics).start(deadlineTimer, work);
    }

    /**
     * Same as {@link #runWithDeadline(CancellationScope, long, TimeUnit, DeadlineWork)} in a new root scope.
     */
    public <T> Future<T> runWithDeadline(long time, TimeUnit unit, DeadlineWork<T> work) {
        return runWithDeadline(CancellationScope.root(), time, unit, work);
    }

    /**
     * Same as {@link #runWithDeadline(long, TimeUnit, DeadlineWork)} with budget in milliseconds.
     */
    public <T> Future<T> runWithDeadline(long timeMs, DeadlineWork<T> work) {
        return runWithDeadline(timeMs, TimeUnit.MILLISECONDS, work);
    }

    /**
     * Runs the work in a child scope of {@code parent} and returns empty result if this invocation's deadline
     * elapses first. Otherwise returns the work's result or fails with its error.
     * <p>
     * Only the timeout raised by this invocation is turned into an empty result: a timeout of an enclosing
     * deadline propagates as a failure. A {@code null} result of the work is returned as empty too.
     *
     * @throws IllegalArgumentException if {@code time} is negative
     */
    public <T> Future<Optional<T>> runWithDeadlineOrNone(CancellationScope parent,
                                                         long time,
                                                         TimeUnit unit,
                                                         DeadlineWork<T> work) {

        validate(parent, time, unit, work);

        if (time == 0) {
            metrics.updateDeadlineMetric(MetricName.deadline_immediate_timeout, OptionalBoundedTask.VARIANT);
            return Future.succeededFuture(Optional.empty());
        }

        return new OptionalBoundedTask<T>(parent, time, unit, metrics).start(deadlineTimer, work);
    }

    /**
     * Same as {@link #runWithDeadlineOrNone(CancellationScope, long, TimeUnit, DeadlineWork)} in a new root scope.
     */
    public <T> Future<Optional<T>> runWithDeadlineOrNone(long time, TimeUnit unit, DeadlineWork<T> work) {
        return runWithDeadlineOrNone(CancellationScope.root(), time, unit, work);
    }

    /**
     * Same as {@link #runWithDeadlineOrNone(long, TimeUnit, DeadlineWork)} with budget in milliseconds.
     */
    public <T> Future<Optional<T>> runWithDeadlineOrNone(long timeMs, DeadlineWork<T> work) {
        return runWithDeadlineOrNone(timeMs, TimeUnit.MILLISECONDS, work);
    }

    /**
     * Suspends the work of the given scope for the given time. Fails with the cancellation cause if the scope
     * gets cancelled first, releasing the underlying timer.
     *
     * @throws IllegalArgumentException if {@code time} is negative
     */
    public Future<Void> delay(CancellationScope scope, long time, TimeUnit unit) {
        Objects.requireNonNull(scope);
        Objects.requireNonNull(unit);
        if (time < 0) {
            throw new IllegalArgumentException("Delay time %d cannot be negative".formatted(time));
        }

        if (time == 0) {
            return Future.succeededFuture();
        }

        final Promise<Void> elapsed = Promise.promise();
        final TimerHandle timerHandle = deadlineTimer.register(time, unit, () -> elapsed.tryComplete());

        return scope.await(elapsed.future())
                .onFailure(ignored -> timerHandle.dispose());
    }

    private static void validate(CancellationScope parent, long time, TimeUnit unit, DeadlineWork<?> work) {
        Objects.requireNonNull(parent);
        Objects.requireNonNull(unit);
        Objects.requireNonNull(work);
        if (time < 0) {
            throw new IllegalArgumentException("Timeout time %d cannot be negative".formatted(time));
        }
    }
}
