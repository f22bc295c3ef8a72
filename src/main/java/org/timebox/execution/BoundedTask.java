package org.timebox.execution;

import io.vertx.core.AsyncResult;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import lombok.Getter;
import org.timebox.execution.scope.CancellationScope;
import org.timebox.execution.scope.ScopeState;
import org.timebox.execution.timer.DeadlineTimer;
import org.timebox.execution.timer.TimerHandle;
import org.timebox.log.Logger;
import org.timebox.log.LoggerFactory;
import org.timebox.metric.MetricName;
import org.timebox.metric.Metrics;

import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

/**
 * Cancellation scope wrapping work subject to a deadline. It is also the target of its own deadline timer.
 * <p>
 * Two events compete for the task: the timer firing ({@link #onFire()}) and the work finishing
 * ({@link #onWorkFinished(AsyncResult)}). Both settle through single compare-and-set transitions of the scope
 * state, so exactly one outcome reaches {@link #continuation} and the timer handle is disposed exactly once,
 * whatever the interleaving.
 * <p>
 * Once the scope is cancelling, by its own deadline or by the parent, the cancellation cause is the final
 * outcome even if the work suppressed it and produced a value or another error.
 *
 * @param <T> type of the work result
 * @param <R> type of the result delivered to the caller
 */
public abstract class BoundedTask<T, R> extends CancellationScope {

    private static final Logger logger = LoggerFactory.getLogger(BoundedTask.class);

    @Getter
    private final long time;

    @Getter
    private final TimeUnit unit;

    protected final Promise<R> continuation;

    private final Metrics metrics;

    private volatile TimerHandle timerHandle;

    BoundedTask(CancellationScope parent, long time, TimeUnit unit, Metrics metrics) {
        super(Objects.requireNonNull(parent));
        if (time <= 0) {
            throw new IllegalArgumentException("Bounded task time must be positive, got " + time);
        }

        this.time = time;
        this.unit = Objects.requireNonNull(unit);
        this.metrics = Objects.requireNonNull(metrics);
        continuation = Promise.promise();
    }

    /**
     * Arms the deadline, links this task to its parent and runs the work inline.
     *
     * @return future completed once with the final outcome, or failed without running the work if the deadline
     * could not be armed
     */
    Future<R> start(DeadlineTimer deadlineTimer, DeadlineWork<T> work) {
        try {
            timerHandle = deadlineTimer.register(time, unit, this::onFire);
        } catch (RuntimeException e) {
            logger.warn("{} could not arm its deadline", e, this);
            makeCompleted(e);
            return Future.failedFuture(e);
        }

        metrics.updateDeadlineMetric(MetricName.deadline_started, variant());
        linkToParent();

        runInline(work).onComplete(this::onWorkFinished);

        return continuation.future();
    }

    private Future<T> runInline(DeadlineWork<T> work) {
        try {
            final Future<T> result = work.run(this);
            return result != null
                    ? result
                    : Future.failedFuture(new IllegalStateException("Deadline work returned null future"));
        } catch (Throwable e) {
            return Future.failedFuture(e);
        }
    }

    /**
     * Deadline elapsed: cancels the work with a signal referencing this task. Does nothing once the task is
     * cancelling or completed.
     */
    void onFire() {
        if (cancel(TimeoutCancellationException.of(time, unit, this))) {
            logger.debug("{} timed out", this);
        }
    }

    /**
     * Completion arbiter. The first call moves the task into its terminal state, disposes the timer and
     * delivers the outcome; later calls do nothing.
     */
    void onWorkFinished(AsyncResult<T> result) {
        final Throwable workFailure = result.failed() ? result.cause() : null;

        final ScopeState terminal = makeCompleted(workFailure);
        if (terminal == null) {
            return;
        }

        timerHandle.dispose();

        final Throwable failure = terminal.getCause();
        if (failure != null && failure != workFailure && logger.isDebugEnabled()) {
            logger.debug("{} outcome superseded by cancellation: {}", this,
                    workFailure != null ? workFailure : "value");
        }

        metrics.updateDeadlineMetric(outcomeMetric(failure), variant());
        afterCompletion(failure == null ? result.result() : null, failure);
    }

    private MetricName outcomeMetric(Throwable failure) {
        if (failure == null) {
            return MetricName.deadline_completed;
        }
        if (isOwnTimeout(failure)) {
            return MetricName.deadline_timed_out;
        }
        return failure instanceof CancellationException ? MetricName.deadline_cancelled : MetricName.deadline_failed;
    }

    boolean isOwnTimeout(Throwable failure) {
        return failure instanceof TimeoutCancellationException
                && ((TimeoutCancellationException) failure).isRaisedBy(this);
    }

    public State getState() {
        final ScopeState current = state();
        return switch (current.getStatus()) {
            case ACTIVE -> State.ACTIVE;
            case CANCELLING -> isOwnTimeout(current.getCause()) ? State.CANCELLING_FROM_TIMEOUT : State.CANCELLING;
            case COMPLETED -> current.getCause() == null ? State.COMPLETED_NORMALLY : State.COMPLETED_WITH_ERROR;
        };
    }

    /**
     * Delivers the final outcome to {@link #continuation}. Called exactly once.
     *
     * @param value   work result, meaningful only when {@code failure} is {@code null}
     * @param failure final failure, {@code null} if the work succeeded
     */
    protected abstract void afterCompletion(T value, Throwable failure);

    /**
     * Entry point variant name used to tag metrics.
     */
    protected abstract String variant();

    @Override
    public String toString() {
        return "%s(%d %s)".formatted(getClass().getSimpleName(), time, unit);
    }

    public enum State {

        ACTIVE,
        CANCELLING_FROM_TIMEOUT,
        CANCELLING,
        COMPLETED_NORMALLY,
        COMPLETED_WITH_ERROR
    }
}
