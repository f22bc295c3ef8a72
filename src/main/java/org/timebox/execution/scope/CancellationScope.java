package org.timebox.execution.scope;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.Promise;
import org.timebox.log.Logger;
import org.timebox.log.LoggerFactory;

import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Hierarchical context that can be asked to terminate its owned work with a given error.
 * <p>
 * Cancellation is cooperative: work observes it only at its suspension points, i.e. futures awaited through
 * {@link #await(Future)}. A child scope is cancelled with its parent's cause and detaches from the parent once
 * completed. All transitions are lock-free and may happen on any thread.
 */
public class CancellationScope {

    private static final Logger logger = LoggerFactory.getLogger(CancellationScope.class);

    private final CancellationScope parent;
    private final AtomicReference<ScopeState> state = new AtomicReference<>(ScopeState.ACTIVE);
    private final Set<Handler<Throwable>> cancellationHandlers = ConcurrentHashMap.newKeySet();
    private final Handler<Throwable> parentCancellationHandler = this::cancel;

    protected CancellationScope(CancellationScope parent) {
        this.parent = parent;
    }

    /**
     * Creates scope without parent.
     */
    public static CancellationScope root() {
        return new CancellationScope(null);
    }

    /**
     * Creates scope cancelled together with this one.
     */
    public CancellationScope child() {
        final CancellationScope child = new CancellationScope(this);
        child.linkToParent();
        return child;
    }

    /**
     * Subscribes this scope to cancellation of its parent. Cancels this scope right away if the parent is
     * already cancelling.
     */
    protected void linkToParent() {
        if (parent != null) {
            parent.onCancellation(parentCancellationHandler);
        }
    }

    /**
     * Cancels this scope with the given cause. Only the first call on an active scope has an effect.
     *
     * @return true if this call moved scope into cancelling state
     */
    public boolean cancel(Throwable cause) {
        Objects.requireNonNull(cause);

        final ScopeState cancelling = ScopeState.of(ScopeState.Status.CANCELLING, cause);
        if (!state.compareAndSet(ScopeState.ACTIVE, cancelling)) {
            return false;
        }

        for (Handler<Throwable> handler : cancellationHandlers) {
            if (cancellationHandlers.remove(handler)) {
                notifyHandler(handler, cause);
            }
        }
        return true;
    }

    /**
     * Completes this scope. A cancelling scope keeps its cancellation cause.
     *
     * @return true if this call completed the scope
     */
    public boolean complete() {
        return makeCompleted(null) != null;
    }

    /**
     * Moves this scope into completed state and detaches it from its parent. The cancellation cause, if any,
     * takes precedence over the given failure.
     *
     * @param failure failure of the owned work, {@code null} if it succeeded
     * @return terminal state reached by this call or {@code null} if the scope had already been completed
     */
    protected ScopeState makeCompleted(Throwable failure) {
        ScopeState current;
        ScopeState completed;
        do {
            current = state.get();
            if (current.getStatus() == ScopeState.Status.COMPLETED) {
                return null;
            }
            final Throwable cause = current.getCause() != null ? current.getCause() : failure;
            completed = ScopeState.of(ScopeState.Status.COMPLETED, cause);
        } while (!state.compareAndSet(current, completed));

        // handlers still pending here are being notified by cancel() or remove themselves on completion
        if (parent != null) {
            parent.removeCancellationHandler(parentCancellationHandler);
        }
        return completed;
    }

    /**
     * Suspension point of the owned work: returns future mirroring the given one, or failing with the
     * cancellation cause if this scope gets cancelled first.
     */
    public <T> Future<T> await(Future<T> future) {
        Objects.requireNonNull(future);

        final Promise<T> promise = Promise.promise();
        final Handler<Throwable> cancellationHandler = promise::tryFail;

        onCancellation(cancellationHandler);
        future.onComplete(result -> {
            removeCancellationHandler(cancellationHandler);
            if (result.succeeded()) {
                promise.tryComplete(result.result());
            } else {
                promise.tryFail(result.cause());
            }
        });

        return promise.future();
    }

    /**
     * Registers handler called once with the cancellation cause. Called immediately if this scope is already
     * cancelling; never called if the scope completes first.
     */
    public void onCancellation(Handler<Throwable> handler) {
        Objects.requireNonNull(handler);

        final ScopeState current = state.get();
        if (current.getStatus() == ScopeState.Status.COMPLETED) {
            return;
        }

        cancellationHandlers.add(handler);

        // cancel() may have already run its notification loop
        final ScopeState afterAdd = state.get();
        if (afterAdd.getStatus() != ScopeState.Status.ACTIVE && cancellationHandlers.remove(handler)
                && afterAdd.getStatus() == ScopeState.Status.CANCELLING) {
            notifyHandler(handler, afterAdd.getCause());
        }
    }

    public void removeCancellationHandler(Handler<Throwable> handler) {
        cancellationHandlers.remove(handler);
    }

    public boolean isActive() {
        return state.get().getStatus() == ScopeState.Status.ACTIVE;
    }

    public boolean isCancelling() {
        return state.get().getStatus() == ScopeState.Status.CANCELLING;
    }

    public boolean isCompleted() {
        return state.get().getStatus() == ScopeState.Status.COMPLETED;
    }

    /**
     * Returns the cause this scope is being cancelled with, or {@code null} if it is not cancelling.
     */
    public Throwable cancellationCause() {
        final ScopeState current = state.get();
        return current.getStatus() == ScopeState.Status.CANCELLING ? current.getCause() : null;
    }

    protected ScopeState state() {
        return state.get();
    }

    private void notifyHandler(Handler<Throwable> handler, Throwable cause) {
        try {
            handler.handle(cause);
        } catch (RuntimeException e) {
            logger.warn("Cancellation handler of {} failed", e, this);
        }
    }
}
