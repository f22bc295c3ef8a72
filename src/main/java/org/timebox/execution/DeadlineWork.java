package org.timebox.execution;

import io.vertx.core.Future;
import org.timebox.execution.scope.CancellationScope;

/**
 * Unit of asynchronous work run under a deadline.
 * <p>
 * The work is started inline on the caller's thread. It should await everything it depends on through the
 * given scope (see {@link CancellationScope#await(Future)}), so that an elapsed deadline or an outer
 * cancellation interrupts it at its next suspension point.
 */
@FunctionalInterface
public interface DeadlineWork<T> {

    Future<T> run(CancellationScope scope);
}
