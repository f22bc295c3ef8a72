package org.timebox.execution.scope;

import lombok.Value;

/**
 * Immutable snapshot of {@link CancellationScope} lifecycle. Swapped atomically as a whole, so the status and
 * its cause are always observed together.
 */
@Value(staticConstructor = "of")
public class ScopeState {

    static final ScopeState ACTIVE = ScopeState.of(Status.ACTIVE, null);

    Status status;

    /**
     * Cancellation cause while cancelling, final failure once completed, {@code null} otherwise.
     */
    Throwable cause;

    public enum Status {

        ACTIVE,
        CANCELLING,
        COMPLETED
    }
}
