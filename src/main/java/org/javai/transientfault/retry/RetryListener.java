package org.javai.transientfault.retry;

import org.javai.transientfault.ops.CompositeRetryListener;

/**
 * Observes the retries performed by a {@link RetryPolicy}.
 * Implementations might emit metrics, structured logs, or traces.
 *
 * <p>Listeners are observational: an exception thrown by a listener is logged and
 * never changes the outcome of the execution.</p>
 */
@FunctionalInterface
public interface RetryListener {

    /**
     * Called after a transient failure, before waiting for the retry.
     */
    void onRetrying(RetryingEvent event);

    /**
     * Called when a transient failure ends the execution because no further retry is allowed.
     *
     * @param lastError the failure that is propagated to the caller
     * @param totalAttempts the number of times the operation was invoked
     */
    default void onRetryExhausted(Throwable lastError, int totalAttempts) {
        // Default: no-op. Implementations may override.
    }

    /**
     * A listener that does nothing.
     */
    static RetryListener noOp() {
        return event -> {};
    }

    /**
     * Creates a listener that fans out to all given listeners.
     */
    static RetryListener composite(RetryListener... listeners) {
        return CompositeRetryListener.of(listeners);
    }
}
