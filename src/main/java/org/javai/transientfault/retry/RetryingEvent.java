package org.javai.transientfault.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * Describes a retry that is about to happen.
 *
 * <p>The event carries everything about the attempt, so listeners shared between concurrent
 * executions can tell the executions apart without consulting the policy.</p>
 *
 * @param currentRetryCount the number of the retry about to be performed (1-based)
 * @param delay the delay before the retry
 * @param lastError the transient failure that triggered the retry
 */
public record RetryingEvent(int currentRetryCount, Duration delay, Throwable lastError) {

    public RetryingEvent {
        if (currentRetryCount < 1) {
            throw new IllegalArgumentException("currentRetryCount must be >= 1, was: " + currentRetryCount);
        }
        Objects.requireNonNull(delay, "delay must not be null");
        Objects.requireNonNull(lastError, "lastError must not be null");
    }
}
