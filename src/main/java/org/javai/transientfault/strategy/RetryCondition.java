package org.javai.transientfault.strategy;

import java.time.Duration;
import java.util.Objects;

/**
 * The decision a {@link ShouldRetryHandler} makes after a transient failure.
 *
 * @param retryAllowed whether another attempt may be made
 * @param delayBeforeRetry how long to wait before the next attempt; zero when no retry is allowed
 */
public record RetryCondition(boolean retryAllowed, Duration delayBeforeRetry) {

    private static final RetryCondition NO_RETRY = new RetryCondition(false, Duration.ZERO);

    public RetryCondition {
        Objects.requireNonNull(delayBeforeRetry, "delayBeforeRetry must not be null");
        if (delayBeforeRetry.isNegative()) {
            throw new IllegalArgumentException("delayBeforeRetry must not be negative");
        }
    }

    /**
     * Do not retry; accept the failure.
     */
    public static RetryCondition noRetry() {
        return NO_RETRY;
    }

    /**
     * Retry the operation after waiting for the specified delay.
     */
    public static RetryCondition retryAfter(Duration delay) {
        return new RetryCondition(true, delay);
    }

    /**
     * Retry the operation without waiting.
     */
    public static RetryCondition immediate() {
        return new RetryCondition(true, Duration.ZERO);
    }
}
