package org.javai.transientfault.strategy;

import java.time.Duration;

/**
 * Retries a fixed number of times, adding a constant increment to the delay after every attempt.
 * The delay before retry {@code n} (zero-based) is {@code initialInterval + increment * n}.
 */
public class IncrementalRetryStrategy extends RetryStrategy {

    private final int retryCount;
    private final Duration initialInterval;
    private final Duration increment;

    public IncrementalRetryStrategy() {
        this(DEFAULT_RETRY_COUNT, DEFAULT_RETRY_INTERVAL, DEFAULT_RETRY_INCREMENT);
    }

    public IncrementalRetryStrategy(int retryCount, Duration initialInterval, Duration increment) {
        this(null, retryCount, initialInterval, increment, false);
    }

    public IncrementalRetryStrategy(String name, int retryCount, Duration initialInterval, Duration increment) {
        this(name, retryCount, initialInterval, increment, false);
    }

    /**
     * @param name the strategy name (may be null)
     * @param retryCount the number of retries, >= 0
     * @param initialInterval the delay before the first retry, >= 0
     * @param increment the amount added to the delay on each subsequent retry, >= 0
     * @param fastFirstRetry whether the first retry is immediate
     * @throws IllegalArgumentException if a parameter is negative
     */
    public IncrementalRetryStrategy(String name, int retryCount, Duration initialInterval, Duration increment,
                                    boolean fastFirstRetry) {
        super(name, fastFirstRetry);
        requireNonNegative(retryCount, "retryCount");
        this.retryCount = retryCount;
        this.initialInterval = requireNonNegative(initialInterval, "initialInterval");
        this.increment = requireNonNegative(increment, "increment");
    }

    public int retryCount() {
        return retryCount;
    }

    public Duration initialInterval() {
        return initialInterval;
    }

    public Duration increment() {
        return increment;
    }

    @Override
    public ShouldRetryHandler getShouldRetryHandler() {
        return (currentRetryCount, lastError) -> {
            if (currentRetryCount >= retryCount) {
                return RetryCondition.noRetry();
            }
            if (currentRetryCount == 0 && fastFirstRetry()) {
                return RetryCondition.immediate();
            }
            return RetryCondition.retryAfter(initialInterval.plus(increment.multipliedBy(currentRetryCount)));
        };
    }
}
