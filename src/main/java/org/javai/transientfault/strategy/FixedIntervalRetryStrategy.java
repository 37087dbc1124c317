package org.javai.transientfault.strategy;

import java.time.Duration;

/**
 * Retries a fixed number of times with the same delay between attempts.
 */
public class FixedIntervalRetryStrategy extends RetryStrategy {

    private final int retryCount;
    private final Duration retryInterval;

    /**
     * Creates an anonymous strategy with {@link #DEFAULT_RETRY_COUNT} retries, one second apart.
     */
    public FixedIntervalRetryStrategy() {
        this(DEFAULT_RETRY_COUNT);
    }

    public FixedIntervalRetryStrategy(int retryCount) {
        this(retryCount, DEFAULT_RETRY_INTERVAL);
    }

    public FixedIntervalRetryStrategy(int retryCount, Duration retryInterval) {
        this(null, retryCount, retryInterval, false);
    }

    public FixedIntervalRetryStrategy(String name, int retryCount, Duration retryInterval) {
        this(name, retryCount, retryInterval, false);
    }

    /**
     * @param name the strategy name (may be null)
     * @param retryCount the number of retries, >= 0
     * @param retryInterval the delay between retries, >= 0
     * @param fastFirstRetry whether the first retry is immediate
     * @throws IllegalArgumentException if a parameter is negative
     */
    public FixedIntervalRetryStrategy(String name, int retryCount, Duration retryInterval, boolean fastFirstRetry) {
        super(name, fastFirstRetry);
        requireNonNegative(retryCount, "retryCount");
        this.retryCount = retryCount;
        this.retryInterval = requireNonNegative(retryInterval, "retryInterval");
    }

    public int retryCount() {
        return retryCount;
    }

    public Duration retryInterval() {
        return retryInterval;
    }

    @Override
    public ShouldRetryHandler getShouldRetryHandler() {
        if (retryCount == 0) {
            return (currentRetryCount, lastError) -> RetryCondition.noRetry();
        }
        return (currentRetryCount, lastError) -> {
            if (currentRetryCount >= retryCount) {
                return RetryCondition.noRetry();
            }
            if (currentRetryCount == 0 && fastFirstRetry()) {
                return RetryCondition.immediate();
            }
            return RetryCondition.retryAfter(retryInterval);
        };
    }
}
