package org.javai.transientfault.strategy;

/**
 * A strategy that never retries, whatever the attempt count or error.
 */
public final class NoRetryStrategy extends RetryStrategy {

    public static final NoRetryStrategy INSTANCE = new NoRetryStrategy();

    private static final ShouldRetryHandler HANDLER = (currentRetryCount, lastError) -> RetryCondition.noRetry();

    private NoRetryStrategy() {
        super("no-retry", false);
    }

    @Override
    public ShouldRetryHandler getShouldRetryHandler() {
        return HANDLER;
    }
}
