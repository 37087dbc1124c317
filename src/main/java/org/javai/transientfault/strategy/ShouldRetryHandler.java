package org.javai.transientfault.strategy;

/**
 * Decides whether and when to retry after a transient failure.
 * Implementations are pure functions of their arguments and safe to call from many threads.
 */
@FunctionalInterface
public interface ShouldRetryHandler {

    /**
     * @param currentRetryCount number of retries already performed (0 on the first failure)
     * @param lastError the failure that occurred; may be null when probing a strategy
     * @return the retry condition
     */
    RetryCondition shouldRetry(int currentRetryCount, Throwable lastError);
}
