package org.javai.transientfault.strategy;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retries with a randomized, exponentially growing delay.
 *
 * <p>The delay before retry {@code n} (zero-based) is
 * {@code min(minBackoff + (2^n - 1) * jitter(deltaBackoff), maxBackoff)}, where
 * {@code jitter(d)} is drawn uniformly from {@code [0.8 * d, 1.2 * d]}. The first delay is
 * therefore always {@code minBackoff}, and no delay ever exceeds {@code maxBackoff}. When
 * {@code minBackoff} is larger than {@code maxBackoff} every delay is {@code maxBackoff}.</p>
 *
 * <p>Jitter comes from {@link ThreadLocalRandom}, so concurrent callers neither contend on a
 * shared generator nor retry in lockstep.</p>
 */
public class ExponentialBackoffRetryStrategy extends RetryStrategy {

    private final int retryCount;
    private final Duration minBackoff;
    private final Duration maxBackoff;
    private final Duration deltaBackoff;

    /**
     * Creates an anonymous strategy with the default values: 10 retries,
     * 1 second minimum, 30 seconds maximum and a 10 second delta.
     */
    public ExponentialBackoffRetryStrategy() {
        this(DEFAULT_RETRY_COUNT, DEFAULT_MIN_BACKOFF, DEFAULT_MAX_BACKOFF, DEFAULT_DELTA_BACKOFF);
    }

    public ExponentialBackoffRetryStrategy(int retryCount, Duration minBackoff, Duration maxBackoff,
                                           Duration deltaBackoff) {
        this(null, retryCount, minBackoff, maxBackoff, deltaBackoff, false);
    }

    public ExponentialBackoffRetryStrategy(String name, int retryCount, Duration minBackoff, Duration maxBackoff,
                                           Duration deltaBackoff) {
        this(name, retryCount, minBackoff, maxBackoff, deltaBackoff, false);
    }

    /**
     * @param name the strategy name (may be null)
     * @param retryCount the number of retries, >= 0
     * @param minBackoff the smallest delay, >= 0
     * @param maxBackoff the largest delay, >= 0; caps every delay, even below minBackoff
     * @param deltaBackoff the base of the exponential term, >= 0
     * @param fastFirstRetry whether the first retry is immediate
     * @throws IllegalArgumentException if a parameter is negative
     */
    public ExponentialBackoffRetryStrategy(String name, int retryCount, Duration minBackoff, Duration maxBackoff,
                                           Duration deltaBackoff, boolean fastFirstRetry) {
        super(name, fastFirstRetry);
        requireNonNegative(retryCount, "retryCount");
        requireNonNegative(minBackoff, "minBackoff");
        requireNonNegative(maxBackoff, "maxBackoff");
        requireNonNegative(deltaBackoff, "deltaBackoff");
        this.retryCount = retryCount;
        this.minBackoff = minBackoff;
        this.maxBackoff = maxBackoff;
        this.deltaBackoff = deltaBackoff;
    }

    public int retryCount() {
        return retryCount;
    }

    public Duration minBackoff() {
        return minBackoff;
    }

    public Duration maxBackoff() {
        return maxBackoff;
    }

    public Duration deltaBackoff() {
        return deltaBackoff;
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
            return RetryCondition.retryAfter(backoff(currentRetryCount));
        };
    }

    private Duration backoff(int currentRetryCount) {
        long deltaMillis = deltaBackoff.toMillis();
        long jitteredDelta = ThreadLocalRandom.current()
                .nextLong(deltaMillis * 8 / 10, deltaMillis * 12 / 10 + 1);
        // doubles so that large retry counts saturate instead of overflowing
        double exponential = (Math.pow(2.0, currentRetryCount) - 1.0) * jitteredDelta;
        double millis = Math.min(minBackoff.toMillis() + exponential, maxBackoff.toMillis());
        return Duration.ofMillis((long) millis);
    }
}
