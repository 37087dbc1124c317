package org.javai.transientfault.strategy;

import java.time.Duration;
import java.util.Objects;

/**
 * Computes whether another attempt is allowed and how long to wait before it.
 *
 * <p>Strategies are immutable once constructed and may be shared by any number of
 * policies and threads. A strategy may carry a name so that it can be registered
 * with a {@link org.javai.transientfault.manager.RetryManager}.</p>
 *
 * <p>Built-in strategies:</p>
 * <ul>
 *   <li>{@link FixedIntervalRetryStrategy} - the same delay between every retry</li>
 *   <li>{@link IncrementalRetryStrategy} - a delay growing linearly with each retry</li>
 *   <li>{@link ExponentialBackoffRetryStrategy} - a jittered, exponentially growing delay with a cap</li>
 *   <li>{@link NoRetryStrategy} - never retries</li>
 * </ul>
 */
public abstract class RetryStrategy {

    /** Default number of retry attempts. */
    public static final int DEFAULT_RETRY_COUNT = 10;

    /** Default interval between retries for the fixed interval strategy. */
    public static final Duration DEFAULT_RETRY_INTERVAL = Duration.ofSeconds(1);

    /** Default amount added to the interval on each retry by the incremental strategy. */
    public static final Duration DEFAULT_RETRY_INCREMENT = Duration.ofSeconds(1);

    /** Default lower bound of the exponential backoff delay. */
    public static final Duration DEFAULT_MIN_BACKOFF = Duration.ofSeconds(1);

    /** Default upper bound of the exponential backoff delay. */
    public static final Duration DEFAULT_MAX_BACKOFF = Duration.ofSeconds(30);

    /** Default delta used to compute the exponential backoff delay. */
    public static final Duration DEFAULT_DELTA_BACKOFF = Duration.ofSeconds(10);

    private final String name;
    private final boolean fastFirstRetry;

    protected RetryStrategy(String name, boolean fastFirstRetry) {
        this.name = name;
        this.fastFirstRetry = fastFirstRetry;
    }

    /**
     * The name of this strategy, or null if it is anonymous.
     */
    public String name() {
        return name;
    }

    /**
     * Whether the first retry happens immediately, regardless of the configured delays.
     */
    public boolean fastFirstRetry() {
        return fastFirstRetry;
    }

    /**
     * Returns the decision function of this strategy.
     */
    public abstract ShouldRetryHandler getShouldRetryHandler();

    /**
     * Returns the strategy that never retries.
     */
    public static RetryStrategy noRetry() {
        return NoRetryStrategy.INSTANCE;
    }

    /**
     * Creates a strategy from options.
     * Disabled options always produce {@link NoRetryStrategy}, whatever the other fields say.
     *
     * @param options the options
     * @return the configured strategy
     * @throws IllegalArgumentException if the strategy name is not one of
     *         {@link RetryPolicyOptions#EXPONENTIAL}, {@link RetryPolicyOptions#INCREMENTAL} or
     *         {@link RetryPolicyOptions#FIXED}, or if a parameter is out of range
     */
    public static RetryStrategy fromOptions(RetryPolicyOptions options) {
        return fromOptions(null, options);
    }

    /**
     * Creates a named strategy from options.
     *
     * @param name the strategy name (may be null)
     * @param options the options
     * @return the configured strategy
     */
    public static RetryStrategy fromOptions(String name, RetryPolicyOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (!options.isEnabled()) {
            return NoRetryStrategy.INSTANCE;
        }
        String strategyName = options.getRetryStrategyName();
        if (RetryPolicyOptions.EXPONENTIAL.equalsIgnoreCase(strategyName)) {
            return new ExponentialBackoffRetryStrategy(name, options.getRetryCount(), options.getMinBackoff(),
                    options.getMaxBackoff(), options.getDeltaBackoff(), options.isFirstFastRetry());
        }
        if (RetryPolicyOptions.INCREMENTAL.equalsIgnoreCase(strategyName)) {
            return new IncrementalRetryStrategy(name, options.getRetryCount(), options.getInterval(),
                    options.getIncrement(), options.isFirstFastRetry());
        }
        if (RetryPolicyOptions.FIXED.equalsIgnoreCase(strategyName)) {
            return new FixedIntervalRetryStrategy(name, options.getRetryCount(), options.getInterval(),
                    options.isFirstFastRetry());
        }
        throw new IllegalArgumentException("Unknown retry strategy name: " + strategyName
                + " (expected one of " + RetryPolicyOptions.EXPONENTIAL + ", "
                + RetryPolicyOptions.INCREMENTAL + ", " + RetryPolicyOptions.FIXED + ")");
    }

    static void requireNonNegative(int value, String parameter) {
        if (value < 0) {
            throw new IllegalArgumentException(parameter + " must be >= 0, was: " + value);
        }
    }

    static Duration requireNonNegative(Duration value, String parameter) {
        Objects.requireNonNull(value, parameter + " must not be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(parameter + " must not be negative, was: " + value);
        }
        return value;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", fastFirstRetry=" + fastFirstRetry + "]";
    }
}
