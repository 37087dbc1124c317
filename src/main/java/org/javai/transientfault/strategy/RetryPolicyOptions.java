package org.javai.transientfault.strategy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Duration;

/**
 * Options from which a {@link RetryStrategy} is built with {@link RetryStrategy#fromOptions(RetryPolicyOptions)}.
 *
 * <p>Plain mutable bean so hosts can bind it from their configuration source; unknown properties
 * are ignored when bound with Jackson. Durations bind from ISO-8601 strings (for example {@code "PT1S"})
 * when the {@code JavaTimeModule} is registered.</p>
 *
 * <pre>{@code
 * {
 *   "enabled": true,
 *   "retryStrategyName": "Exponential",
 *   "retryCount": 5,
 *   "minBackoff": "PT1S",
 *   "maxBackoff": "PT30S",
 *   "deltaBackoff": "PT2S"
 * }
 * }</pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class RetryPolicyOptions {

    /** Exponential backoff strategy. */
    public static final String EXPONENTIAL = "Exponential";

    /** Incremental strategy. */
    public static final String INCREMENTAL = "Incremental";

    /** Fixed interval strategy. */
    public static final String FIXED = "Fixed";

    private boolean enabled;
    private String retryStrategyName = EXPONENTIAL;
    private int retryCount = 3;
    private boolean firstFastRetry = true;
    private Duration interval = Duration.ofSeconds(1);
    private Duration increment = Duration.ofSeconds(1);
    private Duration minBackoff = Duration.ofSeconds(1);
    private Duration maxBackoff = Duration.ofSeconds(10);
    private Duration deltaBackoff = Duration.ofSeconds(10);

    /**
     * Whether retry is enabled. When false the strategy is always {@link NoRetryStrategy}.
     */
    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * One of {@link #EXPONENTIAL}, {@link #INCREMENTAL} or {@link #FIXED}.
     */
    public String getRetryStrategyName() {
        return retryStrategyName;
    }

    public void setRetryStrategyName(String retryStrategyName) {
        this.retryStrategyName = retryStrategyName;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public void setRetryCount(int retryCount) {
        this.retryCount = retryCount;
    }

    /**
     * If true, the first retry is immediate and the remainder follow the strategy. Default: true.
     */
    public boolean isFirstFastRetry() {
        return firstFastRetry;
    }

    public void setFirstFastRetry(boolean firstFastRetry) {
        this.firstFastRetry = firstFastRetry;
    }

    /**
     * The interval for the incremental and fixed strategies.
     */
    public Duration getInterval() {
        return interval;
    }

    public void setInterval(Duration interval) {
        this.interval = interval;
    }

    /**
     * The increment for the incremental strategy.
     */
    public Duration getIncrement() {
        return increment;
    }

    public void setIncrement(Duration increment) {
        this.increment = increment;
    }

    public Duration getMinBackoff() {
        return minBackoff;
    }

    public void setMinBackoff(Duration minBackoff) {
        this.minBackoff = minBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }

    public Duration getDeltaBackoff() {
        return deltaBackoff;
    }

    public void setDeltaBackoff(Duration deltaBackoff) {
        this.deltaBackoff = deltaBackoff;
    }
}
