package org.javai.transientfault.strategy;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

class FixedIntervalRetryStrategyTest {

    @Test
    void defaults_retryTenTimesOneSecondApart() {
        ShouldRetryHandler handler = new FixedIntervalRetryStrategy().getShouldRetryHandler();

        assertThat(handler.shouldRetry(0, null)).isEqualTo(RetryCondition.retryAfter(Duration.ofSeconds(1)));
        assertThat(handler.shouldRetry(9, null)).isEqualTo(RetryCondition.retryAfter(Duration.ofSeconds(1)));
        assertThat(handler.shouldRetry(10, null).retryAllowed()).isFalse();
    }

    @Test
    void shouldRetry_withinRetryCount_returnsInterval() {
        ShouldRetryHandler handler = new FixedIntervalRetryStrategy("default", 5, Duration.ofMillis(10))
                .getShouldRetryHandler();

        assertThat(handler.shouldRetry(0, null)).isEqualTo(new RetryCondition(true, Duration.ofMillis(10)));
        assertThat(handler.shouldRetry(4, null)).isEqualTo(new RetryCondition(true, Duration.ofMillis(10)));
    }

    @Test
    void shouldRetry_atRetryCount_deniesWithZeroDelay() {
        ShouldRetryHandler handler = new FixedIntervalRetryStrategy("default", 5, Duration.ofMillis(10))
                .getShouldRetryHandler();

        RetryCondition condition = handler.shouldRetry(5, new IOException("boom"));

        assertThat(condition.retryAllowed()).isFalse();
        assertThat(condition.delayBeforeRetry()).isZero();
        assertThat(handler.shouldRetry(50, null).retryAllowed()).isFalse();
    }

    @Test
    void fastFirstRetry_firstRetryIsImmediate() {
        ShouldRetryHandler handler = new FixedIntervalRetryStrategy("fast", 3, Duration.ofSeconds(2), true)
                .getShouldRetryHandler();

        assertThat(handler.shouldRetry(0, null)).isEqualTo(RetryCondition.immediate());
        assertThat(handler.shouldRetry(1, null).delayBeforeRetry()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    void zeroRetryCount_neverRetries() {
        ShouldRetryHandler handler = new FixedIntervalRetryStrategy(0).getShouldRetryHandler();

        assertThat(handler.shouldRetry(0, null).retryAllowed()).isFalse();
    }

    @Test
    void constructor_rejectsNegativeValues() {
        assertThatThrownBy(() -> new FixedIntervalRetryStrategy(-1))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retryCount");
        assertThatThrownBy(() -> new FixedIntervalRetryStrategy(3, Duration.ofMillis(-1)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("retryInterval");
    }

    @Test
    void accessors_exposeConfiguration() {
        FixedIntervalRetryStrategy strategy = new FixedIntervalRetryStrategy("named", 4, Duration.ofMillis(250), true);

        assertThat(strategy.name()).isEqualTo("named");
        assertThat(strategy.retryCount()).isEqualTo(4);
        assertThat(strategy.retryInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(strategy.fastFirstRetry()).isTrue();
    }
}
