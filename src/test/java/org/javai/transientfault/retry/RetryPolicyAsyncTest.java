package org.javai.transientfault.retry;

import org.javai.transientfault.CancellationToken;
import org.javai.transientfault.classify.AlwaysTransientErrorClassifier;
import org.javai.transientfault.classify.NetworkConnectivityErrorClassifier;
import org.javai.transientfault.strategy.FixedIntervalRetryStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.ConnectException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryPolicyAsyncTest {

    private List<Duration> scheduledDelays;
    private List<Runnable> pendingTasks;
    private List<Future<?>> pendingHandles;
    private List<RetryingEvent> retries;

    @BeforeEach
    void setUp() {
        scheduledDelays = new ArrayList<>();
        pendingTasks = new ArrayList<>();
        pendingHandles = new ArrayList<>();
        retries = new ArrayList<>();
    }

    private RetryPolicy immediatePolicy(int retryCount) {
        return new RetryPolicy(new NetworkConnectivityErrorClassifier(),
                new FixedIntervalRetryStrategy(retryCount, Duration.ofMillis(20)),
                millis -> {},
                (task, delay) -> {
                    scheduledDelays.add(delay);
                    task.run();
                    return CompletableFuture.completedFuture(null);
                });
    }

    private RetryPolicy deferredPolicy(int retryCount) {
        return new RetryPolicy(new AlwaysTransientErrorClassifier(),
                new FixedIntervalRetryStrategy(retryCount, Duration.ofSeconds(30)),
                millis -> {},
                (task, delay) -> {
                    pendingTasks.add(task);
                    CompletableFuture<Void> handle = new CompletableFuture<>();
                    pendingHandles.add(handle);
                    return handle;
                });
    }

    @Test
    void executeAsync_success_completesWithValue() throws Exception {
        CompletableFuture<String> result = immediatePolicy(3)
                .executeAsync(() -> CompletableFuture.completedFuture("ok"));

        assertThat(result.get(1, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThat(scheduledDelays).isEmpty();
    }

    @Test
    void executeAsync_transientFailuresThenSuccess_retries() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = immediatePolicy(3).executeAsync(() -> {
            if (attempts.incrementAndGet() <= 2) {
                return CompletableFuture.failedFuture(new ConnectException("refused"));
            }
            return CompletableFuture.completedFuture("connected");
        }, CancellationToken.none(), retries::add);

        assertThat(result.get(1, TimeUnit.SECONDS)).isEqualTo("connected");
        assertThat(attempts.get()).isEqualTo(3);
        assertThat(scheduledDelays).containsExactly(Duration.ofMillis(20), Duration.ofMillis(20));
        assertThat(retries).extracting(RetryingEvent::currentRetryCount).containsExactly(1, 2);
    }

    @Test
    void executeAsync_exhausted_completesWithOriginalError() {
        AtomicInteger attempts = new AtomicInteger();
        ConnectException failure = new ConnectException("refused");

        CompletableFuture<String> result = immediatePolicy(2).executeAsync(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(failure);
        });

        assertThatThrownBy(() -> result.get(1, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .cause().isSameAs(failure);
        assertThat(attempts.get()).isEqualTo(3);
    }

    @Test
    void executeAsync_nonTransient_failsAfterOneAttempt() {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = immediatePolicy(5).executeAsync(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IllegalStateException("bad state"));
        });

        assertThatThrownBy(() -> result.get(1, TimeUnit.SECONDS))
                .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void executeAsync_failureThrownBySupplier_isClassified() throws Exception {
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = immediatePolicy(3).executeAsync(() -> {
            if (attempts.incrementAndGet() == 1) {
                throw new UncheckedIOException(new ConnectException("refused"));
            }
            return CompletableFuture.completedFuture("ok");
        });

        assertThat(result.get(1, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(2);
    }

    @Test
    void executeAsync_cancelledDuringDelay_isCancelledWithoutFurtherAttempts() {
        CancellationToken token = CancellationToken.create();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = deferredPolicy(3).executeAsync(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.failedFuture(new IOException("down"));
        }, token, retries::add);

        assertThat(pendingTasks).hasSize(1);
        assertThat(result).isNotDone();

        token.cancel();

        assertThat(result).isCancelled();
        assertThat(pendingHandles.get(0)).isCancelled();
        pendingTasks.get(0).run();
        assertThat(attempts.get()).isEqualTo(1);
        assertThat(retries).hasSize(1);
    }

    @Test
    void executeAsync_cancelledBeforeStart_neverInvokesOperation() {
        CancellationToken token = CancellationToken.create();
        token.cancel();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = deferredPolicy(3).executeAsync(() -> {
            attempts.incrementAndGet();
            return CompletableFuture.completedFuture("never");
        }, token);

        assertThat(result).isCancelled();
        assertThat(attempts.get()).isZero();
        assertThatThrownBy(result::join).isInstanceOf(CancellationException.class);
    }

    @Test
    void executeAsync_cancelledWhileAttemptInFlight_doesNotRetry() {
        CancellationToken token = CancellationToken.create();
        CompletableFuture<String> inFlight = new CompletableFuture<>();
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = deferredPolicy(3).executeAsync(() -> {
            attempts.incrementAndGet();
            return inFlight;
        }, token, retries::add);

        token.cancel();
        inFlight.completeExceptionally(new IOException("down"));

        assertThat(result).isCancelled();
        assertThat(pendingTasks).isEmpty();
        assertThat(retries).isEmpty();
        assertThat(attempts.get()).isEqualTo(1);
    }

    @Test
    void executeAsync_withSystemScheduler_waitsWithoutBlockingCaller() throws Exception {
        RetryPolicy policy = new RetryPolicy(new AlwaysTransientErrorClassifier(),
                new FixedIntervalRetryStrategy(2, Duration.ofMillis(20)));
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<Integer> result = policy.executeAsync(() -> {
            int attempt = attempts.incrementAndGet();
            return attempt < 3
                    ? CompletableFuture.failedFuture(new IOException("attempt " + attempt))
                    : CompletableFuture.completedFuture(attempt);
        });

        assertThat(result.get(5, TimeUnit.SECONDS)).isEqualTo(3);
    }

    @Test
    void concurrentExecutions_reportTheirOwnRetries() throws Exception {
        RetryPolicy policy = immediatePolicy(3);
        List<RetryingEvent> first = new ArrayList<>();
        List<RetryingEvent> second = new ArrayList<>();
        AtomicInteger firstAttempts = new AtomicInteger();
        AtomicInteger secondAttempts = new AtomicInteger();

        CompletableFuture<String> a = policy.executeAsync(() -> firstAttempts.incrementAndGet() < 2
                ? CompletableFuture.failedFuture(new ConnectException("a"))
                : CompletableFuture.completedFuture("a"), CancellationToken.none(), first::add);
        CompletableFuture<String> b = policy.executeAsync(() -> secondAttempts.incrementAndGet() < 4
                ? CompletableFuture.failedFuture(new ConnectException("b"))
                : CompletableFuture.completedFuture("b"), CancellationToken.none(), second::add);

        assertThat(a.get(1, TimeUnit.SECONDS)).isEqualTo("a");
        assertThat(b.get(1, TimeUnit.SECONDS)).isEqualTo("b");
        assertThat(first).hasSize(1).allSatisfy(event -> assertThat(event.lastError()).hasMessage("a"));
        assertThat(second).hasSize(3).allSatisfy(event -> assertThat(event.lastError()).hasMessage("b"));
    }

    @Test
    void executeAsync_manyImmediateRetries_completeWithoutDeepRecursion() throws Exception {
        RetryPolicy policy = new RetryPolicy(new AlwaysTransientErrorClassifier(),
                new FixedIntervalRetryStrategy(20_000, Duration.ZERO));
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = policy.executeAsync(() -> attempts.incrementAndGet() <= 20_000
                ? CompletableFuture.failedFuture(new IOException("still down"))
                : CompletableFuture.completedFuture("ok"));

        assertThat(result.get(10, TimeUnit.SECONDS)).isEqualTo("ok");
        assertThat(attempts.get()).isEqualTo(20_001);
    }

    @Test
    void executeAsync_manyImmediateRetriesThrownBySupplier_exhaust() {
        RetryPolicy policy = new RetryPolicy(new AlwaysTransientErrorClassifier(),
                new FixedIntervalRetryStrategy(10_000, Duration.ZERO));
        AtomicInteger attempts = new AtomicInteger();

        CompletableFuture<String> result = policy.executeAsync(() -> {
            attempts.incrementAndGet();
            throw new UncheckedIOException(new IOException("still down"));
        });

        assertThatThrownBy(() -> result.get(10, TimeUnit.SECONDS))
                .isInstanceOf(ExecutionException.class)
                .hasCauseInstanceOf(UncheckedIOException.class);
        assertThat(attempts.get()).isEqualTo(10_001);
    }

    @Test
    void executeAsync_throwingClassifier_completesWithClassifierError() {
        RetryPolicy policy = new RetryPolicy(error -> {
            throw new IllegalStateException("classifier bug");
        }, new FixedIntervalRetryStrategy(3, Duration.ZERO));
        IOException failure = new IOException("down");

        CompletableFuture<String> result = policy.executeAsync(
                () -> CompletableFuture.supplyAsync(() -> {
                    throw new UncheckedIOException(failure);
                }));

        Throwable thrown = catchThrowable(() -> result.get(5, TimeUnit.SECONDS));

        assertThat(thrown).isInstanceOf(ExecutionException.class);
        assertThat(thrown.getCause()).isInstanceOf(IllegalStateException.class).hasMessage("classifier bug");
        assertThat(thrown.getCause().getSuppressed())
                .singleElement()
                .isInstanceOf(UncheckedIOException.class);
    }

    @Test
    void executeAsync_schedulerRejectsRetry_completesWithRejection() {
        RejectedExecutionException rejected = new RejectedExecutionException("shut down");
        RetryPolicy policy = new RetryPolicy(new AlwaysTransientErrorClassifier(),
                new FixedIntervalRetryStrategy(3, Duration.ofSeconds(1)),
                millis -> {},
                (task, delay) -> {
                    throw rejected;
                });

        CompletableFuture<String> result = policy.executeAsync(
                () -> CompletableFuture.failedFuture(new IOException("down")));

        assertThat(result).isCompletedExceptionally();
        assertThatThrownBy(result::join).hasCause(rejected);
    }
}
