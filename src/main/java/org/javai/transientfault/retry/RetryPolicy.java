package org.javai.transientfault.retry;

import org.javai.transientfault.CancellationToken;
import org.javai.transientfault.ThrowingRunnable;
import org.javai.transientfault.ThrowingSupplier;
import org.javai.transientfault.classify.ErrorClassifier;
import org.javai.transientfault.classify.NeverTransientErrorClassifier;
import org.javai.transientfault.ops.CompositeRetryListener;
import org.javai.transientfault.strategy.ExponentialBackoffRetryStrategy;
import org.javai.transientfault.strategy.FixedIntervalRetryStrategy;
import org.javai.transientfault.strategy.IncrementalRetryStrategy;
import org.javai.transientfault.strategy.RetryCondition;
import org.javai.transientfault.strategy.RetryPolicyOptions;
import org.javai.transientfault.strategy.RetryStrategy;
import org.javai.transientfault.strategy.ShouldRetryHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Protects an operation against transient failures by retrying it.
 *
 * <p>A policy pairs an {@link ErrorClassifier}, which decides whether a failure is worth
 * retrying, with a {@link RetryStrategy}, which decides how many times and how long to wait.
 * When the operation fails:</p>
 * <ul>
 *   <li>a non-transient failure is propagated at once, unchanged</li>
 *   <li>a transient failure is retried after the strategy's delay while the strategy allows it</li>
 *   <li>once the strategy refuses, the last failure is propagated unchanged</li>
 * </ul>
 *
 * <p>Policies hold no per-execution state and may be shared by any number of threads.
 * Listeners can be attached to the policy, observing every execution, or passed to a single call.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * RetryPolicy policy = new RetryPolicy(new SqlServerErrorClassifier(),
 *         new ExponentialBackoffRetryStrategy(5, Duration.ofSeconds(1), Duration.ofSeconds(30), Duration.ofSeconds(2)));
 *
 * Order order = policy.execute(() -> orders.load(id));
 *
 * CompletableFuture<Order> pending = policy.executeAsync(() -> client.fetchOrder(id), token);
 * }</pre>
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    private final ErrorClassifier errorClassifier;
    private final RetryStrategy retryStrategy;
    private final AtomicReference<CompositeRetryListener> subscribers =
            new AtomicReference<>(CompositeRetryListener.empty());
    private final Sleeper sleeper;
    private final DelayScheduler scheduler;

    /**
     * @param errorClassifier decides which failures are transient
     * @param retryStrategy decides how often and when to retry
     */
    public RetryPolicy(ErrorClassifier errorClassifier, RetryStrategy retryStrategy) {
        this(errorClassifier, retryStrategy, Sleeper.SYSTEM, DelayScheduler.SYSTEM);
    }

    /**
     * Retries up to {@code retryCount} times, one second apart.
     */
    public RetryPolicy(ErrorClassifier errorClassifier, int retryCount) {
        this(errorClassifier, new FixedIntervalRetryStrategy(retryCount));
    }

    /**
     * Retries up to {@code retryCount} times with a fixed interval.
     */
    public RetryPolicy(ErrorClassifier errorClassifier, int retryCount, Duration retryInterval) {
        this(errorClassifier, new FixedIntervalRetryStrategy(retryCount, retryInterval));
    }

    /**
     * Retries up to {@code retryCount} times with a delay growing by {@code increment} each time.
     */
    public RetryPolicy(ErrorClassifier errorClassifier, int retryCount, Duration initialInterval, Duration increment) {
        this(errorClassifier, new IncrementalRetryStrategy(retryCount, initialInterval, increment));
    }

    /**
     * Retries up to {@code retryCount} times with exponential backoff.
     */
    public RetryPolicy(ErrorClassifier errorClassifier, int retryCount, Duration minBackoff, Duration maxBackoff,
                       Duration deltaBackoff) {
        this(errorClassifier, new ExponentialBackoffRetryStrategy(retryCount, minBackoff, maxBackoff, deltaBackoff));
    }

    /**
     * Retries as described by the options; disabled options never retry.
     */
    public RetryPolicy(ErrorClassifier errorClassifier, RetryPolicyOptions options) {
        this(errorClassifier, RetryStrategy.fromOptions(options));
    }

    RetryPolicy(ErrorClassifier errorClassifier, RetryStrategy retryStrategy, Sleeper sleeper,
                DelayScheduler scheduler) {
        this.errorClassifier = Objects.requireNonNull(errorClassifier, "errorClassifier must not be null");
        this.retryStrategy = Objects.requireNonNull(retryStrategy, "retryStrategy must not be null");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
    }

    /**
     * Returns a new policy that runs the operation once and never retries.
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(new NeverTransientErrorClassifier(), RetryStrategy.noRetry());
    }

    public ErrorClassifier errorClassifier() {
        return errorClassifier;
    }

    public RetryStrategy retryStrategy() {
        return retryStrategy;
    }

    /**
     * Attaches a listener that observes the retries of every execution of this policy.
     * Prefer passing a listener to a single call where only that call is of interest.
     */
    public void addRetryListener(RetryListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        subscribers.updateAndGet(current -> current.with(listener));
    }

    /**
     * Detaches a listener previously attached with {@link #addRetryListener(RetryListener)}.
     *
     * @return true if the listener was attached
     */
    public boolean removeRetryListener(RetryListener listener) {
        while (true) {
            CompositeRetryListener current = subscribers.get();
            CompositeRetryListener reduced = current.without(listener);
            if (reduced == current) {
                return false;
            }
            if (subscribers.compareAndSet(current, reduced)) {
                return true;
            }
        }
    }

    // === SYNCHRONOUS EXECUTION ===

    /**
     * Runs the operation, retrying transient failures, and returns its result.
     *
     * @param operation the operation to protect
     * @return the result of the first successful attempt
     * @throws E the failure of the last attempt, unchanged
     * @throws CancellationException if the thread is interrupted while waiting to retry;
     *         the interrupt flag is restored and the cause is the last failure
     */
    public <T, E extends Exception> T execute(ThrowingSupplier<T, E> operation) throws E {
        return execute(operation, null);
    }

    /**
     * Runs the operation as {@link #execute(ThrowingSupplier)} does, also notifying the given
     * listener of the retries of this call only.
     */
    public <T, E extends Exception> T execute(ThrowingSupplier<T, E> operation, RetryListener listener) throws E {
        Objects.requireNonNull(operation, "operation must not be null");
        ShouldRetryHandler shouldRetry = retryStrategy.getShouldRetryHandler();
        int retryCount = 0;

        while (true) {
            try {
                return operation.get();
            } catch (Exception e) {
                RetryCondition condition = nextRetry(shouldRetry, retryCount, e, listener);
                if (!condition.retryAllowed()) {
                    throw RetryPolicy.<E>propagate(e);
                }
                sleep(condition.delayBeforeRetry(), e);
                retryCount++;
            }
        }
    }

    /**
     * Runs an operation without a result, retrying transient failures.
     *
     * @throws E the failure of the last attempt, unchanged
     */
    public <E extends Exception> void run(ThrowingRunnable<E> operation) throws E {
        run(operation, null);
    }

    /**
     * Runs an operation without a result, also notifying the given listener of the retries of this call only.
     */
    public <E extends Exception> void run(ThrowingRunnable<E> operation, RetryListener listener) throws E {
        Objects.requireNonNull(operation, "operation must not be null");
        ThrowingSupplier<Void, E> asSupplier = () -> {
            operation.run();
            return null;
        };
        execute(asSupplier, listener);
    }

    // === ASYNCHRONOUS EXECUTION ===

    /**
     * Starts the operation, retrying transient failures without blocking the calling thread.
     *
     * @param operation starts one attempt; invoked again for each retry
     * @return a future completed with the first successful result, or with the failure of the last attempt
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation) {
        return executeAsync(operation, CancellationToken.none(), null);
    }

    /**
     * Starts the operation as {@link #executeAsync(Supplier)} does, stopping when the token is cancelled.
     *
     * <p>Cancellation is checked before each attempt and aborts a pending delay; the returned future
     * is then cancelled. An attempt already in flight is not interrupted.</p>
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation,
                                                 CancellationToken cancellationToken) {
        return executeAsync(operation, cancellationToken, null);
    }

    /**
     * Starts the operation as {@link #executeAsync(Supplier, CancellationToken)} does, also notifying
     * the given listener of the retries of this call only.
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<? extends CompletionStage<T>> operation,
                                                 CancellationToken cancellationToken,
                                                 RetryListener listener) {
        Objects.requireNonNull(operation, "operation must not be null");
        Objects.requireNonNull(cancellationToken, "cancellationToken must not be null");
        return new AsyncExecution<>(this, operation, cancellationToken, listener).start();
    }

    /**
     * Starts an operation without a result, retrying transient failures.
     */
    public CompletableFuture<Void> runAsync(Supplier<? extends CompletionStage<Void>> operation,
                                            CancellationToken cancellationToken) {
        return executeAsync(operation, cancellationToken, null);
    }

    DelayScheduler scheduler() {
        return scheduler;
    }

    /**
     * Decides what happens after a failed attempt and notifies listeners.
     * A condition that does not allow a retry means the failure must be propagated.
     */
    RetryCondition nextRetry(ShouldRetryHandler shouldRetry, int retryCount, Throwable error, RetryListener listener) {
        int attempts = retryCount + 1;
        if (error instanceof RetryLimitExceededException) {
            log.debug("Operation signalled retry limit after {} attempt(s): {}", attempts, error.toString());
            notifyExhausted(error, attempts, listener);
            return RetryCondition.noRetry();
        }
        if (!errorClassifier.isTransient(error)) {
            log.debug("Non-transient failure after {} attempt(s): {}", attempts, error.toString());
            return RetryCondition.noRetry();
        }
        RetryCondition condition = shouldRetry.shouldRetry(retryCount, error);
        if (!condition.retryAllowed()) {
            log.debug("Retries exhausted after {} attempt(s) with {}: {}", attempts, retryStrategy, error.toString());
            notifyExhausted(error, attempts, listener);
            return condition;
        }
        RetryingEvent event = new RetryingEvent(attempts, condition.delayBeforeRetry(), error);
        log.debug("Transient failure, retry {} in {} ms: {}", event.currentRetryCount(),
                event.delay().toMillis(), error.toString());
        notifyRetrying(event, listener);
        return condition;
    }

    private void notifyRetrying(RetryingEvent event, RetryListener callListener) {
        subscribers.get().with(callListener).onRetrying(event);
    }

    private void notifyExhausted(Throwable lastError, int totalAttempts, RetryListener callListener) {
        subscribers.get().with(callListener).onRetryExhausted(lastError, totalAttempts);
    }

    private void sleep(Duration delay, Exception lastError) {
        if (delay.isZero()) {
            return;
        }
        try {
            sleeper.sleep(delay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            CancellationException cancelled = new CancellationException("Interrupted while waiting to retry");
            cancelled.initCause(lastError);
            throw cancelled;
        }
    }

    @SuppressWarnings("unchecked")
    private static <E extends Exception> E propagate(Exception e) {
        return (E) e;
    }

    @Override
    public String toString() {
        return "RetryPolicy[errorClassifier=" + errorClassifier.getClass().getSimpleName()
                + ", retryStrategy=" + retryStrategy + "]";
    }
}
