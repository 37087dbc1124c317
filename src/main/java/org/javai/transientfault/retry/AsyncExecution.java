package org.javai.transientfault.retry;

import org.javai.transientfault.CancellationToken;
import org.javai.transientfault.strategy.RetryCondition;
import org.javai.transientfault.strategy.ShouldRetryHandler;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * One asynchronous execution of a {@link RetryPolicy}.
 *
 * <p>Holds the retry count of the execution; attempts run strictly one after another, each
 * started from the completion of the previous one or from the delay scheduler.</p>
 *
 * <p>Attempts that must start at once (the first one, and retries without delay) go through
 * {@link #attemptNow()}, which runs them in a loop on the thread that is already running an
 * attempt instead of nesting a new call. Operations returning completed stages therefore retry
 * in constant stack depth.</p>
 */
final class AsyncExecution<T> {

    private final RetryPolicy policy;
    private final Supplier<? extends CompletionStage<T>> operation;
    private final CancellationToken cancellationToken;
    private final RetryListener listener;
    private final ShouldRetryHandler shouldRetry;
    private final CompletableFuture<T> result = new CompletableFuture<>();
    private final AtomicInteger pendingAttempts = new AtomicInteger();
    private volatile Future<?> pendingDelay;
    private int retryCount;

    AsyncExecution(RetryPolicy policy, Supplier<? extends CompletionStage<T>> operation,
                   CancellationToken cancellationToken, RetryListener listener) {
        this.policy = policy;
        this.operation = operation;
        this.cancellationToken = cancellationToken;
        this.listener = listener;
        this.shouldRetry = policy.retryStrategy().getShouldRetryHandler();
    }

    CompletableFuture<T> start() {
        CancellationToken.Registration registration = cancellationToken.register(() -> result.cancel(false));
        result.whenComplete((value, error) -> {
            registration.close();
            cancelPendingDelay();
        });
        attemptNow();
        return result;
    }

    private void attemptNow() {
        if (pendingAttempts.getAndIncrement() != 0) {
            // the thread already looping below picks this attempt up
            return;
        }
        do {
            attempt();
        } while (pendingAttempts.decrementAndGet() != 0);
    }

    private void attempt() {
        if (result.isDone()) {
            return;
        }
        if (cancellationToken.isCancellationRequested()) {
            result.cancel(false);
            return;
        }
        CompletionStage<T> stage;
        try {
            stage = operation.get();
        } catch (Throwable t) {
            onFailure(t);
            return;
        }
        if (stage == null) {
            result.completeExceptionally(new NullPointerException("operation returned a null CompletionStage"));
            return;
        }
        stage.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
            } else {
                onFailure(unwrap(error));
            }
        });
    }

    private void onFailure(Throwable error) {
        if (result.isDone()) {
            return;
        }
        if (cancellationToken.isCancellationRequested()) {
            result.cancel(false);
            return;
        }
        try {
            RetryCondition condition = policy.nextRetry(shouldRetry, retryCount, error, listener);
            if (!condition.retryAllowed()) {
                result.completeExceptionally(error);
                return;
            }
            retryCount++;
            retryAfter(condition.delayBeforeRetry());
        } catch (Throwable t) {
            if (t != error) {
                t.addSuppressed(error);
            }
            result.completeExceptionally(t);
        }
    }

    private void retryAfter(Duration delay) {
        if (delay.isZero()) {
            attemptNow();
            return;
        }
        pendingDelay = policy.scheduler().schedule(this::attemptNow, delay);
        if (result.isDone()) {
            cancelPendingDelay();
        }
    }

    private void cancelPendingDelay() {
        Future<?> delay = pendingDelay;
        if (delay != null) {
            delay.cancel(false);
        }
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
