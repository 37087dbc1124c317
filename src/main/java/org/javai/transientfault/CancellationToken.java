package org.javai.transientfault;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * A cooperative cancellation signal shared between the caller of an asynchronous retry
 * and the retry loop.
 *
 * <p>Cancellation is one-way: once {@link #cancel()} is called the token stays cancelled.
 * Callbacks registered before cancellation run exactly once on the cancelling thread;
 * callbacks registered afterwards run immediately on the registering thread.</p>
 *
 * <pre>{@code
 * CancellationToken token = CancellationToken.create();
 * CompletableFuture<Order> order = policy.executeAsync(() -> client.fetchOrder(id), token);
 * ...
 * token.cancel();
 * }</pre>
 */
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final Object lock = new Object();
    private final List<Runnable> callbacks = new ArrayList<>();
    private volatile boolean cancelled;

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * Creates a new token that can be cancelled.
     */
    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * A token that is never cancelled. Calling {@link #cancel()} on it is an error.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Requests cancellation and runs the registered callbacks.
     *
     * @throws UnsupportedOperationException if this is the {@link #none()} token
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("CancellationToken.none() cannot be cancelled");
        }
        List<Runnable> toRun;
        synchronized (lock) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        for (Runnable callback : toRun) {
            callback.run();
        }
    }

    public boolean isCancellationRequested() {
        return cancelled;
    }

    public boolean canBeCancelled() {
        return cancellable;
    }

    /**
     * Throws {@link CancellationException} if cancellation has been requested.
     */
    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Cancellation requested");
        }
    }

    /**
     * Registers a callback to run when the token is cancelled.
     *
     * @param callback the callback
     * @return a registration that removes the callback when closed
     */
    public Registration register(Runnable callback) {
        Objects.requireNonNull(callback, "callback must not be null");
        if (!cancellable) {
            return () -> {};
        }
        synchronized (lock) {
            if (!cancelled) {
                callbacks.add(callback);
                return () -> {
                    synchronized (lock) {
                        callbacks.remove(callback);
                    }
                };
            }
        }
        callback.run();
        return () -> {};
    }

    /**
     * Handle for a registered cancellation callback.
     */
    @FunctionalInterface
    public interface Registration extends AutoCloseable {

        @Override
        void close();
    }
}
