package org.javai.transientfault.classify;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLTimeoutException;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.function.Predicate;

/**
 * Decorates a classifier so that timeouts are also treated as transient.
 *
 * <p>Timeouts are kept out of the base classifiers because a timeout may mean the operation is
 * stuck rather than that the dependency is congested; wrapping a classifier with this decorator
 * is the explicit opt-in.</p>
 *
 * <p>The recognised timeouts are {@link SocketTimeoutException}, {@link HttpTimeoutException},
 * {@link SQLTimeoutException} and {@link TimeoutException}, plus anything matching an optional
 * extra predicate (for example vendor-specific timeout codes), anywhere in the cause chain.</p>
 */
public final class TimeoutAwareErrorClassifier implements ErrorClassifier {

    private final ErrorClassifier delegate;
    private final Predicate<Throwable> additionalTimeouts;

    public TimeoutAwareErrorClassifier(ErrorClassifier delegate) {
        this(delegate, t -> false);
    }

    /**
     * @param delegate the classifier consulted first
     * @param additionalTimeouts recognises timeouts the standard types do not cover
     */
    public TimeoutAwareErrorClassifier(ErrorClassifier delegate, Predicate<Throwable> additionalTimeouts) {
        this.delegate = Objects.requireNonNull(delegate, "delegate must not be null");
        this.additionalTimeouts = Objects.requireNonNull(additionalTimeouts, "additionalTimeouts must not be null");
    }

    public ErrorClassifier delegate() {
        return delegate;
    }

    @Override
    public boolean isTransient(Throwable error) {
        return delegate.isTransient(error)
                || Causes.anyMatch(error, t -> isStandardTimeout(t) || additionalTimeouts.test(t));
    }

    /**
     * Returns true for the JDK's timeout exception types.
     */
    public static boolean isStandardTimeout(Throwable t) {
        return t instanceof SocketTimeoutException
                || t instanceof HttpTimeoutException
                || t instanceof SQLTimeoutException
                || t instanceof TimeoutException;
    }
}
