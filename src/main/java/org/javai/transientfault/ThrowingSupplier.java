package org.javai.transientfault;

/**
 * An operation that produces a value and may throw a checked exception.
 * Protected operations handed to a {@link org.javai.transientfault.retry.RetryPolicy} take this shape.
 *
 * @param <T> The type of value supplied
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingSupplier<T, E extends Exception> {

    T get() throws E;
}
