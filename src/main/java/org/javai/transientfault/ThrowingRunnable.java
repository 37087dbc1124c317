package org.javai.transientfault;

/**
 * An operation with no result that may throw a checked exception.
 *
 * @param <E> The type of exception that may be thrown
 */
@FunctionalInterface
public interface ThrowingRunnable<E extends Exception> {

    void run() throws E;
}
