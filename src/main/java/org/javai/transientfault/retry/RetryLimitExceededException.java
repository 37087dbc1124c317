package org.javai.transientfault.retry;

/**
 * Thrown by a protected operation to stop retrying.
 *
 * <p>A {@link RetryPolicy} never retries or reclassifies this exception; it is propagated to
 * the caller unchanged, whatever the error classifier would say about it.</p>
 */
public class RetryLimitExceededException extends RuntimeException {

    public RetryLimitExceededException() {
        super("Retry limit exceeded");
    }

    public RetryLimitExceededException(String message) {
        super(message);
    }

    public RetryLimitExceededException(Throwable cause) {
        super("Retry limit exceeded", cause);
    }

    public RetryLimitExceededException(String message, Throwable cause) {
        super(message, cause);
    }
}
