package org.javai.transientfault.classify;

/**
 * Treats every error as transient. Useful for tests and for operations where any failure is worth retrying.
 */
public final class AlwaysTransientErrorClassifier implements ErrorClassifier {

    @Override
    public boolean isTransient(Throwable error) {
        return true;
    }
}
