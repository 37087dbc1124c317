package org.javai.transientfault.classify;

/**
 * Treats no error as transient, which disables retries whatever the strategy allows.
 */
public final class NeverTransientErrorClassifier implements ErrorClassifier {

    @Override
    public boolean isTransient(Throwable error) {
        return false;
    }
}
