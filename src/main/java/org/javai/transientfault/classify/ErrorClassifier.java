package org.javai.transientfault.classify;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Decides whether a failure is transient, that is, likely to succeed if the operation is retried.
 *
 * <p>Implementations are stateless predicates over the error: they inspect its type and, for
 * structured errors, its codes. They must be deterministic and safe to share between threads.</p>
 */
@FunctionalInterface
public interface ErrorClassifier {

    /**
     * @param error the failure raised by the protected operation; may be null
     * @return true if the failure is transient and the operation may be retried
     */
    boolean isTransient(Throwable error);

    /**
     * Returns a classifier that is satisfied by this classifier or the other one.
     */
    default ErrorClassifier or(ErrorClassifier other) {
        Objects.requireNonNull(other, "other must not be null");
        return error -> isTransient(error) || other.isTransient(error);
    }

    /**
     * Returns a classifier that applies this classifier to the error and every cause beneath it.
     */
    default ErrorClassifier orAnyCause() {
        return error -> Causes.anyMatch(error, this::isTransient);
    }

    /**
     * Returns a classifier that is satisfied by any of the given classifiers.
     */
    static ErrorClassifier anyOf(ErrorClassifier... classifiers) {
        List<ErrorClassifier> all = List.copyOf(Arrays.asList(classifiers));
        return error -> {
            for (ErrorClassifier classifier : all) {
                if (classifier.isTransient(error)) {
                    return true;
                }
            }
            return false;
        };
    }
}
