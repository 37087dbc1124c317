package org.javai.transientfault.classify;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Walks the cause chain of an error.
 */
public final class Causes {

    private Causes() {
        // Utility class
    }

    /**
     * Returns true if the error or any of its causes satisfies the predicate.
     * Cause cycles are visited once.
     *
     * @param error the error to inspect; null never matches
     * @param predicate the test applied to each layer
     */
    public static boolean anyMatch(Throwable error, Predicate<Throwable> predicate) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            if (predicate.test(current)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns the first layer of the cause chain that is an instance of the given type, or null.
     */
    public static <T extends Throwable> T find(Throwable error, Class<T> type) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Throwable current = error; current != null && seen.add(current); current = current.getCause()) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
        }
        return null;
    }
}
