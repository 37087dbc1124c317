package org.javai.transientfault.sql;

import org.javai.transientfault.classify.Causes;

import java.sql.SQLException;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Helpers for inspecting the errors carried by a {@link SQLException}.
 *
 * <p>A driver may report several errors for one failure, chained through
 * {@link SQLException#getNextException()}; the helpers visit each of them, and each
 * {@code SQLException} found in the cause chain.</p>
 */
public final class SqlErrors {

    private SqlErrors() {
        // Utility class
    }

    /**
     * Returns true if any SQL error reachable from the given error satisfies the predicate.
     */
    public static boolean anyError(Throwable error, Predicate<SQLException> predicate) {
        return Causes.anyMatch(error, t -> t instanceof SQLException sql && anyChained(sql, predicate));
    }

    /**
     * Returns true if any SQL error reachable from the given error has one of the vendor codes.
     */
    public static boolean hasErrorCode(Throwable error, Set<Integer> codes) {
        return anyError(error, sql -> codes.contains(sql.getErrorCode()));
    }

    /**
     * Returns true if any SQL error reachable from the given error has a SQLSTATE starting with one of the prefixes.
     */
    public static boolean hasSqlStatePrefix(Throwable error, Set<String> prefixes) {
        return anyError(error, sql -> {
            String state = sql.getSQLState();
            if (state == null) {
                return false;
            }
            for (String prefix : prefixes) {
                if (state.startsWith(prefix)) {
                    return true;
                }
            }
            return false;
        });
    }

    private static boolean anyChained(SQLException first, Predicate<SQLException> predicate) {
        Set<SQLException> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (SQLException current = first; current != null && seen.add(current); current = current.getNextException()) {
            if (predicate.test(current)) {
                return true;
            }
        }
        return false;
    }
}
