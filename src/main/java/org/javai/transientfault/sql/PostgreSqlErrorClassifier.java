package org.javai.transientfault.sql;

import org.javai.transientfault.classify.Causes;
import org.javai.transientfault.classify.ErrorClassifier;
import org.javai.transientfault.classify.TimeoutAwareErrorClassifier;

import java.sql.SQLTimeoutException;
import java.sql.SQLTransientException;
import java.util.Set;

/**
 * Transient error detection for PostgreSQL, based on SQLSTATE codes.
 */
public final class PostgreSqlErrorClassifier implements ErrorClassifier {

    private static final Set<String> TRANSIENT_SQL_STATES = Set.of(
            "08",       // connection exception
            "53",       // insufficient resources, including too_many_connections
            "57P01",    // admin_shutdown
            "57P02",    // crash_shutdown
            "57P03",    // cannot_connect_now
            "40001",    // serialization_failure
            "40P01",    // deadlock_detected
            "55P03"     // lock_not_available
    );

    private final boolean includeTimeouts;

    /**
     * Creates a classifier that treats timeouts as transient.
     */
    public PostgreSqlErrorClassifier() {
        this(true);
    }

    public PostgreSqlErrorClassifier(boolean includeTimeouts) {
        this.includeTimeouts = includeTimeouts;
    }

    @Override
    public boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        if (SqlErrors.hasSqlStatePrefix(error, TRANSIENT_SQL_STATES)) {
            return true;
        }
        if (includeTimeouts && Causes.anyMatch(error, TimeoutAwareErrorClassifier::isStandardTimeout)) {
            return true;
        }
        return SqlErrors.anyError(error, sql -> sql instanceof SQLTransientException
                && !(sql instanceof SQLTimeoutException));
    }
}
