package org.javai.transientfault.sql;

import org.javai.transientfault.classify.ErrorClassifier;
import org.javai.transientfault.classify.TimeoutAwareErrorClassifier;
import org.javai.transientfault.classify.Causes;

import java.util.Set;

/**
 * Transient error detection for MySQL and MariaDB.
 */
public final class MySqlErrorClassifier implements ErrorClassifier {

    private static final Set<Integer> TRANSIENT_ERROR_CODES = Set.of(
            1040,   // ER_CON_COUNT_ERROR: too many connections
            1042,   // ER_BAD_HOST_ERROR: unable to connect to host
            1205,   // ER_LOCK_WAIT_TIMEOUT: lock wait timeout exceeded
            1213,   // ER_LOCK_DEADLOCK: deadlock found when trying to get lock
            1317,   // ER_QUERY_INTERRUPTED: query execution was interrupted (command timeout)
            1614,   // ER_XA_RBDEADLOCK: transaction branch rolled back, deadlock detected
            2002,   // CR_CONNECTION_ERROR: cannot connect through socket
            2003    // CR_CONN_HOST_ERROR: cannot connect to server
    );

    /** Communication link failure. */
    private static final Set<String> TRANSIENT_SQL_STATES = Set.of("08S01");

    private final boolean includeTimeouts;

    /**
     * Creates a classifier that treats timeouts as transient.
     */
    public MySqlErrorClassifier() {
        this(true);
    }

    public MySqlErrorClassifier(boolean includeTimeouts) {
        this.includeTimeouts = includeTimeouts;
    }

    @Override
    public boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        if (SqlErrors.hasErrorCode(error, TRANSIENT_ERROR_CODES)
                || SqlErrors.hasSqlStatePrefix(error, TRANSIENT_SQL_STATES)) {
            return true;
        }
        return includeTimeouts && Causes.anyMatch(error, TimeoutAwareErrorClassifier::isStandardTimeout);
    }
}
