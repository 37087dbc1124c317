package org.javai.transientfault.sql;

import org.javai.transientfault.classify.ErrorClassifier;

import java.sql.SQLTransientConnectionException;
import java.util.Set;

/**
 * Transient error detection for SQL Server and SQL Database.
 *
 * <p>Recognises the server error numbers reported for throttling, resource governance,
 * failover and transport-level faults, and JDBC's {@link SQLTransientConnectionException}.
 * Timeouts are not transient here; see {@link AzureSqlErrorClassifier#withTimeouts()}.</p>
 */
public class SqlServerErrorClassifier implements ErrorClassifier {

    static final Set<Integer> TRANSIENT_ERROR_NUMBERS = Set.of(
            20,     // the instance of SQL Server does not support encryption
            64,     // connection established but an error occurred during login
            233,    // connection initialization error
            10053,  // transport-level error while receiving results
            10054,  // transport-level error while sending the request
            10060,  // network-related or instance-specific error
            10928,  // resource limit reached
            10929,  // resource minimum guarantee not available
            40143,  // service encountered an error processing the request
            40197,  // service error, e.g. failover or upgrade
            40501,  // service is currently busy (throttling)
            40540,  // service encountered an error processing the request
            40613   // database is currently unavailable
    );

    @Override
    public boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        return SqlErrors.hasErrorCode(error, TRANSIENT_ERROR_NUMBERS)
                || SqlErrors.anyError(error, sql -> sql instanceof SQLTransientConnectionException);
    }
}
