package org.javai.transientfault.sql;

import org.javai.transientfault.classify.ErrorClassifier;
import org.javai.transientfault.classify.TimeoutAwareErrorClassifier;

import java.util.Set;

/**
 * Transient error detection for Azure SQL Database.
 *
 * <p>Extends the SQL Server table with the throttling and availability errors documented for
 * SQL Database (4060, 10928, 10929, 40197, 40501, 40540, 40613), checked on every layer of
 * the cause chain.</p>
 */
public class AzureSqlErrorClassifier implements ErrorClassifier {

    private static final Set<Integer> AZURE_ERROR_NUMBERS = Set.of(40540, 10928, 10929, 4060, 40197, 40501, 40613);

    /** Client-side timeout (-2) and semaphore timeout (121). */
    private static final Set<Integer> TIMEOUT_ERROR_NUMBERS = Set.of(-2, 121);

    private final SqlServerErrorClassifier sqlServer = new SqlServerErrorClassifier();

    @Override
    public boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        return sqlServer.isTransient(error) || SqlErrors.hasErrorCode(error, AZURE_ERROR_NUMBERS);
    }

    /**
     * Returns an Azure SQL classifier that also treats timeouts as transient, including the
     * SQL Server timeout error numbers -2 and 121.
     */
    public static ErrorClassifier withTimeouts() {
        return new TimeoutAwareErrorClassifier(new AzureSqlErrorClassifier(),
                t -> SqlErrors.hasErrorCode(t, TIMEOUT_ERROR_NUMBERS));
    }
}
