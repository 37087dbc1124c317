package org.javai.transientfault.sql;

import org.javai.transientfault.classify.ErrorClassifier;

import java.util.Set;

/**
 * Detects the SQL Server "no such host is known" failure (error 11001), which is worth retrying
 * while name resolution recovers or a failover completes.
 */
public class SqlServerNetworkConnectivityErrorClassifier implements ErrorClassifier {

    private static final Set<Integer> HOST_NOT_FOUND = Set.of(11001);

    @Override
    public boolean isTransient(Throwable error) {
        return error != null && SqlErrors.hasErrorCode(error, HOST_NOT_FOUND);
    }
}
