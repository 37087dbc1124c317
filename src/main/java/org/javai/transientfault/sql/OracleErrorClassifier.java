package org.javai.transientfault.sql;

import org.javai.transientfault.classify.Causes;
import org.javai.transientfault.classify.ErrorClassifier;
import org.javai.transientfault.classify.TimeoutAwareErrorClassifier;

import java.util.Set;

/**
 * Transient error detection for Oracle Database.
 *
 * <p>There are thousands of ORA error codes; these are the network-level ones worth retrying.</p>
 */
public final class OracleErrorClassifier implements ErrorClassifier {

    private static final Set<Integer> TRANSIENT_ERROR_CODES = Set.of(
            39, 317, 539,
            12150, 12152, 12161, 12200,
            12224,  // no listener
            12225,  // destination host unreachable
            12231, 12233, 12234, 12531,
            12535,  // operation timed out
            12540,  // internal limit restriction exceeded (too many connections)
            12541,  // no listener
            12560,  // protocol adapter error
            12636,  // packet send failed
            12637   // packet receive failed
    );

    private final boolean includeTimeouts;

    /**
     * Creates a classifier that treats timeouts as transient.
     */
    public OracleErrorClassifier() {
        this(true);
    }

    public OracleErrorClassifier(boolean includeTimeouts) {
        this.includeTimeouts = includeTimeouts;
    }

    @Override
    public boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        if (SqlErrors.hasErrorCode(error, TRANSIENT_ERROR_CODES)) {
            return true;
        }
        return includeTimeouts && Causes.anyMatch(error, TimeoutAwareErrorClassifier::isStandardTimeout);
    }
}
