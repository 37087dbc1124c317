package org.javai.transientfault.http;

import org.javai.transientfault.classify.Causes;
import org.javai.transientfault.classify.ErrorClassifier;
import org.javai.transientfault.classify.NetworkConnectivityErrorClassifier;

import java.net.http.HttpTimeoutException;
import java.util.Objects;

/**
 * Transient error detection for HTTP exchanges.
 *
 * <ul>
 *   <li>408 Request Timeout, 502 Bad Gateway, 503 Service Unavailable and 504 Gateway Timeout are transient</li>
 *   <li>500 Internal Server Error is transient only when server errors are included</li>
 *   <li>a client-side {@link HttpTimeoutException} is transient only when timeouts are included</li>
 *   <li>network connectivity failures anywhere in the cause chain are transient</li>
 * </ul>
 */
public class HttpStatusCodeErrorClassifier implements ErrorClassifier {

    private final boolean includeTimeouts;
    private final boolean includeServerErrors;
    private final NetworkConnectivityErrorClassifier network = new NetworkConnectivityErrorClassifier();

    /**
     * Includes timeouts but not server errors.
     */
    public HttpStatusCodeErrorClassifier() {
        this(true, false);
    }

    public HttpStatusCodeErrorClassifier(boolean includeTimeouts, boolean includeServerErrors) {
        this.includeTimeouts = includeTimeouts;
        this.includeServerErrors = includeServerErrors;
    }

    public HttpStatusCodeErrorClassifier(HttpRetryPolicyOptions options) {
        this(Objects.requireNonNull(options, "options must not be null").isIncludeTimeouts(),
                options.isIncludeServerErrors());
    }

    @Override
    public boolean isTransient(Throwable error) {
        if (error == null) {
            return false;
        }
        HttpStatusException status = Causes.find(error, HttpStatusException.class);
        if (status != null) {
            return isTransientStatus(status.statusCode());
        }
        if (includeTimeouts && Causes.find(error, HttpTimeoutException.class) != null) {
            return true;
        }
        return network.isTransient(error);
    }

    /**
     * Returns true if a response with this status code is worth retrying.
     */
    public boolean isTransientStatus(int statusCode) {
        return switch (statusCode) {
            case 408, 502, 503, 504 -> true;
            case 500 -> includeServerErrors;
            default -> false;
        };
    }
}
