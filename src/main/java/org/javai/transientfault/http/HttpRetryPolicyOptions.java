package org.javai.transientfault.http;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import org.javai.transientfault.strategy.RetryPolicyOptions;

/**
 * Retry options for HTTP clients: the strategy options plus which optional failure kinds are transient.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class HttpRetryPolicyOptions extends RetryPolicyOptions {

    private boolean includeTimeouts = true;
    private boolean includeServerErrors;

    /**
     * Whether client-side request timeouts are retried. Default: true.
     */
    public boolean isIncludeTimeouts() {
        return includeTimeouts;
    }

    public void setIncludeTimeouts(boolean includeTimeouts) {
        this.includeTimeouts = includeTimeouts;
    }

    /**
     * Whether 500 Internal Server Error is retried. Default: false.
     */
    public boolean isIncludeServerErrors() {
        return includeServerErrors;
    }

    public void setIncludeServerErrors(boolean includeServerErrors) {
        this.includeServerErrors = includeServerErrors;
    }
}
