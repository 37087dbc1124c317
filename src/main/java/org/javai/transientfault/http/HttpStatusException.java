package org.javai.transientfault.http;

import java.io.IOException;
import java.net.http.HttpResponse;
import java.util.Optional;

/**
 * Signals that an HTTP exchange completed with an unsuccessful status code.
 *
 * <p>Carries the response when it was produced by {@link RetryingHttpClient}, so that callers
 * and classifiers can inspect headers or body.</p>
 */
public class HttpStatusException extends IOException {

    private final int statusCode;
    private final transient HttpResponse<?> response;

    public HttpStatusException(int statusCode) {
        this(statusCode, null);
    }

    public HttpStatusException(int statusCode, HttpResponse<?> response) {
        super(message(statusCode, response));
        this.statusCode = statusCode;
        this.response = response;
    }

    public int statusCode() {
        return statusCode;
    }

    /**
     * The response that carried the status code, if known.
     */
    public Optional<HttpResponse<?>> response() {
        return Optional.ofNullable(response);
    }

    private static String message(int statusCode, HttpResponse<?> response) {
        if (response == null) {
            return "HTTP status " + statusCode;
        }
        return "HTTP status " + statusCode + " from " + response.request().method() + " " + response.uri();
    }
}
