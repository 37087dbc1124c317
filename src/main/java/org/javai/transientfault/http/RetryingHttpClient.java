package org.javai.transientfault.http;

import org.javai.transientfault.CancellationToken;
import org.javai.transientfault.retry.RetryPolicy;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Sends HTTP requests through a {@link RetryPolicy}.
 *
 * <p>A response with a status outside 2xx counts as a failed attempt, classified by status code.
 * When the policy stops retrying a status failure, the last response is returned rather than
 * thrown, as a plain {@link HttpClient} would return it. Transport failures that end the
 * retries are thrown.</p>
 *
 * <pre>{@code
 * RetryingHttpClient client = new RetryingHttpClient();
 * HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
 * }</pre>
 */
public class RetryingHttpClient {

	private static final Duration TIMEOUT = Duration.ofSeconds(10);

	private final HttpClient httpClient;
	private final RetryPolicy retryPolicy;

	/**
	 * Creates a client with a 10 second connect timeout and the {@link #defaultRetryPolicy()}.
	 */
	public RetryingHttpClient() {
		this(HttpClient.newBuilder().connectTimeout(TIMEOUT).build(), defaultRetryPolicy());
	}

	/**
	 * Creates a client whose retries follow the options.
	 */
	public RetryingHttpClient(HttpClient httpClient, HttpRetryPolicyOptions options) {
		this(httpClient, new RetryPolicy(new HttpStatusCodeErrorClassifier(options), options));
	}

	public RetryingHttpClient(HttpClient httpClient, RetryPolicy retryPolicy) {
		this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
		this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy must not be null");
	}

	/**
	 * Three retries with exponential backoff between 1 and 10 seconds, classified by
	 * {@link HttpStatusCodeErrorClassifier} with timeouts included.
	 */
	public static RetryPolicy defaultRetryPolicy() {
		return new RetryPolicy(new HttpStatusCodeErrorClassifier(), 3,
				Duration.ofSeconds(1), Duration.ofSeconds(10), Duration.ofSeconds(10));
	}

	public RetryPolicy retryPolicy() {
		return retryPolicy;
	}

	/**
	 * Sends the request, retrying transient failures.
	 *
	 * @return the first successful response, or the last response if retries end on a status failure
	 * @throws IOException if the last attempt failed in transport; an {@link InterruptedIOException}
	 *         with the interrupt flag restored if the thread was interrupted during an exchange
	 */
	public <T> HttpResponse<T> send(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler) throws IOException {
		Objects.requireNonNull(request, "request must not be null");
		Objects.requireNonNull(bodyHandler, "bodyHandler must not be null");
		try {
			return retryPolicy.execute(() -> checkStatus(exchange(request, bodyHandler)));
		} catch (HttpStatusException e) {
			if (e.response().isPresent()) {
				return lastResponse(e);
			}
			throw e;
		}
	}

	/**
	 * Sends the request asynchronously, retrying transient failures.
	 */
	public <T> CompletableFuture<HttpResponse<T>> sendAsync(HttpRequest request,
															HttpResponse.BodyHandler<T> bodyHandler) {
		return sendAsync(request, bodyHandler, CancellationToken.none());
	}

	/**
	 * Sends the request asynchronously, retrying transient failures until the token is cancelled.
	 */
	public <T> CompletableFuture<HttpResponse<T>> sendAsync(HttpRequest request,
															HttpResponse.BodyHandler<T> bodyHandler,
															CancellationToken cancellationToken) {
		Objects.requireNonNull(request, "request must not be null");
		Objects.requireNonNull(bodyHandler, "bodyHandler must not be null");
		return retryPolicy.<HttpResponse<T>>executeAsync(
						() -> httpClient.sendAsync(request, bodyHandler).thenCompose(RetryingHttpClient::completeOnSuccess),
						cancellationToken)
				.exceptionallyCompose(error -> {
					Throwable cause = error instanceof CompletionException && error.getCause() != null
							? error.getCause()
							: error;
					if (cause instanceof HttpStatusException && ((HttpStatusException) cause).response().isPresent()) {
						return CompletableFuture.completedFuture(RetryingHttpClient.<T>lastResponse((HttpStatusException) cause));
					}
					return CompletableFuture.failedFuture(cause);
				});
	}

	private <T> HttpResponse<T> exchange(HttpRequest request, HttpResponse.BodyHandler<T> bodyHandler)
			throws IOException {
		try {
			return httpClient.send(request, bodyHandler);
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			InterruptedIOException interrupted = new InterruptedIOException("Interrupted during HTTP exchange");
			interrupted.initCause(e);
			throw interrupted;
		}
	}

	private static <T> HttpResponse<T> checkStatus(HttpResponse<T> response) throws HttpStatusException {
		if (isSuccess(response.statusCode())) {
			return response;
		}
		throw new HttpStatusException(response.statusCode(), response);
	}

	private static <T> CompletableFuture<HttpResponse<T>> completeOnSuccess(HttpResponse<T> response) {
		if (isSuccess(response.statusCode())) {
			return CompletableFuture.completedFuture(response);
		}
		return CompletableFuture.failedFuture(new HttpStatusException(response.statusCode(), response));
	}

	private static boolean isSuccess(int statusCode) {
		return statusCode >= 200 && statusCode < 300;
	}

	@SuppressWarnings("unchecked")
	private static <T> HttpResponse<T> lastResponse(HttpStatusException e) {
		return (HttpResponse<T>) e.response().orElseThrow();
	}
}
