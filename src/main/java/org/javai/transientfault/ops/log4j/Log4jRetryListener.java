package org.javai.transientfault.ops.log4j;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;
import org.javai.transientfault.retry.RetryListener;
import org.javai.transientfault.retry.RetryingEvent;

/**
 * Logs retries using Log4j2.
 *
 * <p>Each retry is logged at INFO with the {@code RETRY} marker; exhaustion is logged at WARN
 * with the {@code RETRY_EXHAUSTED} marker, so that appenders and filters can route them
 * separately from application logging.</p>
 */
public class Log4jRetryListener implements RetryListener {

	static final Marker RETRY_MARKER = MarkerManager.getMarker("RETRY");
	static final Marker RETRY_EXHAUSTED_MARKER = MarkerManager.getMarker("RETRY_EXHAUSTED");

	private final String operation;
	private final Logger logger;

	/**
	 * Creates a listener for an unnamed operation using the default logger name.
	 */
	public Log4jRetryListener() {
		this(null, LogManager.getLogger("org.javai.transientfault.Retry"));
	}

	/**
	 * Creates a listener whose messages name the protected operation.
	 *
	 * @param operation the operation name (may be null)
	 */
	public Log4jRetryListener(String operation) {
		this(operation, LogManager.getLogger("org.javai.transientfault.Retry"));
	}

	/**
	 * @param operation the operation name (may be null)
	 * @param logger the Log4j logger to use
	 */
	public Log4jRetryListener(String operation, Logger logger) {
		this.operation = operation;
		this.logger = logger;
	}

	@Override
	public void onRetrying(RetryingEvent event) {
		logger.atInfo()
			.withMarker(RETRY_MARKER)
			.log("Retry {} for operation [{}] in {} ms after transient failure: {}",
				event.currentRetryCount(),
				operationName(),
				event.delay().toMillis(),
				describe(event.lastError()));
	}

	@Override
	public void onRetryExhausted(Throwable lastError, int totalAttempts) {
		logger.atWarn()
			.withMarker(RETRY_EXHAUSTED_MARKER)
			.withThrowable(lastError)
			.log("Retry exhausted for operation [{}] after {} attempts: {}",
				operationName(),
				totalAttempts,
				describe(lastError));
	}

	private String operationName() {
		return operation != null ? operation : "unnamed";
	}

	private static String describe(Throwable error) {
		String message = error.getMessage();
		return message != null
			? error.getClass().getName() + ": " + message
			: error.getClass().getName();
	}
}
