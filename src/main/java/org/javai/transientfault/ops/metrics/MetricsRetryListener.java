package org.javai.transientfault.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.transientfault.retry.RetryListener;
import org.javai.transientfault.retry.RetryingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.format.DateTimeFormatter;

/**
 * Reports retries as JSON-lines metrics via SLF4J.
 *
 * <p>Outputs one JSON object per event, suitable for metrics aggregation pipelines. The
 * tracking key combines an optional namespace with the operation name.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"orders.fetch","retryCount":1,"delayMs":1000,"errorType":"java.net.ConnectException"}
 * {"eventType":"retry_exhausted","timestamp":"2024-01-20T10:30:12Z","trackingKey":"orders.fetch","totalAttempts":4,"errorType":"java.net.ConnectException"}
 * }</pre>
 */
public class MetricsRetryListener implements RetryListener {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.transientfault.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String trackingKey;
	private final Logger logger;
	private final Clock clock;

	/**
	 * Creates a listener for the named operation with the default logger.
	 *
	 * @param operation the operation name used as tracking key
	 */
	public MetricsRetryListener(String operation) {
		this(null, operation, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Creates a listener with a namespace prefix and the default logger.
	 *
	 * @param namespace the namespace to prepend to the tracking key (may be null or empty)
	 * @param operation the operation name
	 */
	public MetricsRetryListener(String namespace, String operation) {
		this(namespace, operation, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME), Clock.systemUTC());
	}

	/**
	 * Package-private for testing.
	 */
	MetricsRetryListener(String namespace, String operation, Logger logger, Clock clock) {
		this.trackingKey = buildTrackingKey(namespace, operation);
		this.logger = logger;
		this.clock = clock;
	}

	@Override
	public void onRetrying(RetryingEvent event) {
		ObjectNode json = newEvent("retry_attempt");
		json.put("retryCount", event.currentRetryCount());
		json.put("delayMs", event.delay().toMillis());
		json.put("errorType", event.lastError().getClass().getName());
		emit(json);
	}

	@Override
	public void onRetryExhausted(Throwable lastError, int totalAttempts) {
		ObjectNode json = newEvent("retry_exhausted");
		json.put("totalAttempts", totalAttempts);
		json.put("errorType", lastError.getClass().getName());
		if (lastError.getMessage() != null) {
			json.put("message", lastError.getMessage());
		}
		emit(json);
	}

	String trackingKey() {
		return trackingKey;
	}

	private ObjectNode newEvent(String eventType) {
		ObjectNode json = MAPPER.createObjectNode();
		json.put("eventType", eventType);
		json.put("timestamp", ISO_FORMATTER.format(clock.instant()));
		json.put("trackingKey", trackingKey);
		return json;
	}

	private void emit(ObjectNode json) {
		try {
			logger.info(MAPPER.writeValueAsString(json));
		} catch (JsonProcessingException e) {
			logger.warn("Could not serialise retry metrics event: {}", e.getMessage());
		}
	}

	private static String buildTrackingKey(String namespace, String operation) {
		String op = operation == null || operation.isBlank() ? "unnamed" : operation.trim();
		if (namespace == null || namespace.isBlank()) {
			return op;
		}
		return namespace.trim() + "." + op;
	}
}
