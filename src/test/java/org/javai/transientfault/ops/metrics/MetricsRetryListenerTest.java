package org.javai.transientfault.ops.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.javai.transientfault.retry.RetryingEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Marker;
import org.slf4j.event.Level;
import org.slf4j.helpers.AbstractLogger;
import org.slf4j.helpers.MessageFormatter;

import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MetricsRetryListenerTest {

	private static final Instant NOW = Instant.parse("2024-01-20T10:30:00Z");

	private final ObjectMapper mapper = new ObjectMapper();
	private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
	private List<String> capturedMessages;
	private CapturingLogger capturingLogger;

	@BeforeEach
	void setUp() {
		capturedMessages = new ArrayList<>();
		capturingLogger = new CapturingLogger(capturedMessages);
	}

	@Test
	void onRetrying_emitsRetryAttemptAsJsonLine() throws Exception {
		MetricsRetryListener listener = new MetricsRetryListener("orders", "fetch", capturingLogger, clock);

		listener.onRetrying(new RetryingEvent(2, Duration.ofMillis(1500), new ConnectException("refused")));

		assertThat(capturedMessages).hasSize(1);
		JsonNode json = mapper.readTree(capturedMessages.get(0));
		assertThat(json.get("eventType").asText()).isEqualTo("retry_attempt");
		assertThat(json.get("timestamp").asText()).isEqualTo("2024-01-20T10:30:00Z");
		assertThat(json.get("trackingKey").asText()).isEqualTo("orders.fetch");
		assertThat(json.get("retryCount").asInt()).isEqualTo(2);
		assertThat(json.get("delayMs").asLong()).isEqualTo(1500);
		assertThat(json.get("errorType").asText()).isEqualTo("java.net.ConnectException");
	}

	@Test
	void onRetryExhausted_emitsExhaustedEventWithMessage() throws Exception {
		MetricsRetryListener listener = new MetricsRetryListener(null, "fetch", capturingLogger, clock);

		listener.onRetryExhausted(new ConnectException("refused"), 4);

		JsonNode json = mapper.readTree(capturedMessages.get(0));
		assertThat(json.get("eventType").asText()).isEqualTo("retry_exhausted");
		assertThat(json.get("trackingKey").asText()).isEqualTo("fetch");
		assertThat(json.get("totalAttempts").asInt()).isEqualTo(4);
		assertThat(json.get("message").asText()).isEqualTo("refused");
	}

	@Test
	void onRetryExhausted_withoutMessage_omitsMessageField() throws Exception {
		MetricsRetryListener listener = new MetricsRetryListener(null, "fetch", capturingLogger, clock);

		listener.onRetryExhausted(new IllegalStateException(), 1);

		JsonNode json = mapper.readTree(capturedMessages.get(0));
		assertThat(json.has("message")).isFalse();
		assertThat(json.get("errorType").asText()).isEqualTo("java.lang.IllegalStateException");
	}

	@Test
	void trackingKey_blankNamespace_usesOperationOnly() {
		assertThat(new MetricsRetryListener("  ", "fetch", capturingLogger, clock).trackingKey()).isEqualTo("fetch");
	}

	@Test
	void trackingKey_missingOperation_isUnnamed() {
		assertThat(new MetricsRetryListener("orders", null, capturingLogger, clock).trackingKey())
			.isEqualTo("orders.unnamed");
		assertThat(new MetricsRetryListener(" ").trackingKey()).isEqualTo("unnamed");
	}

	@Test
	void eachEvent_isASingleLine() {
		MetricsRetryListener listener = new MetricsRetryListener("orders", "fetch", capturingLogger, clock);

		listener.onRetrying(new RetryingEvent(1, Duration.ZERO, new ConnectException("line one\nline two")));
		listener.onRetryExhausted(new ConnectException("line one\nline two"), 2);

		assertThat(capturedMessages).hasSize(2).allSatisfy(line -> assertThat(line).doesNotContain("\n"));
	}

	/**
	 * Minimal SLF4J logger that captures formatted messages.
	 */
	private static class CapturingLogger extends AbstractLogger {

		private final List<String> messages;

		CapturingLogger(List<String> messages) {
			this.messages = messages;
			this.name = "capturing";
		}

		@Override
		protected String getFullyQualifiedCallerName() {
			return null;
		}

		@Override
		protected void handleNormalizedLoggingCall(Level level, Marker marker, String messagePattern,
												   Object[] arguments, Throwable throwable) {
			if (level == Level.INFO) {
				messages.add(MessageFormatter.basicArrayFormat(messagePattern, arguments));
			}
		}

		@Override
		public boolean isTraceEnabled() {
			return false;
		}

		@Override
		public boolean isTraceEnabled(Marker marker) {
			return false;
		}

		@Override
		public boolean isDebugEnabled() {
			return false;
		}

		@Override
		public boolean isDebugEnabled(Marker marker) {
			return false;
		}

		@Override
		public boolean isInfoEnabled() {
			return true;
		}

		@Override
		public boolean isInfoEnabled(Marker marker) {
			return true;
		}

		@Override
		public boolean isWarnEnabled() {
			return true;
		}

		@Override
		public boolean isWarnEnabled(Marker marker) {
			return true;
		}

		@Override
		public boolean isErrorEnabled() {
			return true;
		}

		@Override
		public boolean isErrorEnabled(Marker marker) {
			return true;
		}
	}
}
