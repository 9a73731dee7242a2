package org.javai.resilience.ops.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.javai.resilience.Failure;
import org.javai.resilience.breaker.CircuitState;
import org.javai.resilience.ops.OpReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;

/**
 * Reports resilience events as JSON-lines metrics via SLF4J.
 *
 * <p>One JSON object per event, suitable for metrics aggregation pipelines.
 * The tracking key is the service name, optionally prefixed by a namespace.</p>
 *
 * <p>Example output:</p>
 * <pre>{@code
 * {"eventType":"retry_attempt","timestamp":"2024-01-20T10:30:00Z","trackingKey":"otel.loki","attemptNumber":1,"delayMs":1000,...}
 * }</pre>
 */
public class MetricsOpReporter implements OpReporter {

	private static final String DEFAULT_LOGGER_NAME = "org.javai.resilience.Metrics";
	private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;
	private static final ObjectMapper MAPPER = new ObjectMapper();

	private final String namespace;
	private final Logger logger;

	/**
	 * Creates a MetricsOpReporter with no namespace and the default logger.
	 */
	public MetricsOpReporter() {
		this(null, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Creates a MetricsOpReporter with the specified namespace and default logger.
	 *
	 * @param namespace the namespace to prepend to tracking keys (may be null or empty)
	 */
	public MetricsOpReporter(String namespace) {
		this(namespace, LoggerFactory.getLogger(DEFAULT_LOGGER_NAME));
	}

	/**
	 * Package-private for testing.
	 */
	MetricsOpReporter(String namespace, Logger logger) {
		this.namespace = normalizeNamespace(namespace);
		this.logger = logger;
	}

	@Override
	public void report(Failure failure) {
		ObjectNode event = baseEvent("failure", failure.occurredAt(), failure.service());
		event.put("code", failure.id().toString());
		event.put("type", failure.type().name());
		event.put("message", failure.message());
		event.put("attempts", failure.attempts());
		emit(event);
	}

	@Override
	public void reportRetryAttempt(Failure failure, int attemptNumber, Duration delay) {
		ObjectNode event = baseEvent("retry_attempt", failure.occurredAt(), failure.service());
		event.put("attemptNumber", attemptNumber);
		event.put("delayMs", delay.toMillis());
		event.put("code", failure.id().toString());
		event.put("type", failure.type().name());
		emit(event);
	}

	@Override
	public void reportRetryExhausted(Failure failure, int totalAttempts) {
		ObjectNode event = baseEvent("retry_exhausted", failure.occurredAt(), failure.service());
		event.put("totalAttempts", totalAttempts);
		event.put("code", failure.rootFailure().id().toString());
		emit(event);
	}

	@Override
	public void reportStateTransition(String service, CircuitState from, CircuitState to) {
		ObjectNode event = baseEvent("state_transition", Instant.now(), service);
		event.put("from", from.wireName());
		event.put("to", to.wireName());
		emit(event);
	}

	String buildTrackingKey(String service) {
		if (namespace == null) {
			return service;
		}
		return namespace + "." + service;
	}

	private ObjectNode baseEvent(String eventType, Instant timestamp, String service) {
		ObjectNode event = MAPPER.createObjectNode();
		event.put("eventType", eventType);
		event.put("timestamp", ISO_FORMATTER.format(timestamp));
		event.put("trackingKey", buildTrackingKey(service));
		return event;
	}

	private void emit(ObjectNode event) {
		try {
			logger.info(MAPPER.writeValueAsString(event));
		} catch (JsonProcessingException e) {
			// Reporting must not break the protected call
			logger.debug("Could not serialize metrics event {}", event.get("eventType"), e);
		}
	}

	private static String normalizeNamespace(String namespace) {
		if (namespace == null || namespace.isBlank()) {
			return null;
		}
		return namespace.trim();
	}
}
